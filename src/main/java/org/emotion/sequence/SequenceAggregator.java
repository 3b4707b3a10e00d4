package org.emotion.sequence;

import org.emotion.model.FrameSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses a frame table (many rows per instance name) into one variable-length sequence
 * per instance.
 *
 * Grouping is stable: output order is the order in which names first appear, and each
 * group is the contiguous block of its total count starting at the group's offset. Frames
 * of one instance are expected to be stored consecutively and to share label and speaker;
 * both are taken from the first frame.
 */
public final class SequenceAggregator {

    private static final Logger log = LoggerFactory.getLogger(SequenceAggregator.class);

    public AggregatedSequences aggregate(double[][] frameX, int[] frameY, List<String> names, int[] speakerIndices) {
        Objects.requireNonNull(frameX, "frameX must not be null");
        Objects.requireNonNull(frameY, "frameY must not be null");
        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(speakerIndices, "speakerIndices must not be null");
        int k = frameX.length;
        if (frameY.length != k || names.size() != k || speakerIndices.length != k) {
            throw new IllegalArgumentException(
                    "Frame arrays differ in length: x=" + k + ", y=" + frameY.length
                            + ", names=" + names.size() + ", speakers=" + speakerIndices.length
            );
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : names) {
            counts.merge(name, 1, Integer::sum);
        }

        int m = counts.size();
        int[] offsets = new int[m + 1];
        List<String> uniqueNames = new ArrayList<>(counts.keySet());
        int j = 0;
        for (int c : counts.values()) {
            offsets[j + 1] = offsets[j] + c;
            j++;
        }

        List<FrameSequence> x = new ArrayList<>(m);
        int[] y = new int[m];
        int[] speakers = new int[m];
        for (int i = 0; i < m; i++) {
            int start = offsets[i];
            x.add(new FrameSequence(Arrays.copyOfRange(frameX, start, offsets[i + 1])));
            y[i] = frameY[start];
            speakers[i] = speakerIndices[start];
        }

        log.info("{} sequences of vectors of size {}", m, k == 0 ? 0 : frameX[0].length);
        return new AggregatedSequences(x, y, uniqueNames, speakers);
    }

    /**
     * Post-pads a sequence with zero frames up to {@code multiple * ceil(length / multiple)}.
     * Already aligned sequences are returned unchanged.
     */
    public static FrameSequence pad(FrameSequence sequence, int multiple) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        return sequence.padTo(multiple);
    }

    public static List<FrameSequence> pad(List<FrameSequence> sequences, int multiple) {
        Objects.requireNonNull(sequences, "sequences must not be null");
        List<FrameSequence> out = new ArrayList<>(sequences.size());
        for (FrameSequence s : sequences) {
            out.add(pad(s, multiple));
        }
        return out;
    }
}
