package org.emotion.sequence;

import org.emotion.model.FrameSequence;

import java.util.List;
import java.util.Objects;

/**
 * Frames regrouped into one sequence per instance, in first-occurrence order.
 */
public record AggregatedSequences(List<FrameSequence> x, int[] y, List<String> names, int[] speakerIndices) {

    public AggregatedSequences {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(speakerIndices, "speakerIndices must not be null");
        x = List.copyOf(x);
        y = y.clone();
        names = List.copyOf(names);
        speakerIndices = speakerIndices.clone();
    }

    @Override
    public int[] y() {
        return y.clone();
    }

    @Override
    public int[] speakerIndices() {
        return speakerIndices.clone();
    }

    public int size() {
        return names.size();
    }
}
