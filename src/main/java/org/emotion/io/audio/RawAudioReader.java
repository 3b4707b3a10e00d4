package org.emotion.io.audio;

import org.emotion.error.MissingLabelException;
import org.emotion.error.SourceReadException;
import org.emotion.io.FileNames;
import org.emotion.io.FormatReader;
import org.emotion.io.LabelSource;
import org.emotion.io.RawTable;
import org.emotion.io.annotation.AnnotationFiles;
import org.emotion.model.FrameSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a newline-delimited list of audio files. Each file becomes one instance named by its
 * stem, with the waveform as an {@code (n_samples, 1)} sequence and no other processing.
 *
 * Labels come from {@code labels.txt} next to the list, keyed by stem. Relative paths in the
 * list are resolved against the working directory.
 */
public final class RawAudioReader implements FormatReader<FrameSequence> {

    private static final Logger log = LoggerFactory.getLogger(RawAudioReader.class);

    public static final String ANNOTATION_FILE = "labels.txt";

    private final AudioDecoder decoder;
    private final LabelSource labelSource;

    public RawAudioReader() {
        this(new WavAudioDecoder(), LabelSource.ANNOTATIONS);
    }

    public RawAudioReader(AudioDecoder decoder, LabelSource labelSource) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.labelSource = Objects.requireNonNull(labelSource, "labelSource must not be null");
    }

    @Override
    public RawTable<FrameSequence> read(Path fileList) {
        List<String> paths = readList(fileList);

        Map<String, String> annotations = labelSource == LabelSource.ANNOTATIONS
                ? AnnotationFiles.classification(annotationsFor(fileList))
                : Map.of();

        List<String> names = new ArrayList<>(paths.size());
        List<FrameSequence> rows = new ArrayList<>(paths.size());
        List<String> tokens = new ArrayList<>();

        for (String p : paths) {
            String name = FileNames.stem(p);
            if (labelSource == LabelSource.ANNOTATIONS) {
                String token = annotations.get(name);
                if (token == null) {
                    throw new MissingLabelException(name);
                }
                tokens.add(token);
            }

            Path audio = Path.of(p);
            float[] samples;
            try {
                samples = decoder.decode(audio);
            } catch (IOException e) {
                throw new SourceReadException(audio, "Failed to decode audio", e);
            }
            if (samples.length == 0) {
                throw new SourceReadException(audio, "Audio file has no samples");
            }
            names.add(name);
            rows.add(FrameSequence.ofSamples(samples));
            log.debug("Decoded {} samples from {}", samples.length, audio);
        }

        log.info("{} audio files", names.size());
        return new RawTable<>(names, rows, tokens, List.of("pcm"), Optional.empty());
    }

    public static Path annotationsFor(Path fileList) {
        Path dir = fileList.toAbsolutePath().getParent();
        return dir.resolve(ANNOTATION_FILE);
    }

    private static List<String> readList(Path fileList) {
        if (!Files.isRegularFile(fileList)) {
            throw new SourceReadException(fileList, "File list does not exist");
        }
        List<String> out = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(fileList, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String s = line.strip();
                if (!s.isEmpty()) {
                    out.add(s);
                }
            }
        } catch (IOException e) {
            throw new SourceReadException(fileList, "Failed to read file list", e);
        }
        return out;
    }
}
