package org.emotion.io.arff;

import org.emotion.io.FormatReader;
import org.emotion.model.Vector;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks the tabular reader for a file by its extension: {@code .bin} is packed, anything
 * else is text.
 */
public final class ArffReaders {

    public static final String PACKED_EXTENSION = ".bin";

    private final PackedArffDecoder decoder;

    /**
     * @param decoder decoder for packed files; may be {@code null} when only text files are read
     */
    public ArffReaders(PackedArffDecoder decoder) {
        this.decoder = decoder;
    }

    public FormatReader<Vector> forPath(Path source) {
        Objects.requireNonNull(source, "source must not be null");
        if (isPacked(source)) {
            if (decoder == null) {
                throw new IllegalStateException("No packed decoder configured for " + source);
            }
            return new PackedArffReader(decoder);
        }
        return new ArffReader();
    }

    public static boolean isPacked(Path source) {
        Path fileName = source.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(PACKED_EXTENSION);
    }
}
