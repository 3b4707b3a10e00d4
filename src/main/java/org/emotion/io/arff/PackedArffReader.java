package org.emotion.io.arff;

import org.emotion.error.SourceReadException;
import org.emotion.io.FormatReader;
import org.emotion.io.RawTable;
import org.emotion.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a binary-packed attribute-relation file. All byte-level work is done by the
 * {@link PackedArffDecoder}.
 */
public final class PackedArffReader implements FormatReader<Vector> {

    private static final Logger log = LoggerFactory.getLogger(PackedArffReader.class);

    private final PackedArffDecoder decoder;

    public PackedArffReader(PackedArffDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    @Override
    public RawTable<Vector> read(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new SourceReadException(source, "Feature file does not exist");
        }
        ArffRelation relation;
        try (InputStream in = Files.newInputStream(source)) {
            relation = decoder.decode(in.readAllBytes());
        } catch (IOException e) {
            throw new SourceReadException(source, "Failed to decode packed attribute file", e);
        }
        if (relation == null) {
            throw new SourceReadException(source, "Decoder returned no relation");
        }
        log.debug("Decoded relation '{}' with {} rows from {}", relation.relation(), relation.data().size(), source);
        return ArffTables.toRawTable(source, relation);
    }
}
