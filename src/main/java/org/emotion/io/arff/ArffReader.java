package org.emotion.io.arff;

import org.emotion.error.SourceReadException;
import org.emotion.io.FormatReader;
import org.emotion.io.RawTable;
import org.emotion.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a text attribute-relation file. The relation name is reported as the corpus id.
 */
public final class ArffReader implements FormatReader<Vector> {

    private static final Logger log = LoggerFactory.getLogger(ArffReader.class);

    private final ArffParser parser = new ArffParser();

    @Override
    public RawTable<Vector> read(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new SourceReadException(source, "Feature file does not exist");
        }
        ArffRelation relation;
        try (Reader in = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            relation = parser.parse(in);
        } catch (IOException e) {
            throw new SourceReadException(source, "Failed to read attribute file", e);
        } catch (ArffParser.ArffFormatException e) {
            throw new SourceReadException(source, "Malformed attribute file (" + e.getMessage() + ")", e);
        }
        log.debug("Read relation '{}' with {} rows from {}", relation.relation(), relation.data().size(), source);
        return ArffTables.toRawTable(source, relation);
    }
}
