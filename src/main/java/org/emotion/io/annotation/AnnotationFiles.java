package org.emotion.io.annotation;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.emotion.error.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsers for the annotation CSV files written by the corpus conversion scripts.
 * Both formats have a header row and the instance name in the first column.
 */
public final class AnnotationFiles {

    private static final Logger log = LoggerFactory.getLogger(AnnotationFiles.class);

    private AnnotationFiles() {
    }

    /**
     * Classification annotations: {@code name,label}. Extra columns are ignored; a name
     * listed twice is an error.
     *
     * @return instance name to label token, in file order
     */
    public static Map<String, String> classification(Path file) {
        List<String[]> rows = readRows(file);
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlank(row)) {
                continue;
            }
            if (row.length < 2) {
                throw new SourceReadException(file, "Line " + (i + 1) + " needs a name and a label");
            }
            String name = row[0].strip();
            if (out.putIfAbsent(name, row[1].strip()) != null) {
                throw new SourceReadException(file, "Line " + (i + 1) + " repeats instance " + name);
            }
        }
        log.debug("Read {} classification annotations from {}", out.size(), file);
        return Collections.unmodifiableMap(out);
    }

    /**
     * Regression annotations: {@code name,col1,col2,...} with numeric values.
     *
     * @return instance name to (column name to value), in file order
     */
    public static Map<String, Map<String, Double>> regression(Path file) {
        List<String[]> rows = readRows(file);
        String[] header = rows.get(0);
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlank(row)) {
                continue;
            }
            if (row.length != header.length) {
                throw new SourceReadException(file,
                        "Line " + (i + 1) + " has " + row.length + " columns, header has " + header.length);
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (int c = 1; c < row.length; c++) {
                try {
                    values.put(header[c].strip(), Double.parseDouble(row[c].strip()));
                } catch (NumberFormatException e) {
                    throw new SourceReadException(file,
                            "Non-numeric value '" + row[c] + "' in column " + header[c] + " at line " + (i + 1), e);
                }
            }
            if (out.putIfAbsent(row[0].strip(), Collections.unmodifiableMap(values)) != null) {
                throw new SourceReadException(file, "Line " + (i + 1) + " repeats instance " + row[0].strip());
            }
        }
        log.debug("Read {} regression annotations from {}", out.size(), file);
        return Collections.unmodifiableMap(out);
    }

    private static List<String[]> readRows(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SourceReadException(file, "Annotation file does not exist");
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            List<String[]> rows = csv.readAll();
            if (rows.isEmpty()) {
                throw new SourceReadException(file, "Annotation file has no header");
            }
            return rows;
        } catch (IOException | CsvException e) {
            throw new SourceReadException(file, "Failed to read annotation file", e);
        }
    }

    private static boolean isBlank(String[] row) {
        return row.length == 0 || (row.length == 1 && row[0].isBlank());
    }
}
