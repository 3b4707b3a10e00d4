package org.emotion.io.arff;

import org.emotion.error.SourceReadException;
import org.emotion.io.RawTable;
import org.emotion.model.Vector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a decoded relation onto the tabular layout used by every corpus file:
 * first attribute = instance name, last attribute = label token, the rest = features.
 */
final class ArffTables {

    private ArffTables() {
    }

    static RawTable<Vector> toRawTable(Path source, ArffRelation relation) {
        List<ArffAttribute> attributes = relation.attributes();
        if (attributes.size() < 3) {
            throw new SourceReadException(source,
                    "Expected name, features and label attributes but found " + attributes.size());
        }

        List<String> featureNames = new ArrayList<>(attributes.size() - 2);
        for (ArffAttribute a : attributes.subList(1, attributes.size() - 1)) {
            featureNames.add(a.name());
        }

        List<String> names = new ArrayList<>(relation.data().size());
        List<Vector> rows = new ArrayList<>(relation.data().size());
        List<String> labels = new ArrayList<>(relation.data().size());
        int last = attributes.size() - 1;

        for (int r = 0; r < relation.data().size(); r++) {
            List<Object> row = relation.data().get(r);
            if (row.size() != attributes.size()) {
                throw new SourceReadException(source,
                        "Row " + r + " has " + row.size() + " values, expected " + attributes.size());
            }
            Object name = row.get(0);
            Object label = row.get(last);
            if (name == null || label == null) {
                throw new SourceReadException(source, "Row " + r + " has a missing name or label");
            }

            double[] features = new double[last - 1];
            for (int j = 1; j < last; j++) {
                features[j - 1] = toDouble(source, row.get(j), r, attributes.get(j).name());
            }
            names.add(name.toString());
            rows.add(new Vector(features));
            labels.add(label.toString());
        }

        return new RawTable<>(names, rows, labels, featureNames, Optional.of(relation.relation()));
    }

    private static double toDouble(Path source, Object cell, int row, String attribute) {
        if (cell instanceof Number) {
            return ((Number) cell).doubleValue();
        }
        if (cell == null) {
            throw new SourceReadException(source, "Missing value for " + attribute + " in row " + row);
        }
        try {
            return Double.parseDouble(cell.toString());
        } catch (NumberFormatException e) {
            throw new SourceReadException(source,
                    "Non-numeric value '" + cell + "' for " + attribute + " in row " + row, e);
        }
    }
}
