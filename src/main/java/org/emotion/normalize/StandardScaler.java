package org.emotion.normalize;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Zero mean, unit variance per feature dimension, using the population variance.
 * Constant dimensions are centred but not scaled, so they come out as zeros.
 */
public final class StandardScaler implements FeatureScaler {

    @Override
    public double[][] fitTransform(double[][] rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows must not be null");
        }
        double[][] out = new double[rows.length][];
        if (rows.length == 0) {
            return out;
        }

        int dim = rows[0].length;
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != dim) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length + " values, expected " + dim);
            }
            out[i] = new double[dim];
        }

        for (int j = 0; j < dim; j++) {
            for (int i = 0; i < rows.length; i++) {
                column[i] = rows[i][j];
            }
            double mean = StatUtils.mean(column);
            double std = Math.sqrt(StatUtils.populationVariance(column, mean));
            double scale = std == 0.0 ? 1.0 : std;
            for (int i = 0; i < rows.length; i++) {
                out[i][j] = (rows[i][j] - mean) / scale;
            }
        }
        return out;
    }

    @Override
    public String name() {
        return "standard";
    }

    @Override
    public String toString() {
        return name();
    }
}
