package org.emotion.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable fixed-length feature vector of doubles.
 */
public final class Vector {

    private final double[] data;

    /**
     * The input array is copied to keep immutability.
     *
     * @param values raw feature values (must be non-null and non-empty)
     */
    public Vector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    /**
     * @return the vector dimension (number of features).
     */
    public int dim() {
        return data.length;
    }

    /**
     * Returns a copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the value at the given feature index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + data.length);
        }
        return data[index];
    }

    /**
     * Stacks vectors of equal dimension into a row-major matrix.
     */
    public static double[][] toMatrix(List<Vector> rows) {
        double[][] out = new double[rows.size()][];
        int dim = -1;
        for (int i = 0; i < out.length; i++) {
            Vector v = rows.get(i);
            if (dim < 0) {
                dim = v.dim();
            } else if (v.dim() != dim) {
                throw new IllegalArgumentException(
                        "Cannot stack vectors with different dimensions. Expected " + dim + " but got " + v.dim()
                );
            }
            out[i] = v.data.clone();
        }
        return out;
    }

    /**
     * Wraps every row of a matrix as a vector.
     */
    public static List<Vector> fromMatrix(double[][] matrix) {
        List<Vector> out = new ArrayList<>(matrix.length);
        for (double[] row : matrix) {
            out.add(new Vector(row));
        }
        return out;
    }

    @Override
    public String toString() {
        return "Vector(dim=" + data.length + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Vector other = (Vector) obj;
        return Arrays.equals(this.data, other.data);
    }
}
