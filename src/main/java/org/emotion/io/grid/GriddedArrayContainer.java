package org.emotion.io.grid;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of an open gridded scientific-array file. Holds native resources until closed.
 */
public interface GriddedArrayContainer extends Closeable {

    /** A two-dimensional numeric variable as row-major rows. */
    double[][] matrix(String variable) throws IOException;

    /** A one-dimensional string variable. */
    List<String> strings(String variable) throws IOException;
}
