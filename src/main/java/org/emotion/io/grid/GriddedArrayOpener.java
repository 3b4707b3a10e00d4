package org.emotion.io.grid;

import java.io.IOException;
import java.nio.file.Path;

/** Opens a gridded-array file; the caller owns and closes the container. */
@FunctionalInterface
public interface GriddedArrayOpener {

    GriddedArrayContainer open(Path file) throws IOException;
}
