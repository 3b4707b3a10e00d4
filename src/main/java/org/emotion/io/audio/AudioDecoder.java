package org.emotion.io.audio;

import java.io.IOException;
import java.nio.file.Path;

/** Decodes an audio file into mono samples in [-1, 1]. */
@FunctionalInterface
public interface AudioDecoder {

    float[] decode(Path file) throws IOException;
}
