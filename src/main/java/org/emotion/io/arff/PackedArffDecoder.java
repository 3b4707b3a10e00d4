package org.emotion.io.arff;

import java.io.IOException;

/**
 * Decodes the binary-packed attribute-relation encoding. The byte layout belongs to the
 * implementation; readers only hand over the file contents.
 */
@FunctionalInterface
public interface PackedArffDecoder {

    ArffRelation decode(byte[] bytes) throws IOException;
}
