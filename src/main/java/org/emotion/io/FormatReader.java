package org.emotion.io;

import java.nio.file.Path;

/**
 * Turns one on-disk corpus artifact into a {@link RawTable}.
 *
 * Implementations must:
 * - open the source for the duration of the read only, and release it before returning
 * - fail with {@link org.emotion.error.SourceReadException} when the artifact is missing or malformed
 * - fail with {@link org.emotion.error.MissingLabelException} rather than drop unlabelled instances
 */
public interface FormatReader<X> {

    RawTable<X> read(Path source);
}
