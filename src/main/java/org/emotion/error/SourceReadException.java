package org.emotion.error;

import java.nio.file.Path;

/** A source artifact is missing, unreadable or malformed. */
public final class SourceReadException extends DatasetBuildException {

    private final Path source;

    public SourceReadException(Path source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public SourceReadException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
