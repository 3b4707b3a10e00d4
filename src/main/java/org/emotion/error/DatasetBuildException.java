package org.emotion.error;

/**
 * Base type for every failure that aborts a dataset build.
 * The core never recovers from these; a batch driver may catch one and skip the whole corpus.
 */
public class DatasetBuildException extends RuntimeException {

    public DatasetBuildException(String message) {
        super(message);
    }

    public DatasetBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
