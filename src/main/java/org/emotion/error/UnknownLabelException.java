package org.emotion.error;

/** A label token is neither a code nor a class of the corpus vocabulary. */
public final class UnknownLabelException extends DatasetBuildException {

    private final String token;

    public UnknownLabelException(String corpus, String instanceName, String token) {
        super("Unknown label '" + token + "' for instance " + instanceName + " in corpus " + corpus);
        this.token = token;
    }

    /** No label code could be decoded from the instance name. */
    public UnknownLabelException(String corpus, String instanceName, Throwable cause) {
        super("Cannot decode a label from instance " + instanceName + " in corpus " + corpus, cause);
        this.token = null;
    }

    /** {@code null} when the name did not yield a label code at all. */
    public String token() {
        return token;
    }
}
