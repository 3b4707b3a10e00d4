package org.emotion.error;

/** The speaker id extracted from an instance name is not in the corpus speaker list. */
public final class UnknownSpeakerException extends DatasetBuildException {

    private final String speakerId;

    public UnknownSpeakerException(String corpus, String instanceName, String speakerId) {
        super("Unknown speaker '" + speakerId + "' for instance " + instanceName + " in corpus " + corpus);
        this.speakerId = speakerId;
    }

    /** No speaker id could be decoded from the instance name. */
    public UnknownSpeakerException(String corpus, String instanceName, Throwable cause) {
        super("Cannot decode a speaker from instance " + instanceName + " in corpus " + corpus, cause);
        this.speakerId = null;
    }

    /** {@code null} when the name did not yield a speaker id at all. */
    public String speakerId() {
        return speakerId;
    }
}
