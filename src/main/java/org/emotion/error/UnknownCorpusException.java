package org.emotion.error;

/** Thrown when a corpus id has no registry entry. */
public final class UnknownCorpusException extends DatasetBuildException {

    private final String corpusId;

    public UnknownCorpusException(String corpusId) {
        super("Corpus " + corpusId + " hasn't been registered");
        this.corpusId = corpusId;
    }

    public String corpusId() {
        return corpusId;
    }
}
