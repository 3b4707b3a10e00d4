package org.emotion.error;

/** An instance from the feature source has no entry in the label annotations. */
public final class MissingLabelException extends DatasetBuildException {

    private final String instanceName;

    public MissingLabelException(String instanceName) {
        super("No label annotation for instance: " + instanceName);
        this.instanceName = instanceName;
    }

    public String instanceName() {
        return instanceName;
    }
}
