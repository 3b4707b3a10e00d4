package org.emotion.io;

import java.util.Locale;

/**
 * Where readers without an embedded label column get their labels from.
 */
public enum LabelSource {
    /** Join a classification annotation file; a missing file or entry is fatal. */
    ANNOTATIONS,
    /** Leave the table unlabelled; labels are decoded from names with the corpus label rule. */
    NAMES;

    public static LabelSource parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("label source must be non-empty");
        }
        return valueOf(raw.strip().toUpperCase(Locale.ROOT));
    }
}
