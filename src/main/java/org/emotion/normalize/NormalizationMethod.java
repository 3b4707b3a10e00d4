package org.emotion.normalize;

import java.util.Locale;

/** Scope over which the feature scaler is fitted. */
public enum NormalizationMethod {
    /** One fit over every instance. */
    ALL,
    /** An independent fit per speaker. */
    SPEAKER,
    /** Identity. */
    NONE;

    /**
     * Accepts "all", "speaker" and "none" in any case.
     */
    public static NormalizationMethod parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("normalization method must be non-empty");
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "all" -> ALL;
            case "speaker" -> SPEAKER;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unknown normalization method: " + raw);
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
