package org.emotion.corpus;

import java.util.List;
import java.util.Objects;

/**
 * Splits canonical emotion labels into a positive and a negative pole of one affective
 * dimension (arousal or valence).
 */
public record EmotionGroups(List<String> positive, List<String> negative) {

    public EmotionGroups {
        Objects.requireNonNull(positive, "positive must not be null");
        Objects.requireNonNull(negative, "negative must not be null");
        positive = List.copyOf(positive);
        negative = List.copyOf(negative);
    }

    /** Labels in neither list count as negative. */
    public boolean isPositive(String label) {
        return positive.contains(label);
    }

    public boolean isGrouped(String label) {
        return positive.contains(label) || negative.contains(label);
    }
}
