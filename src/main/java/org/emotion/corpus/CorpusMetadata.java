package org.emotion.corpus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one corpus: its label vocabulary, speakers and the rules that
 * pull label codes and speaker ids out of instance names.
 *
 * When both gender lists are given, the full speaker list is always male speakers followed
 * by female speakers.
 */
public final class CorpusMetadata {

    private final String id;
    private final Map<String, String> labelMap;
    private final List<String> classes;
    private final EmotionGroups arousal;
    private final EmotionGroups valence;
    private final List<String> maleSpeakers;
    private final List<String> femaleSpeakers;
    private final List<String> speakers;
    private final int[] speakerGroups;
    private final NameRule labelRule;
    private final NameRule speakerRule;

    private CorpusMetadata(Builder b) {
        this.id = requireNonBlank(b.id, "id");
        this.labelMap = b.labelMap == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.labelMap));
        this.classes = List.copyOf(new LinkedHashSet<>(this.labelMap.values()));
        this.arousal = b.arousal;
        this.valence = b.valence;
        this.maleSpeakers = b.maleSpeakers == null ? null : List.copyOf(b.maleSpeakers);
        this.femaleSpeakers = b.femaleSpeakers == null ? null : List.copyOf(b.femaleSpeakers);

        if (maleSpeakers != null && femaleSpeakers != null) {
            List<String> all = new ArrayList<>(maleSpeakers);
            all.addAll(femaleSpeakers);
            this.speakers = List.copyOf(all);
        } else if (b.speakers != null) {
            this.speakers = List.copyOf(b.speakers);
        } else {
            throw new IllegalArgumentException("Corpus " + id + " defines no speakers");
        }

        if (b.speakerGroups != null && b.speakerGroups.length != speakers.size()) {
            throw new IllegalArgumentException(
                    "Corpus " + id + ": speaker group table has " + b.speakerGroups.length
                            + " entries for " + speakers.size() + " speakers"
            );
        }
        this.speakerGroups = b.speakerGroups == null ? null : b.speakerGroups.clone();
        this.labelRule = b.labelRule;
        this.speakerRule = Objects.requireNonNull(b.speakerRule, "speakerRule must not be null");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    /** Label code to canonical label, in declaration order. */
    public Map<String, String> labelMap() {
        return labelMap;
    }

    /** Ordered class vocabulary: unique label map values in first-occurrence order. */
    public List<String> classes() {
        return classes;
    }

    public Optional<EmotionGroups> arousal() {
        return Optional.ofNullable(arousal);
    }

    public Optional<EmotionGroups> valence() {
        return Optional.ofNullable(valence);
    }

    public Optional<List<String>> maleSpeakers() {
        return Optional.ofNullable(maleSpeakers);
    }

    public Optional<List<String>> femaleSpeakers() {
        return Optional.ofNullable(femaleSpeakers);
    }

    public boolean hasGenderSplit() {
        return maleSpeakers != null && femaleSpeakers != null;
    }

    public List<String> speakers() {
        return speakers;
    }

    /**
     * Coarsened group for a speaker index. Identity unless the corpus repeats speakers
     * across sessions under different ids.
     */
    public int speakerGroupOf(int speakerIndex) {
        if (speakerIndex < 0 || speakerIndex >= speakers.size()) {
            throw new IndexOutOfBoundsException("speakerIndex=" + speakerIndex + ", speakers=" + speakers.size());
        }
        return speakerGroups == null ? speakerIndex : speakerGroups[speakerIndex];
    }

    public boolean hasSpeakerGroups() {
        return speakerGroups != null;
    }

    public Optional<NameRule> labelRule() {
        return Optional.ofNullable(labelRule);
    }

    public NameRule speakerRule() {
        return speakerRule;
    }

    public String speakerOf(String name) {
        return speakerRule.apply(name);
    }

    @Override
    public String toString() {
        return "CorpusMetadata(" + id + ", classes=" + classes + ", speakers=" + speakers.size()
                + (speakerGroups == null ? "" : ", groups=" + Arrays.toString(speakerGroups)) + ")";
    }

    private static String requireNonBlank(String s, String what) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException(what + " must be non-empty");
        }
        return s;
    }

    public static final class Builder {
        private final String id;
        private Map<String, String> labelMap;
        private EmotionGroups arousal;
        private EmotionGroups valence;
        private List<String> maleSpeakers;
        private List<String> femaleSpeakers;
        private List<String> speakers;
        private int[] speakerGroups;
        private NameRule labelRule;
        private NameRule speakerRule;

        private Builder(String id) {
            this.id = id;
        }

        public Builder labelMap(Map<String, String> labelMap) {
            this.labelMap = labelMap;
            return this;
        }

        public Builder arousal(EmotionGroups arousal) {
            this.arousal = arousal;
            return this;
        }

        public Builder valence(EmotionGroups valence) {
            this.valence = valence;
            return this;
        }

        public Builder maleSpeakers(List<String> maleSpeakers) {
            this.maleSpeakers = maleSpeakers;
            return this;
        }

        public Builder femaleSpeakers(List<String> femaleSpeakers) {
            this.femaleSpeakers = femaleSpeakers;
            return this;
        }

        public Builder speakers(List<String> speakers) {
            this.speakers = speakers;
            return this;
        }

        public Builder speakerGroups(int... speakerGroups) {
            this.speakerGroups = speakerGroups;
            return this;
        }

        public Builder labelRule(NameRule labelRule) {
            this.labelRule = labelRule;
            return this;
        }

        public Builder speakerRule(NameRule speakerRule) {
            this.speakerRule = speakerRule;
            return this;
        }

        public CorpusMetadata build() {
            return new CorpusMetadata(this);
        }
    }
}
