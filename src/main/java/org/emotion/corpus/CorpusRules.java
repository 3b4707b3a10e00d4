package org.emotion.corpus;

import java.util.Map;
import java.util.Optional;

import static org.emotion.corpus.NameRule.afterLast;
import static org.emotion.corpus.NameRule.charAt;
import static org.emotion.corpus.NameRule.from;
import static org.emotion.corpus.NameRule.group;
import static org.emotion.corpus.NameRule.slice;
import static org.emotion.corpus.NameRule.untilFirst;

/**
 * Dispatch tables from corpus id to the rules that decode its file naming convention.
 * Corpora whose labels only come from annotation files have no label rule.
 */
public final class CorpusRules {

    private static final Map<String, NameRule> LABEL_RULES = Map.ofEntries(
            Map.entry("cafe", charAt(3)),
            Map.entry("demos", slice(-6, -3)),
            Map.entry("emodb", charAt(5)),
            Map.entry("emofilm", slice(2, 5)),
            Map.entry("enterface", slice(-4, -2)),
            Map.entry("iemocap", from(-3)),
            Map.entry("jl", group("^\\w+\\d_([a-z]+)_.*$")),
            Map.entry("msp-improv", charAt(-1)),
            Map.entry("portuguese", group("^\\d+[sp][AB]_([a-z]+)\\d+$")),
            Map.entry("ravdess", slice(6, 8)),
            // "DC_a01" vs "DC_sa01"
            Map.entry("savee", name -> {
                if (name.length() < 5) {
                    throw new IllegalArgumentException("Name too short for a label code: " + name);
                }
                return Character.isDigit(name.charAt(4)) ? name.substring(3, 4) : name.substring(3, 5);
            }),
            Map.entry("shemo", charAt(3)),
            Map.entry("tess", afterLast('_'))
    );

    private static final Map<String, NameRule> SPEAKER_RULES = Map.ofEntries(
            Map.entry("cafe", slice(0, 2)),
            Map.entry("crema-d", slice(0, 4)),
            Map.entry("demos", slice(-9, -7)),
            Map.entry("emodb", slice(0, 2)),
            Map.entry("emofilm", from(-2)),
            Map.entry("enterface", untilFirst('_')),
            Map.entry("iemocap", slice(3, 6)),
            Map.entry("jl", untilFirst('_')),
            Map.entry("msp-improv", slice(5, 8)),
            // speaker letter sits right before the first underscore
            Map.entry("portuguese", name -> {
                int i = name.indexOf('_');
                if (i < 1) {
                    throw new IllegalArgumentException("No speaker letter in name: " + name);
                }
                return name.substring(i - 1, i);
            }),
            Map.entry("ravdess", from(-2)),
            Map.entry("savee", slice(0, 2)),
            Map.entry("semaine", slice(0, 2)),
            Map.entry("shemo", slice(0, 3)),
            Map.entry("smartkom", slice(8, 11)),
            Map.entry("tess", slice(0, 3))
    );

    private CorpusRules() {
    }

    public static Optional<NameRule> labelRule(String corpusId) {
        return Optional.ofNullable(LABEL_RULES.get(corpusId));
    }

    public static Optional<NameRule> speakerRule(String corpusId) {
        return Optional.ofNullable(SPEAKER_RULES.get(corpusId));
    }
}
