package org.emotion.model;

import org.emotion.corpus.CorpusMetadata;
import org.emotion.corpus.EmotionGroups;
import org.emotion.corpus.NameRule;
import org.emotion.error.MissingLabelException;
import org.emotion.error.UnknownLabelException;
import org.emotion.error.UnknownSpeakerException;
import org.emotion.io.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds a {@link Dataset} from reader output and the metadata of its corpus.
 *
 * Steps:
 * - label tokens to class indices through the corpus label map
 * - instance names to speaker indices through the corpus speaker rule
 * - speaker groups, gender partition and (optionally) binary label views
 *
 * No I/O happens here; the only side effect is a summary log line.
 */
public final class DatasetAssembler {

    private static final Logger log = LoggerFactory.getLogger(DatasetAssembler.class);

    /**
     * @param table    reader output; when unlabelled, labels are decoded from names with the corpus label rule
     * @param corpus   resolved corpus metadata
     * @param binarize whether to add one-vs-rest and arousal/valence label views
     */
    public <X> Dataset<X> assemble(RawTable<X> table, CorpusMetadata corpus, boolean binarize) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(corpus, "corpus must not be null");

        List<String> tokens = table.isLabelled() ? table.labelTokens() : tokensFromNames(table.names(), corpus);
        int[] y = classIndices(table.names(), tokens, corpus);
        return build(table.names(), table.rows(), y, table.attributeNames(), corpus, binarize);
    }

    /**
     * Builds a dataset from already resolved class indices, re-deriving every speaker-based
     * view from the names. Used when instances are regrouped, e.g. frames into sequences.
     */
    public <X> Dataset<X> build(List<String> names,
                                List<X> x,
                                int[] y,
                                List<String> featureNames,
                                CorpusMetadata corpus,
                                boolean binarize) {

        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        int nClasses = corpus.classes().size();
        for (int i = 0; i < y.length; i++) {
            if (y[i] < 0 || y[i] >= nClasses) {
                throw new IllegalArgumentException("Class index " + y[i] + " out of range for " + names.get(i));
            }
        }

        int n = names.size();
        int[] speakerIndices = speakerIndices(names, corpus);

        int[] groupIndices = new int[n];
        for (int i = 0; i < n; i++) {
            groupIndices[i] = corpus.speakerGroupOf(speakerIndices[i]);
        }

        Map<String, int[]> labels = new LinkedHashMap<>();
        labels.put(Dataset.ALL, y.clone());
        if (binarize) {
            labels.putAll(binaryViews(y, corpus));
        }

        Dataset<X> dataset = new Dataset<>(corpus.id(), corpus.classes(), featureNames, names, x, y,
                corpus.speakers(), speakerIndices, groupIndices, genderIndices(names, corpus), labels);
        logSummary(dataset, corpus);
        return dataset;
    }

    /**
     * Resolves each token through the label map, then indexes the canonical label in the
     * vocabulary. Tokens that are already canonical labels are accepted as-is.
     */
    int[] classIndices(List<String> names, List<String> tokens, CorpusMetadata corpus) {
        Map<String, Integer> classToInt = new HashMap<>();
        List<String> classes = corpus.classes();
        for (int c = 0; c < classes.size(); c++) {
            classToInt.put(classes.get(c), c);
        }

        int[] y = new int[tokens.size()];
        for (int i = 0; i < y.length; i++) {
            String token = tokens.get(i);
            String label = corpus.labelMap().getOrDefault(token, token);
            Integer c = classToInt.get(label);
            if (c == null) {
                throw new UnknownLabelException(corpus.id(), names.get(i), token);
            }
            y[i] = c;
        }
        return y;
    }

    int[] speakerIndices(List<String> names, CorpusMetadata corpus) {
        Map<String, Integer> speakerToInt = new HashMap<>();
        List<String> speakers = corpus.speakers();
        for (int s = 0; s < speakers.size(); s++) {
            speakerToInt.putIfAbsent(speakers.get(s), s);
        }

        int[] out = new int[names.size()];
        for (int i = 0; i < out.length; i++) {
            String name = names.get(i);
            String speaker = speakerOf(name, corpus);
            Integer s = speakerToInt.get(speaker);
            if (s == null) {
                throw new UnknownSpeakerException(corpus.id(), name, speaker);
            }
            out[i] = s;
        }
        return out;
    }

    private static List<String> tokensFromNames(List<String> names, CorpusMetadata corpus) {
        NameRule rule = corpus.labelRule().orElseThrow(() ->
                new MissingLabelException(names.isEmpty() ? "<none>" : names.get(0))
        );
        List<String> tokens = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                tokens.add(rule.apply(name));
            } catch (RuntimeException e) {
                throw new UnknownLabelException(corpus.id(), name, e);
            }
        }
        return tokens;
    }

    /** A rule failure on a malformed name surfaces as {@link UnknownSpeakerException}. */
    private static String speakerOf(String name, CorpusMetadata corpus) {
        try {
            return corpus.speakerOf(name);
        } catch (RuntimeException e) {
            throw new UnknownSpeakerException(corpus.id(), name, e);
        }
    }

    private static Map<String, int[]> genderIndices(List<String> names, CorpusMetadata corpus) {
        Map<String, int[]> out = new LinkedHashMap<>();
        int n = names.size();
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        out.put(Dataset.ALL, all);

        if (corpus.hasGenderSplit()) {
            List<String> male = corpus.maleSpeakers().orElseThrow();
            List<String> female = corpus.femaleSpeakers().orElseThrow();
            List<Integer> m = new ArrayList<>();
            List<Integer> f = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String speaker = corpus.speakerOf(names.get(i));
                if (male.contains(speaker)) {
                    m.add(i);
                } else if (female.contains(speaker)) {
                    f.add(i);
                }
            }
            out.put(Dataset.MALE, m.stream().mapToInt(Integer::intValue).toArray());
            out.put(Dataset.FEMALE, f.stream().mapToInt(Integer::intValue).toArray());
        }
        return out;
    }

    private static Map<String, int[]> binaryViews(int[] y, CorpusMetadata corpus) {
        Map<String, int[]> out = new LinkedHashMap<>();
        List<String> classes = corpus.classes();

        for (int c = 0; c < classes.size(); c++) {
            int[] oneVsRest = new int[y.length];
            for (int i = 0; i < y.length; i++) {
                oneVsRest[i] = y[i] == c ? 1 : 0;
            }
            out.put(Integer.toString(c), oneVsRest);
        }

        if (corpus.arousal().isPresent() && corpus.valence().isPresent()) {
            out.put(Dataset.AROUSAL, affectView(y, classes, corpus.arousal().get(), Dataset.AROUSAL));
            out.put(Dataset.VALENCE, affectView(y, classes, corpus.valence().get(), Dataset.VALENCE));
        }
        return out;
    }

    private static int[] affectView(int[] y, List<String> classes, EmotionGroups groups, String dimension) {
        int[] byClass = new int[classes.size()];
        for (int c = 0; c < classes.size(); c++) {
            String label = classes.get(c);
            byClass[c] = groups.isPositive(label) ? 1 : 0;
            if (!groups.isGrouped(label)) {
                log.debug("Class '{}' is in neither {} group, treating it as negative", label, dimension);
            }
        }
        int[] out = new int[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = byClass[y[i]];
        }
        return out;
    }

    private static void logSummary(Dataset<?> dataset, CorpusMetadata corpus) {
        if (!log.isInfoEnabled()) {
            return;
        }
        Map<String, Integer> perSpeaker = new TreeMap<>();
        for (String name : dataset.names()) {
            perSpeaker.merge(corpus.speakerOf(name), 1, Integer::sum);
        }
        Map<String, Integer> perClass = new LinkedHashMap<>();
        for (String c : dataset.classes()) {
            perClass.put(c, 0);
        }
        for (int label : dataset.y()) {
            perClass.merge(dataset.classes().get(label), 1, Integer::sum);
        }

        log.info("Corpus: {}", dataset.corpus());
        log.info("Classes: {} {}", dataset.nClasses(), dataset.classes());
        log.info("{} speakers, {} instances", dataset.nSpeakers(), dataset.size());
        log.info("Speaker counts: {}", perSpeaker);
        log.info("Class counts: {}", perClass);
    }
}
