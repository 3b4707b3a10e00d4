package org.emotion.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembled corpus: one payload, one class index and one speaker per instance, plus the
 * derived index and label views.
 *
 * All parallel arrays share the order of {@link #names()}. Accessors hand out copies or
 * unmodifiable views. The only mutation is {@link #padSequences(Dataset, int)}.
 *
 * @param <X> per-instance payload ({@link Vector} or {@link FrameSequence})
 */
public final class Dataset<X> {

    public static final String ALL = "all";
    public static final String MALE = "m";
    public static final String FEMALE = "f";
    public static final String AROUSAL = "arousal";
    public static final String VALENCE = "valence";

    private final String corpus;
    private final List<String> classes;
    private final List<String> featureNames;
    private final List<String> names;
    private final List<X> x;
    private final int[] y;
    private final List<String> speakers;
    private final int[] speakerIndices;
    private final int[] speakerGroupIndices;
    private final Map<String, int[]> genderIndices;
    private final Map<String, int[]> labels;

    Dataset(String corpus,
            List<String> classes,
            List<String> featureNames,
            List<String> names,
            List<X> x,
            int[] y,
            List<String> speakers,
            int[] speakerIndices,
            int[] speakerGroupIndices,
            Map<String, int[]> genderIndices,
            Map<String, int[]> labels) {

        this.corpus = Objects.requireNonNull(corpus, "corpus must not be null");
        this.classes = List.copyOf(classes);
        this.featureNames = List.copyOf(featureNames);
        this.names = List.copyOf(names);
        this.x = new ArrayList<>(x);
        this.y = y.clone();
        this.speakers = List.copyOf(speakers);
        this.speakerIndices = speakerIndices.clone();
        this.speakerGroupIndices = speakerGroupIndices.clone();
        this.genderIndices = Collections.unmodifiableMap(new LinkedHashMap<>(genderIndices));
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));

        int n = this.names.size();
        if (this.x.size() != n || this.y.length != n || this.speakerIndices.length != n
                || this.speakerGroupIndices.length != n) {
            throw new IllegalArgumentException(
                    "Parallel arrays differ in length: names=" + n + ", x=" + this.x.size()
                            + ", y=" + this.y.length + ", speakers=" + this.speakerIndices.length
            );
        }
        if (!this.labels.containsKey(ALL)) {
            throw new IllegalArgumentException("labels must contain '" + ALL + "'");
        }
    }

    /**
     * Same instances and metadata with a replaced payload, e.g. after normalization.
     */
    public <Z> Dataset<Z> withPayload(List<Z> newX) {
        Objects.requireNonNull(newX, "newX must not be null");
        return new Dataset<>(corpus, classes, featureNames, names, newX, y, speakers,
                speakerIndices, speakerGroupIndices, genderIndices, labels);
    }

    /**
     * Post-pads every sequence of {@code dataset} in place to a multiple of {@code multiple}
     * frames. The number of instances does not change.
     */
    public static void padSequences(Dataset<FrameSequence> dataset, int multiple) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        if (multiple < 1) {
            throw new IllegalArgumentException("multiple must be >= 1");
        }
        List<FrameSequence> sequences = dataset.x;
        for (int i = 0; i < sequences.size(); i++) {
            sequences.set(i, sequences.get(i).padTo(multiple));
        }
    }

    public String corpus() {
        return corpus;
    }

    public List<String> classes() {
        return classes;
    }

    public int nClasses() {
        return classes.size();
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int nFeatures() {
        return featureNames.size();
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public List<X> x() {
        return Collections.unmodifiableList(x);
    }

    public X x(int i) {
        return x.get(i);
    }

    public int[] y() {
        return y.clone();
    }

    public int y(int i) {
        return y[i];
    }

    public List<String> speakers() {
        return speakers;
    }

    public int nSpeakers() {
        return speakers.size();
    }

    public int[] speakerIndices() {
        return speakerIndices.clone();
    }

    public int[] speakerGroupIndices() {
        return speakerGroupIndices.clone();
    }

    /** Keys: {@code all}, and {@code m}/{@code f} when the corpus has gender lists. */
    public Map<String, int[]> genderIndices() {
        return copyOf(genderIndices);
    }

    /**
     * Keys: {@code all}; with binarization one key per class index ("0", "1", ...) and
     * {@code arousal}/{@code valence} when the corpus defines them.
     */
    public Map<String, int[]> labels() {
        return copyOf(labels);
    }

    public int[] labels(String view) {
        int[] l = labels.get(view);
        if (l == null) {
            throw new IllegalArgumentException("Unknown label view: " + view + ". Available: " + labels.keySet());
        }
        return l.clone();
    }

    @Override
    public String toString() {
        return "Dataset(" + corpus + ", instances=" + names.size() + ", classes=" + classes.size()
                + ", speakers=" + speakers.size() + ")";
    }

    private static Map<String, int[]> copyOf(Map<String, int[]> m) {
        Map<String, int[]> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(k, v.clone()));
        return Collections.unmodifiableMap(out);
    }
}
