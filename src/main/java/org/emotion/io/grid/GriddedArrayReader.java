package org.emotion.io.grid;

import org.emotion.error.MissingLabelException;
import org.emotion.error.SourceReadException;
import org.emotion.io.FileNames;
import org.emotion.io.FormatReader;
import org.emotion.io.LabelSource;
import org.emotion.io.RawTable;
import org.emotion.io.annotation.AnnotationFiles;
import org.emotion.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Reads a feature block and its parallel file name list from a gridded-array file.
 *
 * Labels are not stored in the container: they are joined by name from a classification
 * annotation file. The result is sorted by instance name so that it lines up with
 * externally ordered annotation files.
 */
public final class GriddedArrayReader implements FormatReader<Vector> {

    private static final Logger log = LoggerFactory.getLogger(GriddedArrayReader.class);

    public static final String FEATURES_VARIABLE = "features";
    public static final String FILENAME_VARIABLE = "filename";

    private final GriddedArrayOpener opener;
    private final LabelSource labelSource;
    private final Function<Path, Path> annotationLocator;

    /**
     * Labels from {@code labels.csv} two directories above the feature file.
     */
    public GriddedArrayReader(GriddedArrayOpener opener) {
        this(opener, LabelSource.ANNOTATIONS, GriddedArrayReader::defaultAnnotations);
    }

    public GriddedArrayReader(GriddedArrayOpener opener, LabelSource labelSource, Function<Path, Path> annotationLocator) {
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
        this.labelSource = Objects.requireNonNull(labelSource, "labelSource must not be null");
        this.annotationLocator = Objects.requireNonNull(annotationLocator, "annotationLocator must not be null");
    }

    /** {@code <feature dir>/../labels.csv} */
    public static Path defaultAnnotations(Path source) {
        Path dir = source.toAbsolutePath().getParent();
        Path base = dir.getParent() == null ? dir : dir.getParent();
        return base.resolve("labels.csv");
    }

    @Override
    public RawTable<Vector> read(Path source) {
        double[][] features;
        List<String> filenames;
        try (GriddedArrayContainer container = opener.open(source)) {
            features = container.matrix(FEATURES_VARIABLE);
            filenames = container.strings(FILENAME_VARIABLE);
        } catch (IOException e) {
            throw new SourceReadException(source, "Failed to read gridded-array file", e);
        }

        if (features.length != filenames.size()) {
            throw new SourceReadException(source,
                    features.length + " feature rows but " + filenames.size() + " file names");
        }

        List<String> names = new ArrayList<>(filenames.size());
        for (String f : filenames) {
            names.add(FileNames.stem(f));
        }

        List<String> tokens = List.of();
        if (labelSource == LabelSource.ANNOTATIONS) {
            Map<String, String> annotations = AnnotationFiles.classification(annotationLocator.apply(source));
            tokens = new ArrayList<>(names.size());
            for (String name : names) {
                String token = annotations.get(name);
                if (token == null) {
                    throw new MissingLabelException(name);
                }
                tokens.add(token);
            }
        }

        int[] order = IntStream.range(0, names.size())
                .boxed()
                .sorted(Comparator.comparing(names::get))
                .mapToInt(Integer::intValue)
                .toArray();

        List<String> sortedNames = new ArrayList<>(order.length);
        List<Vector> rows = new ArrayList<>(order.length);
        List<String> sortedTokens = new ArrayList<>(tokens.isEmpty() ? 0 : order.length);
        for (int i : order) {
            sortedNames.add(names.get(i));
            rows.add(new Vector(features[i]));
            if (!tokens.isEmpty()) {
                sortedTokens.add(tokens.get(i));
            }
        }

        int dim = features.length == 0 ? 0 : features[0].length;
        List<String> featureNames = new ArrayList<>(dim);
        for (int j = 0; j < dim; j++) {
            featureNames.add("representation_" + (j + 1));
        }

        log.info("{} instances x {} features from {}", sortedNames.size(), dim, source);
        return new RawTable<>(sortedNames, rows, sortedTokens, featureNames, Optional.empty());
    }
}
