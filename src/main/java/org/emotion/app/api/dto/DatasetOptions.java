package org.emotion.app.api.dto;

import org.emotion.io.LabelSource;
import org.emotion.normalize.NormalizationMethod;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * How datasets are built: normalization scope, whether binary label views are added, the
 * padding multiple for sequence datasets (0 = no padding) and where unlabelled formats get
 * their labels.
 */
public record DatasetOptions(NormalizationMethod normalization,
                             boolean binarize,
                             int padMultiple,
                             LabelSource labelSource) {

    public static final String RESOURCE = "dataset.properties";
    public static final String SYSTEM_PREFIX = "emotion.dataset.";

    public DatasetOptions {
        Objects.requireNonNull(normalization, "normalization must not be null");
        Objects.requireNonNull(labelSource, "labelSource must not be null");
        if (padMultiple < 0) {
            throw new IllegalArgumentException("padMultiple must be >= 0");
        }
    }

    /**
     * Classpath defaults from {@value #RESOURCE}, overridden by {@code emotion.dataset.*}
     * system properties.
     */
    public static DatasetOptions load() {
        Properties props = new Properties();
        try (InputStream in = DatasetOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : new String[]{"normalise", "binarise", "pad", "labels"}) {
            String override = System.getProperty(SYSTEM_PREFIX + key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static DatasetOptions fromProperties(Properties props) {
        Objects.requireNonNull(props, "props must not be null");
        String pad = props.getProperty("pad", "0").strip();
        try {
            return new DatasetOptions(
                    NormalizationMethod.parse(props.getProperty("normalise", "speaker")),
                    Boolean.parseBoolean(props.getProperty("binarise", "false").strip()),
                    Integer.parseInt(pad),
                    LabelSource.parse(props.getProperty("labels", "annotations"))
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("pad must be an integer but was '" + pad + "'", e);
        }
    }

    public DatasetOptions withNormalization(NormalizationMethod method) {
        return new DatasetOptions(method, binarize, padMultiple, labelSource);
    }

    public DatasetOptions withBinarize(boolean b) {
        return new DatasetOptions(normalization, b, padMultiple, labelSource);
    }

    public DatasetOptions withPadMultiple(int multiple) {
        return new DatasetOptions(normalization, binarize, multiple, labelSource);
    }

    public DatasetOptions withLabelSource(LabelSource source) {
        return new DatasetOptions(normalization, binarize, padMultiple, source);
    }
}
