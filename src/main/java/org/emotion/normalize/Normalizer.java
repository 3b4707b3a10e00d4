package org.emotion.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies a {@link FeatureScaler} globally or independently within each speaker's rows.
 *
 * Fitting per speaker keeps speaker identity (vocal tract, recording set-up) from dominating
 * the feature distribution. For frame data, pass one speaker index per frame.
 */
public final class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final FeatureScaler scaler;

    public Normalizer() {
        this(new StandardScaler());
    }

    public Normalizer(FeatureScaler scaler) {
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
    }

    /**
     * @param x              row-major features; not modified
     * @param speakerIndices speaker index per row
     * @param nSpeakers      number of speakers; indices must lie in {@code [0, nSpeakers)}
     * @param method         fit scope
     * @return a new normalized matrix
     */
    public double[][] normalize(double[][] x, int[] speakerIndices, int nSpeakers, NormalizationMethod method) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(method, "method must not be null");
        log.debug("Normalising {} rows with {} scaler, method={}", x.length, scaler.name(), method);

        return switch (method) {
            case NONE -> copy(x);
            case ALL -> scaler.fitTransform(x);
            case SPEAKER -> perSpeaker(x, speakerIndices, nSpeakers);
        };
    }

    private double[][] perSpeaker(double[][] x, int[] speakerIndices, int nSpeakers) {
        Objects.requireNonNull(speakerIndices, "speakerIndices must not be null");
        if (speakerIndices.length != x.length) {
            throw new IllegalArgumentException(
                    "speakerIndices (" + speakerIndices.length + ") and rows (" + x.length + ") differ"
            );
        }

        int[] counts = new int[nSpeakers];
        for (int s : speakerIndices) {
            if (s < 0 || s >= nSpeakers) {
                throw new IllegalArgumentException("Speaker index " + s + " out of range [0, " + nSpeakers + ")");
            }
            counts[s]++;
        }

        double[][] out = copy(x);
        for (int sp = 0; sp < nSpeakers; sp++) {
            if (counts[sp] == 0) {
                continue;
            }
            int[] rows = new int[counts[sp]];
            double[][] block = new double[counts[sp]][];
            int k = 0;
            for (int i = 0; i < x.length; i++) {
                if (speakerIndices[i] == sp) {
                    rows[k] = i;
                    block[k++] = x[i];
                }
            }
            double[][] scaled = scaler.fitTransform(block);
            for (int r = 0; r < rows.length; r++) {
                out[rows[r]] = scaled[r];
            }
        }
        return out;
    }

    private static double[][] copy(double[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i].clone();
        }
        return out;
    }
}
