package org.emotion.model;

import java.util.Arrays;

/**
 * An immutable, non-empty sequence of equal-length frames.
 *
 * Used both for per-frame feature sequences and for raw waveforms, which are stored as
 * {@code (n_samples, 1)}.
 */
public final class FrameSequence {

    private final double[][] frames;
    private final int dim;

    /**
     * @param frames row-major frames, copied (must be non-empty and rectangular)
     */
    public FrameSequence(double[][] frames) {
        if (frames == null) {
            throw new IllegalArgumentException("frames must not be null");
        }
        if (frames.length == 0) {
            throw new IllegalArgumentException("a sequence needs at least one frame");
        }
        int d = frames[0].length;
        if (d == 0) {
            throw new IllegalArgumentException("frames must not be empty");
        }
        double[][] copy = new double[frames.length][];
        for (int i = 0; i < frames.length; i++) {
            if (frames[i].length != d) {
                throw new IllegalArgumentException(
                        "Frame " + i + " has " + frames[i].length + " values, expected " + d
                );
            }
            copy[i] = frames[i].clone();
        }
        this.frames = copy;
        this.dim = d;
    }

    /** A single-channel sequence, one frame per sample. */
    public static FrameSequence ofSamples(float[] samples) {
        double[][] frames = new double[samples.length][1];
        for (int i = 0; i < samples.length; i++) {
            frames[i][0] = samples[i];
        }
        return new FrameSequence(frames);
    }

    /** Number of frames. */
    public int length() {
        return frames.length;
    }

    /** Values per frame. */
    public int dim() {
        return dim;
    }

    public double get(int frame, int index) {
        return frames[frame][index];
    }

    public Vector frame(int i) {
        return new Vector(frames[i]);
    }

    public double[][] toArrayCopy() {
        double[][] out = new double[frames.length][];
        for (int i = 0; i < frames.length; i++) {
            out[i] = frames[i].clone();
        }
        return out;
    }

    /**
     * Appends zero frames so the length becomes the next multiple of {@code multiple}.
     * Returns {@code this} when the length is already a multiple.
     */
    public FrameSequence padTo(int multiple) {
        if (multiple < 1) {
            throw new IllegalArgumentException("multiple must be >= 1");
        }
        int target = (int) Math.ceil(frames.length / (double) multiple) * multiple;
        if (target == frames.length) {
            return this;
        }
        double[][] padded = Arrays.copyOf(toArrayCopy(), target);
        for (int i = frames.length; i < target; i++) {
            padded[i] = new double[dim];
        }
        return new FrameSequence(padded);
    }

    @Override
    public String toString() {
        return "FrameSequence(length=" + frames.length + ", dim=" + dim + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(frames);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        FrameSequence other = (FrameSequence) obj;
        return Arrays.deepEquals(this.frames, other.frames);
    }
}
