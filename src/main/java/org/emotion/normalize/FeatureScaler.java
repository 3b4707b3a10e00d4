package org.emotion.normalize;

/**
 * Strategy that fits per-dimension statistics on a block of rows and transforms that same block.
 */
public interface FeatureScaler {

    /**
     * @param rows row-major block, all rows the same length; not modified
     * @return a new transformed block of the same shape
     */
    double[][] fitTransform(double[][] rows);

    /**
     * @return a human-readable name (useful for logging).
     */
    String name();
}
