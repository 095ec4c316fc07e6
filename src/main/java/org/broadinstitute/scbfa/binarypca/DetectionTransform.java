package org.broadinstitute.scbfa.binarypca;

import org.apache.commons.math3.util.FastMath;

import java.util.function.DoubleBinaryOperator;

/**
 * Element-wise transforms applied to a binary detection value y of a gene detected with frequency p before Binary PCA.
 */
public enum DetectionTransform {

    /**
     * {@code y * log(1 / p)}: detections of rare genes weigh more, as in TF-IDF.
     */
    INVERSE_DETECTION_FREQUENCY((y, p) -> y * -FastMath.log(p)),

    /**
     * {@code (y - p) / sqrt(p (1 - p))}: Bernoulli Pearson residual, unit variance per gene.
     */
    PEARSON_RESIDUAL((y, p) -> (y - p) / FastMath.sqrt(p * (1 - p))),

    /**
     * {@code y}; column centering makes this plain PCA of the binary matrix.
     */
    CENTERED((y, p) -> y);

    private final DoubleBinaryOperator function;

    DetectionTransform(final DoubleBinaryOperator function) {
        this.function = function;
    }

    /**
     * @param detection 0 or 1.
     * @param detectionFrequency fraction of cells where the gene is detected, in (0, 1).
     */
    public double apply(final double detection, final double detectionFrequency) {
        return function.applyAsDouble(detection, detectionFrequency);
    }
}
