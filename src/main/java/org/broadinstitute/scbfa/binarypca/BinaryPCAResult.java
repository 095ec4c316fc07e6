package org.broadinstitute.scbfa.binarypca;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.broadinstitute.scbfa.utils.Utils;

/**
 * Output of {@link BinaryPCA#fit}.
 *
 * <p>
 *     All matrices are indexed by the genes and cells of the input, including genes dropped for near-zero detection
 *     variance: their loading rows, centers and transformed columns are zero.
 * </p>
 */
public final class BinaryPCAResult {

    private final RealMatrix scores;
    private final RealMatrix loadings;
    private final double[] explainedVariance;
    private final double[] explainedVarianceRatio;
    private final double[] centers;
    private final RealMatrix transformedMatrix;
    private final int[] droppedGenes;
    private final DetectionTransform transform;

    BinaryPCAResult(final RealMatrix scores, final RealMatrix loadings, final double[] explainedVariance,
                    final double[] explainedVarianceRatio, final double[] centers, final RealMatrix transformedMatrix,
                    final int[] droppedGenes, final DetectionTransform transform) {
        this.scores = Utils.nonNull(scores);
        this.loadings = Utils.nonNull(loadings);
        this.explainedVariance = Utils.nonNull(explainedVariance).clone();
        this.explainedVarianceRatio = Utils.nonNull(explainedVarianceRatio).clone();
        this.centers = Utils.nonNull(centers).clone();
        this.transformedMatrix = Utils.nonNull(transformedMatrix);
        this.droppedGenes = Utils.nonNull(droppedGenes).clone();
        this.transform = Utils.nonNull(transform);
    }

    /**
     * Cell scores {@code U_K S_K}, N x K.
     */
    public RealMatrix getScores() {
        return scores.copy();
    }

    /**
     * Gene loadings {@code V_K}, G x K, orthonormal columns.
     */
    public RealMatrix getLoadings() {
        return loadings.copy();
    }

    /**
     * Variance of each component, {@code s_k^2 / (N - 1)}, in decreasing order.
     */
    public double[] getExplainedVariance() {
        return explainedVariance.clone();
    }

    /**
     * Fraction of the total variance of the transformed, centered matrix captured by each component.
     */
    public double[] getExplainedVarianceRatio() {
        return explainedVarianceRatio.clone();
    }

    /**
     * Per-gene means subtracted from the transformed matrix.
     */
    public RealVector getCenters() {
        return new ArrayRealVector(centers);
    }

    /**
     * The transformed, centered (and covariate-adjusted, if covariates were given) N x G matrix that was decomposed.
     */
    public RealMatrix getTransformedMatrix() {
        return transformedMatrix.copy();
    }

    /**
     * Rank-K approximation of {@link #getTransformedMatrix()}, {@code scores * loadings^T}.
     */
    public RealMatrix reconstruct() {
        return scores.multiply(loadings.transpose());
    }

    public int[] getDroppedGenes() {
        return droppedGenes.clone();
    }

    public DetectionTransform getTransform() {
        return transform;
    }

    public int getNumComponents() {
        return scores.getColumnDimension();
    }
}
