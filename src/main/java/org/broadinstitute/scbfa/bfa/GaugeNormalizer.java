package org.broadinstitute.scbfa.bfa;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.scbfa.exceptions.UserException;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.svd.SVD;
import org.broadinstitute.scbfa.utils.svd.SingularValueDecomposer;

import java.util.Arrays;

/**
 * Fixes the gauge of the bilinear term {@code Z A^T}.
 *
 * <p>
 *     For any invertible K x K matrix T, {@code (Z T, A T^-T)} gives the same product as {@code (Z, A)}. This class
 *     maps any pair to the balanced factorization
 * </p>
 * <pre>
 *     Z = Uz Sz Vz^T,  A = Ua Sa Va^T,  Sz Vz^T Va Sa = P S Q^T
 *     Z' = Uz P sqrt(S),  A' = Ua Q sqrt(S)
 * </pre>
 * <p>
 *     so that {@code Z' A'^T = Z A^T}, the columns of Z' (and of A') are mutually orthogonal, factors are sorted by
 *     decreasing S, and the entry of largest magnitude in each column of A' is positive. The balanced
 *     factorization minimizes {@code |Z|^2 + |A|^2} over all gauges, so an L2-penalized objective never decreases.
 * </p>
 * <p>
 *     The normalization is a pure function of its arguments: the inputs are not modified.
 * </p>
 */
public final class GaugeNormalizer {

    private final SingularValueDecomposer decomposer;

    public GaugeNormalizer(final SingularValueDecomposer decomposer) {
        this.decomposer = Utils.nonNull(decomposer, "the decomposer cannot be null");
    }

    /**
     * @param embedding N x K matrix Z.
     * @param loadings G x K matrix A.
     * @return the normalized (Z', A'); never {@code null}.
     */
    public Pair<RealMatrix, RealMatrix> normalize(final RealMatrix embedding, final RealMatrix loadings) {
        Utils.nonNull(embedding, "the embedding cannot be null");
        Utils.nonNull(loadings, "the loadings cannot be null");
        final int numFactors = embedding.getColumnDimension();
        if (loadings.getColumnDimension() != numFactors) {
            throw new UserException.DimensionMismatch("loading columns (factors)", numFactors, loadings.getColumnDimension());
        }
        Utils.validateArg(embedding.getRowDimension() >= numFactors && loadings.getRowDimension() >= numFactors,
                "both factor matrices need at least as many rows as factors");

        final SVD svdZ = decomposer.createSVD(embedding);
        final SVD svdA = decomposer.createSVD(loadings);
        final RealMatrix core = MatrixUtils.createRealDiagonalMatrix(svdZ.getSingularValues())
                .multiply(svdZ.getV().transpose())
                .multiply(svdA.getV())
                .multiply(MatrixUtils.createRealDiagonalMatrix(svdA.getSingularValues()));
        final SVD svdCore = decomposer.createSVD(core);
        final RealMatrix sqrtS = MatrixUtils.createRealDiagonalMatrix(
                Arrays.stream(svdCore.getSingularValues()).map(FastMath::sqrt).toArray());

        final RealMatrix newEmbedding = svdZ.getU().multiply(svdCore.getU()).multiply(sqrtS);
        final RealMatrix newLoadings = svdA.getU().multiply(svdCore.getV()).multiply(sqrtS);
        fixSigns(newEmbedding, newLoadings);
        return Pair.of(newEmbedding, newLoadings);
    }

    /**
     * Flips factor columns in place so that the largest-magnitude loading of every factor is positive.
     */
    private static void fixSigns(final RealMatrix embedding, final RealMatrix loadings) {
        for (int k = 0; k < loadings.getColumnDimension(); k++) {
            final double[] column = loadings.getColumn(k);
            int argMax = 0;
            for (int g = 1; g < column.length; g++) {
                if (FastMath.abs(column[g]) > FastMath.abs(column[argMax])) {
                    argMax = g;
                }
            }
            if (column[argMax] < 0) {
                loadings.setColumnVector(k, loadings.getColumnVector(k).mapMultiply(-1));
                embedding.setColumnVector(k, embedding.getColumnVector(k).mapMultiply(-1));
            }
        }
    }
}
