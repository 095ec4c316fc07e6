package org.broadinstitute.scbfa.bfa;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.scbfa.exceptions.ScBfaException;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.param.ParamUtils;

/**
 * Solves symmetric positive (semi-)definite normal equations {@code H x = b} by Cholesky decomposition.
 *
 * <p>
 *     The system is first solved as given. If it is not positive definite, or its reciprocal condition estimate
 *     falls below {@code conditionThreshold}, a ridge {@code r I} is added, starting at {@code initialRidge} and
 *     growing tenfold up to {@code maxRidge}. Past that cap the solve fails with
 *     {@link ScBfaException.NumericalInstability}.
 * </p>
 */
public final class RidgeStabilizedSolver {

    private static final double RELATIVE_SYMMETRY_THRESHOLD = 1E-6;
    private static final double ABSOLUTE_POSITIVITY_THRESHOLD = 1E-14;
    private static final double RIDGE_GROWTH = 10.0;

    private final double initialRidge;
    private final double maxRidge;
    private final double conditionThreshold;

    public RidgeStabilizedSolver(final double initialRidge, final double maxRidge, final double conditionThreshold) {
        this.initialRidge = ParamUtils.isPositive(initialRidge, "the initial ridge must be > 0");
        this.maxRidge = ParamUtils.isPositive(maxRidge, "the maximum ridge must be > 0");
        Utils.validateArg(maxRidge >= initialRidge, "the maximum ridge cannot be smaller than the initial ridge");
        this.conditionThreshold = ParamUtils.inRange(conditionThreshold, 0, 1, "the condition threshold must be in [0, 1]");
    }

    /**
     * A solution together with the ridge that had to be added to reach it (0 if none).
     */
    public static final class Solution {
        private final RealVector solution;
        private final double ridge;

        Solution(final RealVector solution, final double ridge) {
            this.solution = solution;
            this.ridge = ridge;
        }

        public RealVector getSolution() {
            return solution;
        }

        public double getRidge() {
            return ridge;
        }
    }

    public Solution solve(final RealMatrix normalMatrix, final RealVector rightHandSide) {
        Utils.nonNull(normalMatrix, "the normal matrix cannot be null");
        Utils.nonNull(rightHandSide, "the right hand side cannot be null");
        Utils.validateArg(normalMatrix.isSquare() && normalMatrix.getRowDimension() == rightHandSide.getDimension(),
                "the normal matrix must be square and conformant with the right hand side");

        final RealVector unregularized = tryCholesky(normalMatrix, rightHandSide);
        if (unregularized != null) {
            return new Solution(unregularized, 0);
        }
        final int dimension = normalMatrix.getRowDimension();
        for (double ridge = initialRidge; ridge <= maxRidge * (1 + 1e-9); ridge *= RIDGE_GROWTH) {
            final RealVector solution = tryCholesky(normalMatrix.add(MatrixUtils.createRealIdentityMatrix(dimension).scalarMultiply(ridge)), rightHandSide);
            if (solution != null) {
                return new Solution(solution, ridge);
            }
        }
        throw new ScBfaException.NumericalInstability(String.format(
                "The %d x %d weighted normal equations are singular or ill-conditioned even with a ridge of %.3e",
                dimension, dimension, maxRidge));
    }

    /**
     * @return the solution, or {@code null} if the matrix is not numerically positive definite or is too ill-conditioned.
     */
    private RealVector tryCholesky(final RealMatrix matrix, final RealVector rightHandSide) {
        final CholeskyDecomposition cholesky;
        try {
            cholesky = new CholeskyDecomposition(matrix, RELATIVE_SYMMETRY_THRESHOLD, ABSOLUTE_POSITIVITY_THRESHOLD);
        } catch (final NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            return null;
        }
        if (reciprocalConditionEstimate(cholesky.getL()) < conditionThreshold) {
            return null;
        }
        return cholesky.getSolver().solve(rightHandSide);
    }

    /**
     * Cheap estimate of 1 / cond(H) from the diagonal of its Cholesky factor L: (min L_ii / max L_ii)^2.
     */
    static double reciprocalConditionEstimate(final RealMatrix lowerTriangular) {
        double min = Double.POSITIVE_INFINITY;
        double max = 0;
        for (int i = 0; i < lowerTriangular.getRowDimension(); i++) {
            final double diagonal = FastMath.abs(lowerTriangular.getEntry(i, i));
            min = FastMath.min(min, diagonal);
            max = FastMath.max(max, diagonal);
        }
        if (max == 0) {
            return 0;
        }
        final double ratio = min / max;
        return ratio * ratio;
    }
}
