package org.broadinstitute.scbfa.utils;

import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import java.util.stream.IntStream;

/**
 * Scalar and matrix helpers for the logistic models fit by this package.
 */
public final class MathUtils {

    private MathUtils() {
    }

    /**
     * Logistic sigmoid, evaluated without overflow for large |x|.
     */
    public static double sigmoid(final double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + FastMath.exp(-x));
        } else {
            final double e = FastMath.exp(x);
            return e / (1.0 + e);
        }
    }

    /**
     * Log-odds of a probability.
     *
     * @param p a probability strictly between 0 and 1.
     * @return any finite double.
     * @throws IllegalArgumentException if {@code p} is not in (0, 1).
     */
    public static double logit(final double p) {
        Utils.validateArg(p > 0 && p < 1, () -> "logit is only defined on (0, 1) but got " + p);
        return FastMath.log(p) - FastMath.log1p(-p);
    }

    /**
     * Computes $\log(1 + e^x)$ avoiding overflow for large x and loss of precision for very negative x.
     */
    public static double log1pExp(final double x) {
        if (x > 0) {
            return x + FastMath.log1p(FastMath.exp(-x));
        } else {
            return FastMath.log1p(FastMath.exp(x));
        }
    }

    /**
     * Log-probability of a binary observation under a Bernoulli with logit {@code eta}.
     *
     * @param y the observation, 0 or 1.
     * @param eta the logit of the success probability.
     * @return a non-positive number.
     */
    public static double bernoulliLogLikelihood(final double y, final double eta) {
        return y * eta - log1pExp(eta);
    }

    public static double mean(final double ... values) {
        Utils.nonNull(values);
        double sum = 0;
        for (final double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Calculates the mean per row from a matrix.
     * @param matrix the input matrix.
     * @return never {@code null}, an array with as many positions as rows in {@code matrix}.
     * @throws IllegalArgumentException if {@code matrix} is {@code null}.
     */
    public static double[] rowMeans(final RealMatrix matrix) {
        Utils.nonNull(matrix);
        return IntStream.range(0, matrix.getRowDimension())
                .mapToDouble(r -> mean(matrix.getRow(r))).toArray();
    }

    /**
     * Sum of the squared entries of a matrix, i.e. its squared Frobenius norm.
     */
    public static double sumOfSquares(final RealMatrix matrix) {
        Utils.nonNull(matrix);
        return matrix.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            private double sum = 0;

            @Override
            public void visit(final int row, final int column, final double value) {
                sum += value * value;
            }

            @Override
            public double end() {
                return sum;
            }
        });
    }
}
