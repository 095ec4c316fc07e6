package org.broadinstitute.scbfa.utils.param;

import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.MathUtils;
import org.broadinstitute.scbfa.utils.Utils;

/**
 * Numeric parameter checks. Each returns its input unchanged or throws an {@link IllegalArgumentException} with the
 * given message.
 *
 * NaN fails every check, since any comparison with NaN is false.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * @return {@code value} if it lies in the closed interval {@code [min, max]}.
     */
    public static double inRange(final double value, final double min, final double max, final String message) {
        if (value >= min && value <= max) {
            return value;
        }
        throw new IllegalArgumentException(message);
    }

    public static double isPositiveOrZero(final double value, final String message) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    public static int isPositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    public static double isPositive(final double value, final String message) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Checks that every entry of a covariate or parameter matrix is finite.
     * @throws IllegalArgumentException if {@code matrix} is {@code null} or has an infinite or NaN entry.
     */
    public static RealMatrix isFinite(final RealMatrix matrix, final String message) {
        Utils.nonNull(matrix, message);
        for (int row = 0; row < matrix.getRowDimension(); row++) {
            try {
                MathUtils.checkFinite(matrix.getRow(row));
            } catch (final NotFiniteNumberException e) {
                throw new IllegalArgumentException(String.format("%s (row %d)", message, row), e);
            }
        }
        return matrix;
    }
}
