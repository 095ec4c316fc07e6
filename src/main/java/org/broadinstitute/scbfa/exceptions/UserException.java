package org.broadinstitute.scbfa.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as inconsistent matrix shapes or
 * detection matrices that carry no information for some gene or cell.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.DimensionMismatch
     * <p/>
     * For shape mismatches among the detection matrix, the covariate matrices and the requested number of factors.
     */
    public static class DimensionMismatch extends UserException {
        private static final long serialVersionUID = 0L;

        public DimensionMismatch(final String message) {
            super(message);
        }

        public DimensionMismatch(final String what, final int expected, final int actual) {
            super(String.format("Dimension mismatch for %s: expected %d but found %d", what, expected, actual));
        }
    }

    /**
     * <p/>
     * Class UserException.DegenerateInput
     * <p/>
     * For detection matrices with a constant (all-zero or all-one) gene row or cell column. Such genes and cells
     * must be filtered out before fitting.
     */
    public static class DegenerateInput extends UserException {
        private static final long serialVersionUID = 0L;

        public DegenerateInput(final String message) {
            super(message);
        }

        public DegenerateInput(final String role, final int index, final int value) {
            super(String.format("The detection matrix %s at index %d is constant (all entries equal %d); " +
                    "remove degenerate genes and cells before fitting", role, index, value));
        }
    }
}
