package org.broadinstitute.scbfa.exceptions;

/**
 * <p/>
 * Class ScBfaException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * numerical breakdowns and "this should never happen" kinds of scenarios.
 */
public class ScBfaException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public ScBfaException( String msg ) {
        super(msg);
    }

    public ScBfaException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of ScBfaException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends ScBfaException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }

    /**
     * <p/>
     * A weighted normal-equation system stayed singular or ill-conditioned after the tolerated ridge regularization
     * was exhausted. The current fit is aborted.
     */
    public static class NumericalInstability extends ScBfaException {
        private static final long serialVersionUID = 0L;

        public NumericalInstability( final String message ) {
            super(message);
        }

        public NumericalInstability( final String message, final Throwable throwable ) {
            super(message, throwable);
        }
    }
}
