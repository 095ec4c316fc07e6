package org.broadinstitute.scbfa.bfa;

import org.broadinstitute.scbfa.utils.Utils;

/**
 * A non-fatal problem found while fitting. It is attached to the result and the caller decides whether to accept
 * the estimate.
 */
public final class ConvergenceWarning {

    private final ConvergenceStatus status;
    private final int iteration;
    private final String message;

    public ConvergenceWarning(final ConvergenceStatus status, final int iteration, final String message) {
        this.status = Utils.nonNull(status);
        Utils.validateArg(!status.isSuccessful() && status.isTerminal(), () -> "no warning applies to status " + status);
        this.iteration = iteration;
        this.message = Utils.nonNull(message);
    }

    /**
     * Builds the warning for an unsuccessful terminal status.
     *
     * @param status a terminal, unsuccessful status.
     * @param logLikelihoodHistory objective values, one per completed sweep after the initial one.
     */
    static ConvergenceWarning fromStatus(final ConvergenceStatus status, final double[] logLikelihoodHistory) {
        final int iteration = logLikelihoodHistory.length - 1;
        final double last = logLikelihoodHistory[iteration];
        final double previous = iteration > 0 ? logLikelihoodHistory[iteration - 1] : Double.NaN;
        switch (status) {
            case MAX_ITERATIONS_REACHED:
                return new ConvergenceWarning(status, iteration, String.format(
                        "Fit did not converge after %d iterations, final log likelihood = %.6f, last change = %.6e. " +
                                "Try increasing the maximum number of iterations or the tolerance.",
                        iteration, last, last - previous));
            case LOG_LIKELIHOOD_DECREASED:
                return new ConvergenceWarning(status, iteration, String.format(
                        "Log likelihood decreased from %.6f to %.6f at iteration %d; returning the current estimate.",
                        previous, last, iteration));
            default:
                throw new IllegalArgumentException("no warning applies to status " + status);
        }
    }

    public ConvergenceStatus getStatus() {
        return status;
    }

    public int getIteration() {
        return iteration;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status.name() + "@" + iteration + ": " + message;
    }
}
