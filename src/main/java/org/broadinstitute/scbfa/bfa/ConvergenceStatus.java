package org.broadinstitute.scbfa.bfa;

/**
 * Outcome of a convergence check on the binary factor analysis objective.
 */
public enum ConvergenceStatus {
    CONTINUE(false, false, "Status is not determined yet."),
    CONVERGED(true, true, "Success -- converged in relative log-likelihood change tolerance."),
    MAX_ITERATIONS_REACHED(true, false, "Failure -- maximum iterations reached."),
    LOG_LIKELIHOOD_DECREASED(true, false, "Failure -- log likelihood decreased beyond the numerical noise tolerance.");

    private final boolean terminal;
    private final boolean success;
    private final String message;

    ConvergenceStatus(final boolean terminal, final boolean success, final String message) {
        this.terminal = terminal;
        this.success = success;
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Whether the fit should stop.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return success;
    }
}
