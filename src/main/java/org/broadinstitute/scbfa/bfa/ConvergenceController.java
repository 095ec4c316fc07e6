package org.broadinstitute.scbfa.bfa;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.param.ParamUtils;

/**
 * Decides when the binary factor analysis iterations stop.
 *
 * <p>
 *     The history holds one objective value per state: index 0 is the value right after initialization and index
 *     t the value after sweep t. Checks run in this order:
 * </p>
 * <ol>
 *     <li>a decrease larger than {@code noiseTolerance} times the previous magnitude stops the fit with
 *     {@link ConvergenceStatus#LOG_LIKELIHOOD_DECREASED};</li>
 *     <li>from the second sweep on, a relative improvement below {@code tol} is {@link ConvergenceStatus#CONVERGED};</li>
 *     <li>reaching {@code maxIter} sweeps is {@link ConvergenceStatus#MAX_ITERATIONS_REACHED}.</li>
 * </ol>
 */
public final class ConvergenceController {

    public static final double DEFAULT_NOISE_TOLERANCE = 1e-8;

    private final double noiseTolerance;

    public ConvergenceController() {
        this(DEFAULT_NOISE_TOLERANCE);
    }

    public ConvergenceController(final double noiseTolerance) {
        this.noiseTolerance = ParamUtils.isPositiveOrZero(noiseTolerance, "the noise tolerance must be >= 0");
    }

    public boolean shouldStop(final double[] logLikelihoodHistory, final int iteration, final int maxIter, final double tol) {
        return evaluate(logLikelihoodHistory, iteration, maxIter, tol).isTerminal();
    }

    public ConvergenceStatus evaluate(final double[] logLikelihoodHistory, final int iteration, final int maxIter, final double tol) {
        Utils.nonNull(logLikelihoodHistory, "the log likelihood history cannot be null");
        Utils.validateArg(iteration >= 0 && iteration < logLikelihoodHistory.length,
                () -> String.format("iteration %d has no entry in a history of length %d", iteration, logLikelihoodHistory.length));
        ParamUtils.isPositive(maxIter, "maxIter must be >= 1");
        ParamUtils.isPositive(tol, "tol must be > 0");

        if (iteration >= 1) {
            final double previous = logLikelihoodHistory[iteration - 1];
            final double current = logLikelihoodHistory[iteration];
            final double relativeChange = relativeChange(previous, current);
            if (relativeChange < -noiseTolerance) {
                return ConvergenceStatus.LOG_LIKELIHOOD_DECREASED;
            }
            if (iteration >= 2 && relativeChange < tol) {
                return ConvergenceStatus.CONVERGED;
            }
        }
        return iteration >= maxIter ? ConvergenceStatus.MAX_ITERATIONS_REACHED : ConvergenceStatus.CONTINUE;
    }

    @VisibleForTesting
    static double relativeChange(final double previous, final double current) {
        return (current - previous) / FastMath.max(FastMath.abs(previous), Double.MIN_NORMAL);
    }

    public double getNoiseTolerance() {
        return noiseTolerance;
    }
}
