package org.broadinstitute.scbfa.bfa;

import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.utils.MathUtils;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Frozen output of a {@link BinaryFactorAnalysis} fit.
 *
 * <p>
 *     With G genes, N cells, K factors, P cell-level covariates and Q gene-level covariates:
 * </p>
 * <ul>
 *     <li>{@link #getEmbedding()} (Z) is N x K, one row per cell;</li>
 *     <li>{@link #getLoadings()} (A) is G x K, one row per gene;</li>
 *     <li>{@link #getCellCovariateCoefficients()} (beta) is P x G;</li>
 *     <li>{@link #getGeneCovariateCoefficients()} (gamma) is Q x N.</li>
 * </ul>
 * <p>
 *     The detection logit is {@code eta = A Z^T + beta^T X^T + W gamma} (G x N). All accessors return copies.
 * </p>
 */
public final class BinaryFactorAnalysisResult {

    private final RealMatrix embedding;
    private final RealMatrix loadings;
    private final RealMatrix cellCovariateCoefficients;
    private final RealMatrix geneCovariateCoefficients;
    private final RealMatrix cellCovariates;
    private final RealMatrix geneCovariates;
    private final double[] logLikelihoodTrace;
    private final double logLikelihood;
    private final ConvergenceStatus status;
    private final List<ConvergenceWarning> warnings;

    BinaryFactorAnalysisResult(final RealMatrix embedding,
                               final RealMatrix loadings,
                               final RealMatrix cellCovariateCoefficients,
                               final RealMatrix geneCovariateCoefficients,
                               final RealMatrix cellCovariates,
                               final RealMatrix geneCovariates,
                               final double[] logLikelihoodTrace,
                               final double logLikelihood,
                               final ConvergenceStatus status,
                               final List<ConvergenceWarning> warnings) {
        this.embedding = Utils.nonNull(embedding);
        this.loadings = Utils.nonNull(loadings);
        this.cellCovariateCoefficients = Utils.nonNull(cellCovariateCoefficients);
        this.geneCovariateCoefficients = Utils.nonNull(geneCovariateCoefficients);
        this.cellCovariates = Utils.nonNull(cellCovariates);
        this.geneCovariates = Utils.nonNull(geneCovariates);
        this.logLikelihoodTrace = Utils.nonNull(logLikelihoodTrace).clone();
        this.logLikelihood = logLikelihood;
        this.status = Utils.nonNull(status);
        Utils.validate(status.isTerminal(), () -> "a result needs a terminal status but got " + status);
        this.warnings = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(warnings)));
    }

    /**
     * Cell embedding Z, N x K.
     */
    public RealMatrix getEmbedding() {
        return embedding.copy();
    }

    /**
     * Gene loadings A, G x K.
     */
    public RealMatrix getLoadings() {
        return loadings.copy();
    }

    /**
     * beta, P x G: effect of each cell-level covariate on the detection logit of each gene.
     */
    public RealMatrix getCellCovariateCoefficients() {
        return cellCovariateCoefficients.copy();
    }

    /**
     * gamma, Q x N: effect of each gene-level covariate on the detection logit in each cell.
     */
    public RealMatrix getGeneCovariateCoefficients() {
        return geneCovariateCoefficients.copy();
    }

    public int getNumFactors() {
        return embedding.getColumnDimension();
    }

    /**
     * Objective value after initialization (index 0) and after every sweep. When the fit used an L2 penalty this
     * is the penalized log likelihood.
     */
    public double[] getLogLikelihoodTrace() {
        return logLikelihoodTrace.clone();
    }

    /**
     * Unpenalized Bernoulli log likelihood of the returned parameters.
     */
    public double getLogLikelihood() {
        return logLikelihood;
    }

    public int getIterations() {
        return logLikelihoodTrace.length - 1;
    }

    public boolean isConverged() {
        return status.isSuccessful();
    }

    public ConvergenceStatus getStatus() {
        return status;
    }

    public List<ConvergenceWarning> getWarnings() {
        return warnings;
    }

    /**
     * Detection logits, G x N.
     */
    public RealMatrix getLinearPredictor() {
        return loadings.multiply(embedding.transpose())
                .add(cellCovariateCoefficients.transpose().multiply(cellCovariates.transpose()))
                .add(geneCovariates.multiply(geneCovariateCoefficients));
    }

    /**
     * Fitted detection probabilities, G x N.
     */
    public RealMatrix getFittedProbabilities() {
        final RealMatrix result = getLinearPredictor();
        result.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(final int row, final int column, final double value) {
                return MathUtils.sigmoid(value);
            }
        });
        return result;
    }
}
