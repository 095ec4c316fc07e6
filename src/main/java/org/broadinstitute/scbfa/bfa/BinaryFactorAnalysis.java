package org.broadinstitute.scbfa.bfa;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.scbfa.conf.ScBfaConf;
import org.broadinstitute.scbfa.detection.DetectionMatrix;
import org.broadinstitute.scbfa.detection.DetectionMatrixUtils;
import org.broadinstitute.scbfa.exceptions.ScBfaException;
import org.broadinstitute.scbfa.utils.MathUtils;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.param.ParamUtils;
import org.broadinstitute.scbfa.utils.svd.SVD;
import org.broadinstitute.scbfa.utils.svd.SVDFactory;
import org.broadinstitute.scbfa.utils.svd.SingularValueDecomposer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.IntStream;

/**
 * Binary factor analysis of a genes x cells detection matrix D.
 *
 * <p>
 *     Each entry {@code D[g,n]} is modeled as Bernoulli with success probability {@code sigmoid(eta[g,n])}, where
 * </p>
 * <pre>
 *     eta[g,n] = sum_k Z[n,k] A[g,k] + sum_p X[n,p] beta[p,g] + sum_q W[g,q] gamma[q,n]
 * </pre>
 * <p>
 *     Z (N x K) is the cell embedding, A (G x K) the gene loadings, X (N x P) the cell-level covariates with
 *     gene-specific coefficients beta and W (G x Q) the gene-level covariates with cell-specific coefficients gamma.
 *     X and W default to a single intercept column, so that beta and gamma hold the gene and cell detection offsets.
 * </p>
 * <p>
 *     The penalized log likelihood (Gaussian prior with precision {@code l2Penalty} on every parameter) is maximized
 *     by block coordinate ascent. Each sweep updates every cell's (Z, gamma) row, then every gene's (A, beta) row,
 *     with one step-halved IRLS step per row, and then fixes the gauge of {@code Z A^T} with
 *     {@link GaugeNormalizer}. Rows within a block are independent and may be updated in parallel.
 * </p>
 * <p>
 *     Instances hold only settings and can be shared across threads and fits. Use {@link Builder} to create them.
 * </p>
 */
public final class BinaryFactorAnalysis {

    private static final Logger logger = LogManager.getLogger(BinaryFactorAnalysis.class);

    public enum InitMethod {
        /**
         * Truncated SVD of the row-centered logit of the clipped detection matrix.
         */
        SVD,
        /**
         * Independent Gaussian entries from the seeded random generator.
         */
        RANDOM
    }

    /**
     * States of the block coordinate ascent loop. Transitions out of {@link #CHECK_CONVERGENCE} are decided by
     * the {@link ConvergenceController} alone.
     */
    enum FitState {
        INIT_BLOCK, UPDATE_Z, UPDATE_A, CHECK_CONVERGENCE, DONE
    }

    private final int maxIter;
    private final double tol;
    private final double epsilon;
    private final double l2Penalty;
    private final double clipDelta;
    private final InitMethod initMethod;
    private final double randomInitScale;
    private final long seed;
    private final int maxStepHalvings;
    private final boolean parallelSweeps;
    private final int verboseInterval;
    private final RidgeStabilizedSolver solver;
    private final ConvergenceController convergenceController;
    private final SingularValueDecomposer decomposer;
    private final GaugeNormalizer gaugeNormalizer;

    private BinaryFactorAnalysis(final Builder builder) {
        this.maxIter = builder.maxIter;
        this.tol = builder.tol;
        this.epsilon = builder.epsilon;
        this.l2Penalty = builder.l2Penalty;
        this.clipDelta = builder.clipDelta;
        this.initMethod = builder.initMethod;
        this.randomInitScale = builder.randomInitScale;
        this.seed = builder.seed;
        this.maxStepHalvings = builder.maxStepHalvings;
        this.parallelSweeps = builder.parallelSweeps;
        this.verboseInterval = builder.verboseInterval;
        this.solver = new RidgeStabilizedSolver(builder.ridge, builder.maxRidge, builder.conditionThreshold);
        this.convergenceController = new ConvergenceController(builder.noiseTolerance);
        this.decomposer = builder.decomposer;
        this.gaugeNormalizer = new GaugeNormalizer(decomposer);
    }

    public BinaryFactorAnalysisResult fit(final RealMatrix detections, final int numFactors) {
        return fit(detections, numFactors, null, null);
    }

    public BinaryFactorAnalysisResult fit(final DetectionMatrix detections, final int numFactors) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        return fit(detections.getDetections(), numFactors, null, null);
    }

    public BinaryFactorAnalysisResult fit(final RealMatrix detections, final int numFactors,
                                          final RealMatrix cellCovariates, final RealMatrix geneCovariates) {
        return fit(detections, numFactors, cellCovariates, geneCovariates, maxIter, tol);
    }

    /**
     * Fits the model.
     *
     * @param detections G x N binary matrix without constant rows or columns; not modified.
     * @param numFactors K, in [1, min(G, N)).
     * @param cellCovariates N x P cell-level covariates, or {@code null} for an intercept column.
     * @param geneCovariates G x Q gene-level covariates, or {@code null} for an intercept column.
     * @param maxIter maximum number of sweeps, at least 1.
     * @param tol relative log-likelihood change tolerance, positive.
     * @return never {@code null}. A fit that hits {@code maxIter} is returned with {@code converged = false} and a
     *         {@link ConvergenceWarning}.
     * @throws org.broadinstitute.scbfa.exceptions.UserException.DimensionMismatch if shapes are inconsistent.
     * @throws org.broadinstitute.scbfa.exceptions.UserException.DegenerateInput if D has a constant row or column.
     * @throws ScBfaException.NumericalInstability if a row update cannot be solved even with the maximum ridge.
     */
    public BinaryFactorAnalysisResult fit(final RealMatrix detections, final int numFactors,
                                          final RealMatrix cellCovariates, final RealMatrix geneCovariates,
                                          final int maxIter, final double tol) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        ParamUtils.isPositive(maxIter, "maxIter must be >= 1.");
        ParamUtils.isPositive(tol, "tol must be > 0.");
        final int geneCount = detections.getRowDimension();
        final int cellCount = detections.getColumnDimension();
        DetectionMatrixUtils.validateNumFactors(numFactors, geneCount, cellCount);
        final RealMatrix x = DetectionMatrixUtils.resolveCellCovariates(cellCovariates, cellCount);
        final RealMatrix w = DetectionMatrixUtils.resolveGeneCovariates(geneCovariates, geneCount);
        DetectionMatrixUtils.validateDetectionMatrix(detections);

        logger.info(String.format("Fitting binary factor analysis with %d factors to %d genes x %d cells " +
                        "(%d cell-level and %d gene-level covariates)...",
                numFactors, geneCount, cellCount, x.getColumnDimension(), w.getColumnDimension()));

        final FitWorkspace ws = new FitWorkspace(detections, x, w, numFactors);
        final List<Double> trace = new ArrayList<>();
        final SweepStatistics statistics = new SweepStatistics();
        ConvergenceStatus status = ConvergenceStatus.CONTINUE;
        int iteration = 0;
        FitState state = FitState.INIT_BLOCK;
        while (state != FitState.DONE) {
            switch (state) {
                case INIT_BLOCK:
                    initialize(ws);
                    normalizeGauge(ws);
                    trace.add(objective(ws));
                    showIterationHeader();
                    showIterationInfo(0, trace.get(0), Double.NaN, "initialization: " + initMethod.name());
                    state = FitState.UPDATE_Z;
                    break;
                case UPDATE_Z:
                    statistics.reset();
                    updateCells(ws, statistics);
                    logger.debug(String.format("Iteration %d: cell block updated (%s).", iteration + 1, statistics));
                    state = FitState.UPDATE_A;
                    break;
                case UPDATE_A:
                    updateGenes(ws, statistics);
                    logger.debug(String.format("Iteration %d: gene block updated (%s).", iteration + 1, statistics));
                    normalizeGauge(ws);
                    iteration++;
                    trace.add(objective(ws));
                    state = FitState.CHECK_CONVERGENCE;
                    break;
                case CHECK_CONVERGENCE:
                    final double[] history = toArray(trace);
                    status = convergenceController.evaluate(history, iteration, maxIter, tol);
                    if (iteration % verboseInterval == 0 || status.isTerminal()) {
                        showIterationInfo(iteration, history[iteration],
                                ConvergenceController.relativeChange(history[iteration - 1], history[iteration]),
                                statistics.toString());
                    }
                    if (statistics.ridgedSolves.sum() > 0) {
                        logger.warn(String.format("Iteration %d: %d row updates needed a ridge of up to %.3e to be solved.",
                                iteration, statistics.ridgedSolves.sum(), statistics.maxRidge.get()));
                    }
                    state = status.isTerminal() ? FitState.DONE : FitState.UPDATE_Z;
                    break;
                default:
                    throw new ScBfaException.ShouldNeverReachHereException("Unknown fit state " + state);
            }
        }

        final double[] history = toArray(trace);
        final List<ConvergenceWarning> warnings = new ArrayList<>();
        if (status.isSuccessful()) {
            logger.info(String.format("Fit converged after %d iterations, final log likelihood = %.5f.",
                    iteration, history[iteration]));
        } else {
            final ConvergenceWarning warning = ConvergenceWarning.fromStatus(status, history);
            logger.warn(warning.getMessage());
            warnings.add(warning);
        }
        return ws.toResult(history, logLikelihood(ws), status, warnings);
    }

    private void showIterationHeader() {
        final String header = String.format("%-15s%-25s%-25s%-40s", "Iterations", "Log Likelihood", "Relative Change", "Misc.");
        logger.info(header);
        logger.info(StringUtils.repeat("=", header.length()));
    }

    private void showIterationInfo(final int iteration, final double logLikelihood, final double relativeChange, final String misc) {
        logger.info(String.format("%-15d%-25.10e%-25.6e%-40s", iteration, logLikelihood, relativeChange, misc));
    }

    /**
     * Sets Z and A from {@link #initMethod}; beta and gamma start at zero.
     */
    private void initialize(final FitWorkspace ws) {
        switch (initMethod) {
            case SVD: {
                final double logitHigh = MathUtils.logit(1 - clipDelta);
                final double logitLow = MathUtils.logit(clipDelta);
                final RealMatrix logits = new Array2DRowRealMatrix(ws.geneCount, ws.cellCount);
                for (int g = 0; g < ws.geneCount; g++) {
                    for (int n = 0; n < ws.cellCount; n++) {
                        logits.setEntry(g, n, ws.d[g][n] == 1 ? logitHigh : logitLow);
                    }
                }
                final double[] rowMeans = MathUtils.rowMeans(logits);
                logits.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
                    @Override
                    public double visit(final int gene, final int cell, final double value) {
                        return value - rowMeans[gene];
                    }
                });
                final SVD svd = SVDFactory.createTruncatedSVD(logits, ws.numFactors, decomposer);
                final double[] sqrtS = Arrays.stream(svd.getSingularValues()).map(Math::sqrt).toArray();
                for (int k = 0; k < ws.numFactors; k++) {
                    for (int g = 0; g < ws.geneCount; g++) {
                        ws.a[g][k] = svd.getU().getEntry(g, k) * sqrtS[k];
                    }
                    for (int n = 0; n < ws.cellCount; n++) {
                        ws.z[n][k] = svd.getV().getEntry(n, k) * sqrtS[k];
                    }
                }
                break;
            }
            case RANDOM: {
                final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(seed));
                for (final double[] row : ws.z) {
                    for (int k = 0; k < row.length; k++) {
                        row[k] = randomInitScale * rng.nextGaussian();
                    }
                }
                for (final double[] row : ws.a) {
                    for (int k = 0; k < row.length; k++) {
                        row[k] = randomInitScale * rng.nextGaussian();
                    }
                }
                break;
            }
            default:
                throw new ScBfaException.ShouldNeverReachHereException("An initialization method must be implemented for each InitMethod.");
        }
    }

    /**
     * UPDATE_Z: one IRLS step for each cell's (Z[n,:], gamma[:,n]) with A and beta held fixed.
     */
    private void updateCells(final FitWorkspace ws, final SweepStatistics statistics) {
        final int k = ws.numFactors;
        final int q = ws.geneCovariateCount;
        final double[][] regressors = new double[ws.geneCount][k + q];
        for (int g = 0; g < ws.geneCount; g++) {
            System.arraycopy(ws.a[g], 0, regressors[g], 0, k);
            System.arraycopy(ws.w[g], 0, regressors[g], k, q);
        }
        units(ws.cellCount).forEach(n -> {
            final double[] offsets = new double[ws.geneCount];
            final double[] observations = new double[ws.geneCount];
            for (int g = 0; g < ws.geneCount; g++) {
                offsets[g] = dot(ws.x[n], ws.betaT[g]);
                observations[g] = ws.d[g][n];
            }
            final double[] theta = concat(ws.z[n], ws.gammaT[n]);
            final double[] updated = updateUnit(regressors, offsets, observations, theta, statistics);
            System.arraycopy(updated, 0, ws.z[n], 0, k);
            System.arraycopy(updated, k, ws.gammaT[n], 0, q);
        });
    }

    /**
     * UPDATE_A: one IRLS step for each gene's (A[g,:], beta[:,g]) with Z and gamma held fixed.
     */
    private void updateGenes(final FitWorkspace ws, final SweepStatistics statistics) {
        final int k = ws.numFactors;
        final int p = ws.cellCovariateCount;
        final double[][] regressors = new double[ws.cellCount][k + p];
        for (int n = 0; n < ws.cellCount; n++) {
            System.arraycopy(ws.z[n], 0, regressors[n], 0, k);
            System.arraycopy(ws.x[n], 0, regressors[n], k, p);
        }
        units(ws.geneCount).forEach(g -> {
            final double[] offsets = new double[ws.cellCount];
            for (int n = 0; n < ws.cellCount; n++) {
                offsets[n] = dot(ws.w[g], ws.gammaT[n]);
            }
            final double[] theta = concat(ws.a[g], ws.betaT[g]);
            final double[] updated = updateUnit(regressors, offsets, ws.d[g], theta, statistics);
            System.arraycopy(updated, 0, ws.a[g], 0, k);
            System.arraycopy(updated, k, ws.betaT[g], 0, p);
        });
    }

    private IntStream units(final int count) {
        final IntStream range = IntStream.range(0, count);
        return parallelSweeps ? range.parallel() : range;
    }

    /**
     * One penalized IRLS (Newton) step for a single row of parameters, with step halving.
     *
     * <p>
     *     Working weights are {@code w = p(1 - p) + epsilon} and the working response, net of the fixed offset, is
     *     {@code m . theta + (y - p) / w}. The step solves {@code (M^T W M + l2Penalty I) theta' = M^T W r}.
     *     If the row objective does not improve, the step is halved up to {@link #maxStepHalvings} times; failing
     *     that, the row keeps its current value.
     * </p>
     *
     * @param regressors one row per observation.
     * @param offsets fixed part of the logit per observation.
     * @param observations 0/1 per observation.
     * @param theta current parameters; not modified.
     * @return the new parameters.
     */
    @VisibleForTesting
    double[] updateUnit(final double[][] regressors, final double[] offsets, final double[] observations,
                        final double[] theta, final SweepStatistics statistics) {
        final int dimension = theta.length;
        final double[][] normal = new double[dimension][dimension];
        final double[] rightHandSide = new double[dimension];
        for (int i = 0; i < observations.length; i++) {
            final double[] m = regressors[i];
            final double linear = dot(m, theta);
            final double probability = MathUtils.sigmoid(offsets[i] + linear);
            final double weight = probability * (1 - probability) + epsilon;
            final double workingResponse = linear + (observations[i] - probability) / weight;
            for (int j = 0; j < dimension; j++) {
                final double weighted = weight * m[j];
                rightHandSide[j] += weighted * workingResponse;
                for (int l = 0; l <= j; l++) {
                    normal[j][l] += weighted * m[l];
                }
            }
        }
        for (int j = 0; j < dimension; j++) {
            normal[j][j] += l2Penalty;
            for (int l = 0; l < j; l++) {
                normal[l][j] = normal[j][l];
            }
        }
        final RidgeStabilizedSolver.Solution solution =
                solver.solve(new Array2DRowRealMatrix(normal, false), new ArrayRealVector(rightHandSide, false));
        if (solution.getRidge() > 0) {
            statistics.ridgedSolves.increment();
            statistics.maxRidge.accumulate(solution.getRidge());
        }
        final double[] proposal = solution.getSolution().toArray();

        final double current = unitObjective(regressors, offsets, observations, theta);
        final double[] candidate = new double[dimension];
        double stepSize = 1.0;
        for (int halving = 0; halving <= maxStepHalvings; halving++) {
            for (int j = 0; j < dimension; j++) {
                candidate[j] = theta[j] + stepSize * (proposal[j] - theta[j]);
            }
            if (unitObjective(regressors, offsets, observations, candidate) >= current) {
                if (halving > 0) {
                    statistics.halvedSteps.increment();
                }
                return candidate;
            }
            stepSize *= 0.5;
        }
        statistics.rejectedSteps.increment();
        return theta.clone();
    }

    /**
     * Penalized log likelihood restricted to the observations of one row update.
     */
    private double unitObjective(final double[][] regressors, final double[] offsets, final double[] observations,
                                 final double[] theta) {
        double result = 0;
        for (int i = 0; i < observations.length; i++) {
            result += MathUtils.bernoulliLogLikelihood(observations[i], offsets[i] + dot(regressors[i], theta));
        }
        return result - 0.5 * l2Penalty * dot(theta, theta);
    }

    private void normalizeGauge(final FitWorkspace ws) {
        final Pair<RealMatrix, RealMatrix> normalized = gaugeNormalizer.normalize(
                new Array2DRowRealMatrix(ws.z, false), new Array2DRowRealMatrix(ws.a, false));
        ws.z = normalized.getLeft().getData();
        ws.a = normalized.getRight().getData();
    }

    /**
     * Unpenalized Bernoulli log likelihood of the current parameters.
     */
    private double logLikelihood(final FitWorkspace ws) {
        double result = 0;
        for (int g = 0; g < ws.geneCount; g++) {
            for (int n = 0; n < ws.cellCount; n++) {
                result += MathUtils.bernoulliLogLikelihood(ws.d[g][n], ws.linearPredictor(g, n));
            }
        }
        return result;
    }

    /**
     * The quantity maximized: log likelihood minus the L2 penalty over all parameters.
     */
    private double objective(final FitWorkspace ws) {
        final double squaredNorm = squaredNorm(ws.z) + squaredNorm(ws.a) + squaredNorm(ws.betaT) + squaredNorm(ws.gammaT);
        return logLikelihood(ws) - 0.5 * l2Penalty * squaredNorm;
    }

    private static double squaredNorm(final double[][] values) {
        double result = 0;
        for (final double[] row : values) {
            result += dot(row, row);
        }
        return result;
    }

    private static double dot(final double[] left, final double[] right) {
        double result = 0;
        for (int i = 0; i < left.length; i++) {
            result += left[i] * right[i];
        }
        return result;
    }

    private static double[] concat(final double[] first, final double[] second) {
        final double[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }

    private static double[] toArray(final List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Counters for one sweep; safe to update from parallel row updates.
     */
    static final class SweepStatistics {
        final LongAdder halvedSteps = new LongAdder();
        final LongAdder rejectedSteps = new LongAdder();
        final LongAdder ridgedSolves = new LongAdder();
        final DoubleAccumulator maxRidge = new DoubleAccumulator(Math::max, 0);

        void reset() {
            halvedSteps.reset();
            rejectedSteps.reset();
            ridgedSolves.reset();
            maxRidge.reset();
        }

        @Override
        public String toString() {
            return String.format("halved: %d, rejected: %d", halvedSteps.sum(), rejectedSteps.sum());
        }
    }

    /**
     * Mutable parameter state of a single fit. Matrices are stored row-major by the unit that owns each row:
     * beta transposed to G x P and gamma transposed to N x Q.
     */
    private static final class FitWorkspace {
        final int geneCount;
        final int cellCount;
        final int numFactors;
        final int cellCovariateCount;
        final int geneCovariateCount;
        final double[][] d;
        final double[][] x;
        final double[][] w;
        double[][] z;
        double[][] a;
        final double[][] betaT;
        final double[][] gammaT;

        FitWorkspace(final RealMatrix detections, final RealMatrix cellCovariates, final RealMatrix geneCovariates,
                     final int numFactors) {
            this.geneCount = detections.getRowDimension();
            this.cellCount = detections.getColumnDimension();
            this.numFactors = numFactors;
            this.cellCovariateCount = cellCovariates.getColumnDimension();
            this.geneCovariateCount = geneCovariates.getColumnDimension();
            this.d = detections.getData();
            this.x = cellCovariates.getData();
            this.w = geneCovariates.getData();
            this.z = new double[cellCount][numFactors];
            this.a = new double[geneCount][numFactors];
            this.betaT = new double[geneCount][cellCovariateCount];
            this.gammaT = new double[cellCount][geneCovariateCount];
        }

        double linearPredictor(final int g, final int n) {
            return dot(z[n], a[g]) + dot(x[n], betaT[g]) + dot(w[g], gammaT[n]);
        }

        BinaryFactorAnalysisResult toResult(final double[] trace, final double logLikelihood,
                                            final ConvergenceStatus status, final List<ConvergenceWarning> warnings) {
            return new BinaryFactorAnalysisResult(
                    new Array2DRowRealMatrix(z),
                    new Array2DRowRealMatrix(a),
                    new Array2DRowRealMatrix(betaT).transpose(),
                    new Array2DRowRealMatrix(gammaT).transpose(),
                    new Array2DRowRealMatrix(x),
                    new Array2DRowRealMatrix(w),
                    trace, logLikelihood, status, warnings);
        }
    }

    public static final class Builder {
        private int maxIter = 300;
        private double tol = 1E-6;
        private double epsilon = 1E-6;
        private double ridge = 1E-8;
        private double maxRidge = 1E-2;
        private double conditionThreshold = 1E-12;
        private double l2Penalty = 1.;
        private double clipDelta = 0.1;
        private InitMethod initMethod = InitMethod.SVD;
        private double randomInitScale = 0.1;
        private long seed = 1337;
        private double noiseTolerance = ConvergenceController.DEFAULT_NOISE_TOLERANCE;
        private int maxStepHalvings = 10;
        private boolean parallelSweeps = false;
        private int verboseInterval = 10;
        private SingularValueDecomposer decomposer = SingularValueDecomposer.getDefault();

        public Builder() {
        }

        /**
         * Starts from the values found in a configuration, see {@link ScBfaConf}.
         */
        public Builder(final ScBfaConf conf) {
            Utils.nonNull(conf, "the configuration cannot be null");
            maxIter(conf.getInt(ScBfaConf.MAX_ITERATIONS_KEY));
            tol(conf.getDouble(ScBfaConf.TOLERANCE_KEY));
            epsilon(conf.getDouble(ScBfaConf.EPSILON_KEY));
            ridge(conf.getDouble(ScBfaConf.RIDGE_KEY), conf.getDouble(ScBfaConf.MAX_RIDGE_KEY));
            conditionThreshold(conf.getDouble(ScBfaConf.CONDITION_THRESHOLD_KEY));
            l2Penalty(conf.getDouble(ScBfaConf.L2_PENALTY_KEY));
            clipDelta(conf.getDouble(ScBfaConf.CLIP_DELTA_KEY));
            initMethod(conf.getEnum(ScBfaConf.INIT_METHOD_KEY, InitMethod.class));
            randomInitScale(conf.getDouble(ScBfaConf.RANDOM_INIT_SCALE_KEY));
            seed(conf.getLong(ScBfaConf.SEED_KEY));
            noiseTolerance(conf.getDouble(ScBfaConf.NOISE_TOLERANCE_KEY));
            maxStepHalvings(conf.getInt(ScBfaConf.MAX_STEP_HALVINGS_KEY));
            parallelSweeps(conf.getBoolean(ScBfaConf.PARALLEL_SWEEPS_KEY));
            verboseInterval(conf.getInt(ScBfaConf.VERBOSE_INTERVAL_KEY));
        }

        public Builder maxIter(final int maxIter) {
            Utils.validateArg(maxIter >= 1, "maxIter must be >= 1.");
            this.maxIter = maxIter;
            return this;
        }

        public Builder tol(final double tol) {
            Utils.validateArg(tol > 0., "tol must be > 0.");
            this.tol = tol;
            return this;
        }

        public Builder epsilon(final double epsilon) {
            Utils.validateArg(epsilon > 0., "epsilon must be > 0.");
            this.epsilon = epsilon;
            return this;
        }

        public Builder ridge(final double ridge, final double maxRidge) {
            Utils.validateArg(ridge > 0., "ridge must be > 0.");
            Utils.validateArg(maxRidge >= ridge, "maxRidge must be >= ridge.");
            this.ridge = ridge;
            this.maxRidge = maxRidge;
            return this;
        }

        public Builder conditionThreshold(final double conditionThreshold) {
            Utils.validateArg(conditionThreshold >= 0. && conditionThreshold < 1., "conditionThreshold must be in [0, 1).");
            this.conditionThreshold = conditionThreshold;
            return this;
        }

        public Builder l2Penalty(final double l2Penalty) {
            Utils.validateArg(l2Penalty >= 0., "l2Penalty must be >= 0.");
            this.l2Penalty = l2Penalty;
            return this;
        }

        public Builder clipDelta(final double clipDelta) {
            Utils.validateArg(clipDelta > 0. && clipDelta < 0.5, "clipDelta must be in (0, 0.5).");
            this.clipDelta = clipDelta;
            return this;
        }

        public Builder initMethod(final InitMethod initMethod) {
            this.initMethod = Utils.nonNull(initMethod, "initMethod cannot be null.");
            return this;
        }

        public Builder randomInitScale(final double randomInitScale) {
            Utils.validateArg(randomInitScale > 0., "randomInitScale must be > 0.");
            this.randomInitScale = randomInitScale;
            return this;
        }

        public Builder seed(final long seed) {
            this.seed = seed;
            return this;
        }

        public Builder noiseTolerance(final double noiseTolerance) {
            Utils.validateArg(noiseTolerance >= 0., "noiseTolerance must be >= 0.");
            this.noiseTolerance = noiseTolerance;
            return this;
        }

        public Builder maxStepHalvings(final int maxStepHalvings) {
            Utils.validateArg(maxStepHalvings >= 0, "maxStepHalvings must be >= 0.");
            this.maxStepHalvings = maxStepHalvings;
            return this;
        }

        public Builder parallelSweeps(final boolean parallelSweeps) {
            this.parallelSweeps = parallelSweeps;
            return this;
        }

        public Builder verboseInterval(final int verboseInterval) {
            Utils.validateArg(verboseInterval >= 1, "verboseInterval must be >= 1.");
            this.verboseInterval = verboseInterval;
            return this;
        }

        public Builder decomposer(final SingularValueDecomposer decomposer) {
            this.decomposer = Utils.nonNull(decomposer, "decomposer cannot be null.");
            return this;
        }

        public BinaryFactorAnalysis build() {
            return new BinaryFactorAnalysis(this);
        }
    }
}
