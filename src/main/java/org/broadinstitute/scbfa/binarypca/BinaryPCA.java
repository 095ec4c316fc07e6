package org.broadinstitute.scbfa.binarypca;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.scbfa.conf.ScBfaConf;
import org.broadinstitute.scbfa.detection.DetectionMatrix;
import org.broadinstitute.scbfa.detection.DetectionMatrixUtils;
import org.broadinstitute.scbfa.exceptions.UserException;
import org.broadinstitute.scbfa.utils.MathUtils;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.svd.SVD;
import org.broadinstitute.scbfa.utils.svd.SVDFactory;
import org.broadinstitute.scbfa.utils.svd.SingularValueDecomposer;

import java.util.Arrays;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 * Principal component analysis of a binary detection matrix.
 *
 * <p>
 *     The genes x cells detection matrix is transposed to cells x genes, transformed entry-wise with a
 *     {@link DetectionTransform} of each gene's detection frequency, centered per gene and, optionally, adjusted for
 *     cell-level covariates by least squares. The cell scores and gene loadings come from a rank-K truncated SVD
 *     of the result.
 * </p>
 * <p>
 *     Component signs are fixed so that the largest-magnitude loading of each component is positive; the fit is
 *     a deterministic function of its inputs.
 * </p>
 */
public final class BinaryPCA {

    private static final Logger logger = LogManager.getLogger(BinaryPCA.class);

    public static final double DEFAULT_MIN_DETECTION_VARIANCE = 1e-8;

    private static final double COVARIATE_SINGULARITY_THRESHOLD = 1e-10;

    private final DetectionTransform transform;
    private final double minDetectionVariance;
    private final SingularValueDecomposer decomposer;

    private BinaryPCA(final Builder builder) {
        this.transform = builder.transform;
        this.minDetectionVariance = builder.minDetectionVariance;
        this.decomposer = builder.decomposer;
    }

    public BinaryPCAResult fit(final RealMatrix detections, final int numComponents) {
        return fit(detections, numComponents, null);
    }

    public BinaryPCAResult fit(final DetectionMatrix detections, final int numComponents) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        return fit(detections.getDetections(), numComponents, null);
    }

    /**
     * @param detections G x N binary matrix without constant rows or columns; not modified.
     * @param numComponents K, in [1, min(G, N)).
     * @param cellCovariates N x P covariates to regress out of the transformed matrix, or {@code null} for none.
     * @return never {@code null}.
     * @throws UserException.DimensionMismatch if shapes are inconsistent, or too few genes are left for K components.
     * @throws UserException.DegenerateInput if D has a constant row or column, or the covariates explain all variance.
     */
    public BinaryPCAResult fit(final RealMatrix detections, final int numComponents, final RealMatrix cellCovariates) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        final int geneCount = detections.getRowDimension();
        final int cellCount = detections.getColumnDimension();
        DetectionMatrixUtils.validateNumFactors(numComponents, geneCount, cellCount);
        final RealMatrix covariates = cellCovariates == null ? null
                : DetectionMatrixUtils.resolveCellCovariates(cellCovariates, cellCount);
        DetectionMatrixUtils.validateDetectionMatrix(detections);

        final double[] frequencies = Arrays.stream(DetectionMatrixUtils.geneDetectionCounts(detections))
                .map(c -> c / cellCount).toArray();
        final int[] keptGenes = IntStream.range(0, geneCount)
                .filter(g -> frequencies[g] * (1 - frequencies[g]) >= minDetectionVariance).toArray();
        final int[] droppedGenes = IntStream.range(0, geneCount)
                .filter(g -> frequencies[g] * (1 - frequencies[g]) < minDetectionVariance).toArray();
        if (droppedGenes.length > 0) {
            logger.warn(String.format("Dropping %d genes with detection variance below %.3e from Binary PCA.",
                    droppedGenes.length, minDetectionVariance));
        }
        if (keptGenes.length <= numComponents) {
            throw new UserException.DimensionMismatch(String.format(
                    "Only %d genes are left after dropping near-constant genes; %d components need more",
                    keptGenes.length, numComponents));
        }

        logger.info(String.format("Computing %d binary principal components of %d genes x %d cells (%s transform)...",
                numComponents, keptGenes.length, cellCount, transform));
        final RealMatrix transformed = new Array2DRowRealMatrix(cellCount, keptGenes.length);
        final double[] keptCenters = new double[keptGenes.length];
        for (int j = 0; j < keptGenes.length; j++) {
            final int g = keptGenes[j];
            final double[] column = new double[cellCount];
            for (int n = 0; n < cellCount; n++) {
                column[n] = transform.apply(detections.getEntry(g, n), frequencies[g]);
            }
            final double center = MathUtils.mean(column);
            for (int n = 0; n < cellCount; n++) {
                column[n] -= center;
            }
            transformed.setColumn(j, column);
            keptCenters[j] = center;
        }
        final RealMatrix adjusted = covariates == null ? transformed : regressOut(transformed, covariates);
        final double totalSquares = MathUtils.sumOfSquares(adjusted);
        if (totalSquares == 0) {
            throw new UserException.DegenerateInput("The cell-level covariates explain all the variation of the detection matrix");
        }

        final SVD svd = SVDFactory.createTruncatedSVD(adjusted, numComponents, decomposer);
        final RealMatrix scores = svd.getU().multiply(
                new Array2DRowRealMatrix(diagonal(svd.getSingularValues()), false));
        final RealMatrix keptLoadings = svd.getV();
        fixSigns(scores, keptLoadings);

        final double inverseDenominator = 1.0 / (cellCount - 1.0);
        final double[] variances = DoubleStream.of(svd.getSingularValues()).map(d -> d * d * inverseDenominator).toArray();
        final double[] varianceRatios = DoubleStream.of(svd.getSingularValues()).map(d -> d * d / totalSquares).toArray();

        final RealMatrix loadings = new Array2DRowRealMatrix(geneCount, numComponents);
        final RealMatrix transformedMatrix = new Array2DRowRealMatrix(cellCount, geneCount);
        final double[] centers = new double[geneCount];
        for (int j = 0; j < keptGenes.length; j++) {
            loadings.setRow(keptGenes[j], keptLoadings.getRow(j));
            transformedMatrix.setColumn(keptGenes[j], adjusted.getColumn(j));
            centers[keptGenes[j]] = keptCenters[j];
        }
        logger.info(String.format("Explained variance ratios: %s", Arrays.toString(varianceRatios)));
        return new BinaryPCAResult(scores, loadings, variances, varianceRatios, centers, transformedMatrix,
                droppedGenes, transform);
    }

    /**
     * Residuals of the least-squares regression of every column of {@code matrix} on {@code covariates}.
     */
    private static RealMatrix regressOut(final RealMatrix matrix, final RealMatrix covariates) {
        Utils.validateArg(covariates.getColumnDimension() < covariates.getRowDimension(),
                "there must be fewer cell-level covariates than cells");
        final RealMatrix coefficients;
        try {
            coefficients = new QRDecomposition(covariates, COVARIATE_SINGULARITY_THRESHOLD).getSolver().solve(matrix);
        } catch (final SingularMatrixException e) {
            throw new UserException("The cell-level covariate matrix is rank deficient", e);
        }
        return matrix.subtract(covariates.multiply(coefficients));
    }

    private static double[][] diagonal(final double[] values) {
        final double[][] result = new double[values.length][values.length];
        for (int i = 0; i < values.length; i++) {
            result[i][i] = values[i];
        }
        return result;
    }

    private static void fixSigns(final RealMatrix scores, final RealMatrix loadings) {
        for (int k = 0; k < loadings.getColumnDimension(); k++) {
            final double[] column = loadings.getColumn(k);
            int argMax = 0;
            for (int g = 1; g < column.length; g++) {
                if (FastMath.abs(column[g]) > FastMath.abs(column[argMax])) {
                    argMax = g;
                }
            }
            if (column[argMax] < 0) {
                loadings.setColumnVector(k, loadings.getColumnVector(k).mapMultiply(-1));
                scores.setColumnVector(k, scores.getColumnVector(k).mapMultiply(-1));
            }
        }
    }

    public DetectionTransform getTransform() {
        return transform;
    }

    public static final class Builder {
        private DetectionTransform transform = DetectionTransform.INVERSE_DETECTION_FREQUENCY;
        private double minDetectionVariance = DEFAULT_MIN_DETECTION_VARIANCE;
        private SingularValueDecomposer decomposer = SingularValueDecomposer.getDefault();

        public Builder() {
        }

        public Builder(final ScBfaConf conf) {
            Utils.nonNull(conf, "the configuration cannot be null");
            transform(conf.getEnum(ScBfaConf.PCA_TRANSFORM_KEY, DetectionTransform.class));
            minDetectionVariance(conf.getDouble(ScBfaConf.PCA_MIN_DETECTION_VARIANCE_KEY));
        }

        public Builder transform(final DetectionTransform transform) {
            this.transform = Utils.nonNull(transform, "transform cannot be null.");
            return this;
        }

        public Builder minDetectionVariance(final double minDetectionVariance) {
            Utils.validateArg(minDetectionVariance >= 0. && minDetectionVariance <= 0.25,
                    "minDetectionVariance must be in [0, 0.25].");
            this.minDetectionVariance = minDetectionVariance;
            return this;
        }

        public Builder decomposer(final SingularValueDecomposer decomposer) {
            this.decomposer = Utils.nonNull(decomposer, "decomposer cannot be null.");
            return this;
        }

        public BinaryPCA build() {
            return new BinaryPCA(this);
        }
    }
}
