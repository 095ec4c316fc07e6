package org.broadinstitute.scbfa.binarypca;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.broadinstitute.scbfa.ScBfaBaseTest;
import org.broadinstitute.scbfa.conf.ScBfaConf;
import org.broadinstitute.scbfa.conf.ScBfaConfBuilder;
import org.broadinstitute.scbfa.detection.DetectionMatrix;
import org.broadinstitute.scbfa.exceptions.UserException;
import org.broadinstitute.scbfa.fakedata.SimulatedDetectionData;
import org.broadinstitute.scbfa.utils.MathObjectAsserts;
import org.broadinstitute.scbfa.utils.MathUtils;
import org.broadinstitute.scbfa.utils.svd.SingularValueDecomposer;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

public final class BinaryPCAUnitTest extends ScBfaBaseTest {

    private static final RealMatrix SMALL = new Array2DRowRealMatrix(smallDetections());

    /**
     * 5 genes x 5 cells; gene 2 is detected in a single cell, p (1 - p) = 0.16, the others have p (1 - p) = 0.24.
     */
    private static final RealMatrix ONE_RARE_GENE = new Array2DRowRealMatrix(new double[][] {
            {1, 1, 0, 0, 0},
            {0, 1, 1, 0, 1},
            {1, 0, 0, 0, 0},
            {0, 0, 1, 1, 0},
            {1, 0, 1, 0, 1}});

    @Test
    public void testSmallExampleShapes() {
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(SMALL, 1);
        Assert.assertEquals(result.getNumComponents(), 1);
        Assert.assertEquals(result.getTransform(), DetectionTransform.INVERSE_DETECTION_FREQUENCY);
        assertShape(result.getScores(), 3, 1);
        assertShape(result.getLoadings(), 4, 1);
        assertShape(result.getTransformedMatrix(), 3, 4);
        Assert.assertEquals(result.getCenters().getDimension(), 4);
        Assert.assertEquals(result.getExplainedVariance().length, 1);
        Assert.assertEquals(result.getDroppedGenes().length, 0);
    }

    @Test
    public void testScoresFollowLeadingSingularVector() {
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(SMALL, 1);
        final RealMatrix transformed = result.getTransformedMatrix();
        final SingularValueDecomposition svd = new SingularValueDecomposition(transformed);
        MathObjectAsserts.assertCollinear(result.getScores().getColumn(0), svd.getU().getColumn(0), 1e-8);
        MathObjectAsserts.assertCollinear(result.getLoadings().getColumn(0), svd.getV().getColumn(0), 1e-8);

        // scores are the projection of the transformed matrix on the loadings
        MathObjectAsserts.assertRealMatrixEquals(result.getScores(), transformed.multiply(result.getLoadings()), 1e-10, 1e-10);
    }

    @Test
    public void testIdfTransformOfSmallExample() {
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(SMALL, 1);
        final double[] frequencies = {2. / 3, 2. / 3, 2. / 3, 1. / 3};
        final RealMatrix transformed = result.getTransformedMatrix();
        for (int g = 0; g < 4; g++) {
            final double weight = -Math.log(frequencies[g]);
            Assert.assertEquals(result.getCenters().getEntry(g), frequencies[g] * weight, 1e-12);
            for (int n = 0; n < 3; n++) {
                Assert.assertEquals(transformed.getEntry(n, g), (SMALL.getEntry(g, n) - frequencies[g]) * weight, 1e-12);
            }
        }
    }

    @Test
    public void testReconstructionError() {
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(SMALL, 1);
        final RealMatrix transformed = result.getTransformedMatrix();
        final double total = MathUtils.sumOfSquares(transformed);
        final double residual = MathUtils.sumOfSquares(transformed.subtract(result.reconstruct()));
        Assert.assertTrue(residual < 0.25 * total, String.format("residual %f of total %f", residual, total));
        Assert.assertEquals(residual, total * (1 - result.getExplainedVarianceRatio()[0]), 1e-10);
    }

    @Test
    public void testExplainedVariance() {
        final RealMatrix detections = SimulatedDetectionData.simulate(40, 30, 3, 17).getDetections();
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(detections, 3);
        final RealMatrix transformed = result.getTransformedMatrix();
        final double[] singularValues = new SingularValueDecomposition(transformed).getSingularValues();
        final double total = MathUtils.sumOfSquares(transformed);

        final double[] variances = result.getExplainedVariance();
        final double[] ratios = result.getExplainedVarianceRatio();
        for (int k = 0; k < 3; k++) {
            final double squared = singularValues[k] * singularValues[k];
            Assert.assertEquals(variances[k], squared / 29, 1e-9 * squared);
            Assert.assertEquals(ratios[k], squared / total, 1e-10);
            if (k > 0) {
                Assert.assertTrue(variances[k] <= variances[k - 1]);
            }
        }
        Assert.assertTrue(Arrays.stream(ratios).sum() <= 1.0 + 1e-12);
        MathObjectAsserts.assertRealMatrixEquals(result.getLoadings().transpose().multiply(result.getLoadings()),
                new Array2DRowRealMatrix(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}), 1e-10, 1e-10);
        MathObjectAsserts.assertOrthogonalColumns(result.getScores(), 1e-10);
    }

    @DataProvider(name = "transforms")
    public Object[][] transforms() {
        return Arrays.stream(DetectionTransform.values()).map(t -> new Object[] {t}).toArray(Object[][]::new);
    }

    @Test(dataProvider = "transforms")
    public void testFitIsDeterministic(final DetectionTransform transform) {
        final RealMatrix detections = SimulatedDetectionData.simulate(30, 20, 2, 8).getDetections();
        final BinaryPCA pca = new BinaryPCA.Builder().transform(transform).build();
        final BinaryPCAResult first = pca.fit(detections, 2);
        final BinaryPCAResult second = pca.fit(detections, 2);
        MathObjectAsserts.assertRealMatrixEquals(first.getScores(), second.getScores(), 0, 1e-300);
        MathObjectAsserts.assertRealMatrixEquals(first.getLoadings(), second.getLoadings(), 0, 1e-300);
        assertEqualsDoubleArray(first.getExplainedVariance(), second.getExplainedVariance(), 0);
        Assert.assertEquals(first.getTransform(), transform);

        // the largest-magnitude entry of each loading vector is positive
        final RealMatrix loadings = first.getLoadings();
        for (int k = 0; k < 2; k++) {
            final double[] column = loadings.getColumn(k);
            final double max = Arrays.stream(column).max().getAsDouble();
            final double min = Arrays.stream(column).min().getAsDouble();
            Assert.assertTrue(max >= -min);
        }
    }

    @Test
    public void testPearsonResidualsAreCenteredPerGene() {
        final BinaryPCAResult result = new BinaryPCA.Builder().transform(DetectionTransform.PEARSON_RESIDUAL).build()
                .fit(SMALL, 1);
        for (int g = 0; g < 4; g++) {
            Assert.assertEquals(result.getCenters().getEntry(g), 0, 1e-12);
        }
    }

    @Test
    public void testNearConstantGenesAreDropped() {
        final BinaryPCAResult result = new BinaryPCA.Builder().minDetectionVariance(0.2).build().fit(ONE_RARE_GENE, 1);
        Assert.assertEquals(result.getDroppedGenes(), new int[] {2});
        assertShape(result.getLoadings(), 5, 1);
        Assert.assertEquals(result.getLoadings().getEntry(2, 0), 0.0);
        Assert.assertEquals(result.getCenters().getEntry(2), 0.0);
        Assert.assertEquals(MathUtils.sumOfSquares(result.getTransformedMatrix().getColumnMatrix(2)), 0.0);
        Assert.assertEquals(result.getLoadings().getColumnVector(0).getNorm(), 1.0, 1e-10);

        final BinaryPCAResult kept = new BinaryPCA.Builder().build().fit(ONE_RARE_GENE, 1);
        Assert.assertEquals(kept.getDroppedGenes().length, 0);
        Assert.assertNotEquals(kept.getLoadings().getEntry(2, 0), 0.0);
    }

    @Test(expectedExceptions = UserException.DimensionMismatch.class)
    public void testTooFewGenesLeft() {
        new BinaryPCA.Builder().minDetectionVariance(0.25).build().fit(ONE_RARE_GENE, 1);
    }

    @Test
    public void testCovariatesAreRegressedOut() {
        final RealMatrix detections = SimulatedDetectionData.simulate(40, 30, 2, 23).getDetections();
        final RealMatrix covariates = new Array2DRowRealMatrix(30, 2);
        for (int n = 0; n < 30; n++) {
            covariates.setEntry(n, 0, 1);
            covariates.setEntry(n, 1, n / 30.0);
        }
        final BinaryPCAResult result = new BinaryPCA.Builder().build().fit(detections, 2, covariates);
        final RealMatrix zero = new Array2DRowRealMatrix(2, 40);
        MathObjectAsserts.assertRealMatrixEquals(covariates.transpose().multiply(result.getTransformedMatrix()), zero, 0, 1e-9);
        MathObjectAsserts.assertRealMatrixEquals(covariates.transpose().multiply(result.getScores()),
                new Array2DRowRealMatrix(2, 2), 0, 1e-9);

        final BinaryPCAResult unadjusted = new BinaryPCA.Builder().build().fit(detections, 2);
        Assert.assertTrue(MathUtils.sumOfSquares(result.getTransformedMatrix())
                <= MathUtils.sumOfSquares(unadjusted.getTransformedMatrix()));
    }

    @Test(expectedExceptions = UserException.class)
    public void testRankDeficientCovariates() {
        final RealMatrix detections = SimulatedDetectionData.simulate(40, 30, 2, 23).getDetections();
        final RealMatrix covariates = new Array2DRowRealMatrix(30, 2);
        for (int n = 0; n < 30; n++) {
            covariates.setEntry(n, 0, n);
            covariates.setEntry(n, 1, 2.0 * n);
        }
        new BinaryPCA.Builder().build().fit(detections, 2, covariates);
    }

    @Test(expectedExceptions = UserException.DimensionMismatch.class)
    public void testCovariateRowMismatch() {
        new BinaryPCA.Builder().build().fit(SMALL, 1, new Array2DRowRealMatrix(4, 1));
    }

    @DataProvider(name = "badComponentCounts")
    public Object[][] badComponentCounts() {
        return new Object[][] {{0}, {3}, {-1}};
    }

    @Test(dataProvider = "badComponentCounts", expectedExceptions = UserException.DimensionMismatch.class)
    public void testBadComponentCount(final int numComponents) {
        new BinaryPCA.Builder().build().fit(SMALL, numComponents);
    }

    @Test
    public void testConstantGeneIsRejectedBeforeAnyDecomposition() {
        final AtomicInteger decompositions = new AtomicInteger();
        final SingularValueDecomposer countingDecomposer = m -> {
            decompositions.incrementAndGet();
            return SingularValueDecomposer.getDefault().createSVD(m);
        };
        final RealMatrix detections = new Array2DRowRealMatrix(new double[][] {
                {1, 0, 1},
                {0, 0, 0},
                {1, 1, 0},
                {0, 1, 1}});
        try {
            new BinaryPCA.Builder().decomposer(countingDecomposer).build().fit(detections, 1);
            Assert.fail("a constant gene row must be rejected");
        } catch (final UserException.DegenerateInput e) {
            Assert.assertTrue(e.getMessage().contains("gene row at index 1"), e.getMessage());
        }
        Assert.assertEquals(decompositions.get(), 0);

        new BinaryPCA.Builder().decomposer(countingDecomposer).build().fit(SMALL, 1);
        Assert.assertEquals(decompositions.get(), 1);
    }

    @Test
    public void testFitNamedDetectionMatrix() {
        final DetectionMatrix named = new DetectionMatrix(SimulatedDetectionData.phonyNames("gene", 4),
                SimulatedDetectionData.phonyNames("cell", 3), SMALL);
        final BinaryPCA pca = new BinaryPCA.Builder().build();
        MathObjectAsserts.assertRealMatrixEquals(pca.fit(named, 1).getScores(), pca.fit(SMALL, 1).getScores(), 0, 1e-300);
    }

    @Test
    public void testBuilderFromConfiguration() {
        final ScBfaConf conf = new ScBfaConfBuilder().setDefaults()
                .setProperty(ScBfaConf.PCA_TRANSFORM_KEY, "PEARSON_RESIDUAL")
                .getConfiguration();
        final BinaryPCA pca = new BinaryPCA.Builder(conf).build();
        Assert.assertEquals(pca.getTransform(), DetectionTransform.PEARSON_RESIDUAL);
        Assert.assertEquals(pca.fit(SMALL, 1).getTransform(), DetectionTransform.PEARSON_RESIDUAL);

        Assert.assertEquals(new BinaryPCA.Builder(ScBfaConfBuilder.getDefaultConfiguration()).build().getTransform(),
                DetectionTransform.INVERSE_DETECTION_FREQUENCY);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMinDetectionVarianceOutOfRange() {
        new BinaryPCA.Builder().minDetectionVariance(0.3);
    }

    private static void assertShape(final RealMatrix matrix, final int rows, final int columns) {
        Assert.assertEquals(matrix.getRowDimension(), rows);
        Assert.assertEquals(matrix.getColumnDimension(), columns);
    }
}
