package org.broadinstitute.scbfa.detection;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.ScBfaBaseTest;
import org.broadinstitute.scbfa.utils.MathObjectAsserts;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class CountMatrixUnitTest extends ScBfaBaseTest {

    private static final RealMatrix COUNTS = new Array2DRowRealMatrix(new double[][] {{1, 0, 3}, {0, 2, 0}});

    @DataProvider(name = "badNames")
    public Object[][] badNames() {
        return new Object[][] {
                {null, Arrays.asList("c1", "c2", "c3")},
                {Arrays.asList("g1", null), Arrays.asList("c1", "c2", "c3")},
                {Arrays.asList("g1", "g1"), Arrays.asList("c1", "c2", "c3")},
                {Arrays.asList("g1", "g2", "g3"), Arrays.asList("c1", "c2", "c3")},
                {Arrays.asList("g1", "g2"), Arrays.asList("c1", "c2")},
        };
    }

    @Test(dataProvider = "badNames", expectedExceptions = IllegalArgumentException.class)
    public void testBadNames(final List<String> genes, final List<String> cells) {
        new CountMatrix(genes, cells, COUNTS);
    }

    @Test
    public void testCountsAreCopied() {
        final RealMatrix counts = COUNTS.copy();
        final CountMatrix countMatrix = new CountMatrix(Arrays.asList("g1", "g2"), Arrays.asList("c1", "c2", "c3"), counts);
        counts.setEntry(0, 0, 50);
        Assert.assertEquals(countMatrix.getCounts().getEntry(0, 0), 1.0);
        countMatrix.getCounts().setEntry(0, 0, 50);
        Assert.assertEquals(countMatrix.getCounts().getEntry(0, 0), 1.0);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testNamesAreUnmodifiable() {
        new CountMatrix(Arrays.asList("g1", "g2"), Arrays.asList("c1", "c2", "c3"), COUNTS).getGeneNames().add("g3");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDetectionMatrixMustBeBinary() {
        new DetectionMatrix(Arrays.asList("g1", "g2"), Arrays.asList("c1", "c2", "c3"), COUNTS);
    }

    @Test
    public void testDetectionMatrixSubset() {
        final DetectionMatrix detections = new DetectionMatrix(Arrays.asList("g1", "g2", "g3", "g4"),
                Arrays.asList("c1", "c2", "c3"), new Array2DRowRealMatrix(smallDetections()));
        final DetectionMatrix subset = detections.subset(new int[] {3, 0}, new int[] {2, 1});
        Assert.assertEquals(subset.getGeneNames(), Arrays.asList("g4", "g1"));
        Assert.assertEquals(subset.getCellNames(), Arrays.asList("c3", "c2"));
        MathObjectAsserts.assertRealMatrixEquals(subset.getDetections(), new Array2DRowRealMatrix(new double[][] {{1, 0}, {1, 0}}));
    }
}
