package org.broadinstitute.scbfa;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger.
 */
public abstract class ScBfaBaseTest {

    public static final Logger logger = LogManager.getLogger("org.broadinstitute.scbfa");

    @BeforeSuite
    public void setTestVerbosity() {
        Configurator.setLevel("org.broadinstitute.scbfa", Level.WARN);
    }

    /**
     * Checks whether two double array contain the same values or not.
     * @param actual actual produced array.
     * @param expected expected array.
     * @param tolerance maximum difference between double value to be consider equivalent.
     */
    protected static void assertEqualsDoubleArray(final double[] actual, final double[] expected, final double tolerance) {
        if (expected == null) {
            Assert.assertNull(actual);
            return;
        }
        Assert.assertNotNull(actual);
        Assert.assertEquals(actual.length, expected.length, "array length");
        for (int i = 0; i < actual.length; i++) {
            Assert.assertEquals(actual[i], expected[i], tolerance, "array position " + i);
        }
    }

    /**
     * The 4 genes x 3 cells detection matrix used as a worked example throughout the tests.
     */
    protected static double[][] smallDetections() {
        return new double[][] {
                {1, 0, 1},
                {0, 1, 1},
                {1, 1, 0},
                {0, 0, 1}};
    }
}
