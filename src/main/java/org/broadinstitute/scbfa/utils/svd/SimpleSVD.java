package org.broadinstitute.scbfa.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.Arrays;

/**
 * Simple implementation of the SVD interface for storing the matrices (and vector) of a SVD result.
 */
public final class SimpleSVD implements SVD {
    private final RealMatrix v;
    private final RealMatrix u;
    private final double[] singularValues;

    public SimpleSVD(final RealMatrix u, final double[] singularValues, final RealMatrix v) {
        this.u = Utils.nonNull(u);
        this.singularValues = Utils.nonNull(singularValues);
        this.v = Utils.nonNull(v);
        Utils.validateArg(u.getColumnDimension() == singularValues.length && v.getColumnDimension() == singularValues.length,
                "U and V must have one column per singular value");
    }

    @Override
    public RealMatrix getV() {
        return v;
    }

    @Override
    public RealMatrix getU() {
        return u;
    }

    @Override
    public double[] getSingularValues() {
        return singularValues;
    }

    @Override
    public SVD truncate(final int k) {
        Utils.validateArg(k >= 1 && k <= singularValues.length,
                () -> String.format("cannot keep %d components out of %d", k, singularValues.length));
        if (k == singularValues.length) {
            return this;
        }
        return new SimpleSVD(u.getSubMatrix(0, u.getRowDimension() - 1, 0, k - 1),
                Arrays.copyOf(singularValues, k),
                v.getSubMatrix(0, v.getRowDimension() - 1, 0, k - 1));
    }
}
