package org.broadinstitute.scbfa.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.utils.Utils;

/**
 * Entry point for creating an instance of SVD.  When the object is created, all of the calculation will be done as well.
 */
public final class SVDFactory {

    private SVDFactory() {}

    /**
     * Create a rank-{@code k} truncated SVD.
     *
     * @param m matrix that is not {@code null}
     * @param k number of leading components to keep; must not exceed min(rows, columns).
     * @param decomposer the decomposer to use, not {@code null}.
     * @return SVD instance with exactly {@code k} components, never {@code null}
     */
    public static SVD createTruncatedSVD(final RealMatrix m, final int k, final SingularValueDecomposer decomposer){
        Utils.nonNull(m, "Cannot perform SVD on a null.");
        Utils.nonNull(decomposer, "the decomposer cannot be null");
        Utils.validateArg(k >= 1 && k <= Math.min(m.getRowDimension(), m.getColumnDimension()),
                () -> String.format("cannot keep %d components of a %d x %d matrix", k, m.getRowDimension(), m.getColumnDimension()));
        return decomposer.createSVD(m).truncate(k);
    }
}
