package org.broadinstitute.scbfa.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.broadinstitute.scbfa.utils.Utils;

/**
 * Perform compact singular value decomposition in pure Java, Commons Math.
 *
 * <p>For an m x n input, U is m x p and V is n x p with p = min(m, n).</p>
 */
public final class ApacheSingularValueDecomposer implements SingularValueDecomposer {

    /** Create a SVD instance using Apache Commons Math.
     *
     * @param m matrix that is not {@code null}
     * @return SVD instance that is never {@code null}
     */
    @Override
    public SVD createSVD(final RealMatrix m) {

        Utils.nonNull(m, "Cannot create SVD on a null matrix.");

        final SingularValueDecomposition svd = new SingularValueDecomposition(m);
        return new SimpleSVD(svd.getU(), svd.getSingularValues(), svd.getV());
    }
}
