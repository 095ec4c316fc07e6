package org.broadinstitute.scbfa.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Compact singular value decomposition {@code M = U diag(s) V^T} of an m x n matrix, with Apache Commons matrices
 * for the factors.
 */
public interface SVD {

    /**
     * Right singular vectors, n x p with orthonormal columns.
     */
    RealMatrix getV();

    /**
     * Left singular vectors, m x p with orthonormal columns.
     */
    RealMatrix getU();

    /**
     * The p singular values in non-increasing order.
     */
    double[] getSingularValues();

    /**
     * Keep only the leading {@code k} singular triplets.
     *
     * @param k number of components to keep, between 1 and the number of singular values.
     * @return never {@code null}.
     */
    SVD truncate(final int k);
}
