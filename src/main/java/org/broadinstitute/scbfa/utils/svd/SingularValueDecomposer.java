package org.broadinstitute.scbfa.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;

/**
 *  Perform singular value decomposition.
 */
public interface SingularValueDecomposer {
    SVD createSVD(final RealMatrix m);

    /**
     * Create the default decomposer.
     */
    static SingularValueDecomposer getDefault(){
        return new ApacheSingularValueDecomposer();
    }
}
