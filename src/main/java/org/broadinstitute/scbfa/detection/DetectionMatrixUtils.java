package org.broadinstitute.scbfa.detection;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.exceptions.UserException;
import org.broadinstitute.scbfa.utils.Utils;
import org.broadinstitute.scbfa.utils.param.ParamUtils;

/**
 * Input checks shared by the model fitters. All of them run before any optimization or decomposition work.
 */
public final class DetectionMatrixUtils {

    private DetectionMatrixUtils() {}

    /**
     * Checks that every entry of {@code detections} is exactly 0 or 1.
     * @throws IllegalArgumentException otherwise.
     */
    public static void validateBinary(final RealMatrix detections) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        detections.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(final int row, final int column, final double value) {
                if (value != 0 && value != 1) {
                    throw new IllegalArgumentException(String.format(
                            "the detection matrix must be binary but entry (%d, %d) is %s", row, column, value));
                }
            }
        });
    }

    /**
     * Full validation of a genes x cells detection matrix: non-null, non-empty, binary and free of constant rows
     * and columns.
     *
     * @throws UserException.DegenerateInput if some gene row or cell column is constant.
     */
    public static void validateDetectionMatrix(final RealMatrix detections) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        validateBinary(detections);
        final int geneCount = detections.getRowDimension();
        final int cellCount = detections.getColumnDimension();
        if (geneCount < 2 || cellCount < 2) {
            throw new UserException.DimensionMismatch(String.format(
                    "the detection matrix must have at least 2 genes and 2 cells but it is %d x %d", geneCount, cellCount));
        }
        final double[] geneTotals = geneDetectionCounts(detections);
        for (int g = 0; g < geneCount; g++) {
            if (geneTotals[g] == 0 || geneTotals[g] == cellCount) {
                throw new UserException.DegenerateInput("gene row", g, geneTotals[g] == 0 ? 0 : 1);
            }
        }
        final double[] cellTotals = cellDetectionCounts(detections);
        for (int n = 0; n < cellCount; n++) {
            if (cellTotals[n] == 0 || cellTotals[n] == geneCount) {
                throw new UserException.DegenerateInput("cell column", n, cellTotals[n] == 0 ? 0 : 1);
            }
        }
    }

    /**
     * Checks {@code 1 <= numFactors < min(genes, cells)}.
     * @throws UserException.DimensionMismatch otherwise.
     */
    public static void validateNumFactors(final int numFactors, final int geneCount, final int cellCount) {
        final int limit = Math.min(geneCount, cellCount);
        if (numFactors < 1 || numFactors >= limit) {
            throw new UserException.DimensionMismatch(String.format(
                    "the number of factors must be in [1, %d) for a %d x %d detection matrix but was %d",
                    limit, geneCount, cellCount, numFactors));
        }
    }

    /**
     * Returns the cell-level covariate matrix to use, defaulting to an intercept column.
     *
     * @param cellCovariates N x P covariates, or {@code null}.
     * @param cellCount N.
     * @throws UserException.DimensionMismatch if the row count is not N.
     */
    public static RealMatrix resolveCellCovariates(final RealMatrix cellCovariates, final int cellCount) {
        return resolveCovariates(cellCovariates, cellCount, "cell-level covariate rows (cells)");
    }

    /**
     * Returns the gene-level covariate matrix to use, defaulting to an intercept column.
     *
     * @param geneCovariates G x Q covariates, or {@code null}.
     * @param geneCount G.
     * @throws UserException.DimensionMismatch if the row count is not G.
     */
    public static RealMatrix resolveGeneCovariates(final RealMatrix geneCovariates, final int geneCount) {
        return resolveCovariates(geneCovariates, geneCount, "gene-level covariate rows (genes)");
    }

    private static RealMatrix resolveCovariates(final RealMatrix covariates, final int expectedRows, final String what) {
        if (covariates == null) {
            return intercept(expectedRows);
        }
        if (covariates.getRowDimension() != expectedRows) {
            throw new UserException.DimensionMismatch(what, expectedRows, covariates.getRowDimension());
        }
        ParamUtils.isFinite(covariates, "covariates must be finite");
        return covariates.copy();
    }

    /**
     * A single column of ones.
     */
    public static RealMatrix intercept(final int rows) {
        final RealMatrix result = new Array2DRowRealMatrix(rows, 1);
        for (int i = 0; i < rows; i++) {
            result.setEntry(i, 0, 1.0);
        }
        return result;
    }

    /**
     * Number of cells each gene is detected in.
     */
    public static double[] geneDetectionCounts(final RealMatrix detections) {
        final double[] result = new double[detections.getRowDimension()];
        detections.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(final int row, final int column, final double value) {
                result[row] += value;
            }
        });
        return result;
    }

    /**
     * Number of genes detected in each cell.
     */
    public static double[] cellDetectionCounts(final RealMatrix detections) {
        final double[] result = new double[detections.getColumnDimension()];
        detections.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(final int row, final int column, final double value) {
                result[column] += value;
            }
        });
        return result;
    }
}
