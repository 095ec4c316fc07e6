package org.broadinstitute.scbfa.detection;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.stream.IntStream;

/**
 * Turns raw genes x cells count matrices into binary detection matrices.
 *
 * <p>
 *     Entry (g, n) of the output is 1 when the count of gene g in cell n is strictly positive and 0 otherwise.
 *     Counts must be non-negative and finite.
 * </p>
 */
public final class DetectionMatrixBuilder {

    private static final Logger logger = LogManager.getLogger(DetectionMatrixBuilder.class);

    private DetectionMatrixBuilder() {}

    /**
     * Binarizes a bare count matrix.
     *
     * @param counts genes x cells counts, dense or sparse, not {@code null}.
     * @return a new dense matrix of the same shape. Never {@code null}.
     * @throws IllegalArgumentException if {@code counts} is {@code null}, or has a negative or non-finite entry.
     */
    public static RealMatrix build(final RealMatrix counts) {
        Utils.nonNull(counts, "the count matrix cannot be null");
        final RealMatrix result = new Array2DRowRealMatrix(counts.getRowDimension(), counts.getColumnDimension());
        counts.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(final int row, final int column, final double value) {
                if (!(value >= 0) || Double.isInfinite(value)) {
                    throw new IllegalArgumentException(String.format(
                            "counts must be non-negative and finite but entry (%d, %d) is %s", row, column, value));
                }
                if (value > 0) {
                    result.setEntry(row, column, 1.0);
                }
            }
        });
        return result;
    }

    /**
     * Binarizes a named count matrix, keeping its gene and cell names.
     *
     * @param counts not {@code null}.
     * @return never {@code null}.
     */
    public static DetectionMatrix build(final CountMatrix counts) {
        Utils.nonNull(counts, "the count matrix cannot be null");
        return new DetectionMatrix(counts.getGeneNames(), counts.getCellNames(), build(counts.countsView()));
    }

    /**
     * Drops genes detected in no cell or in every cell, and cells with no or all genes detected.
     *
     * <p>
     *     Removing cells can make a gene constant and vice versa, so the filter is repeated until nothing changes.
     * </p>
     *
     * @param detections not {@code null}.
     * @return a detection matrix that passes {@link DetectionMatrixUtils#validateDetectionMatrix}, possibly the input itself.
     * @throws IllegalArgumentException if nothing would be left.
     */
    public static DetectionMatrix removeDegenerate(final DetectionMatrix detections) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        DetectionMatrix current = detections;
        while (true) {
            final RealMatrix matrix = current.getDetections();
            final int cellCount = current.getCellCount();
            final int geneCount = current.getGeneCount();
            final double[] geneTotals = DetectionMatrixUtils.geneDetectionCounts(matrix);
            final double[] cellTotals = DetectionMatrixUtils.cellDetectionCounts(matrix);
            final int[] genesToKeep = IntStream.range(0, geneCount)
                    .filter(g -> geneTotals[g] > 0 && geneTotals[g] < cellCount).toArray();
            final int[] cellsToKeep = IntStream.range(0, cellCount)
                    .filter(n -> cellTotals[n] > 0 && cellTotals[n] < geneCount).toArray();
            if (genesToKeep.length == geneCount && cellsToKeep.length == cellCount) {
                return current;
            }
            Utils.validateArg(genesToKeep.length > 0 && cellsToKeep.length > 0,
                    "no informative genes or cells are left after removing constant rows and columns");
            logger.info(String.format("Removing %d constant genes and %d constant cells...",
                    geneCount - genesToKeep.length, cellCount - cellsToKeep.length));
            current = current.subset(genesToKeep, cellsToKeep);
        }
    }
}
