package org.broadinstitute.scbfa.detection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A raw single-cell count matrix, one row per gene and one column per cell, with the gene and cell names
 * in row and column order.
 *
 * <p>
 *     The counts may be held in a dense ({@link org.apache.commons.math3.linear.Array2DRowRealMatrix}) or
 *     sparse ({@link org.apache.commons.math3.linear.OpenMapRealMatrix}) matrix. The matrix is copied on
 *     construction so later changes to the argument do not leak in.
 * </p>
 */
public final class CountMatrix {

    private final List<String> geneNames;

    private final List<String> cellNames;

    private final RealMatrix counts;

    /**
     * Creates a new count matrix.
     *
     * @param geneNames the gene names, one per row of {@code counts}.
     * @param cellNames the cell names, one per column of {@code counts}.
     * @param counts the counts.
     * @throws IllegalArgumentException if any of these is true:
     * <ul>
     *     <li>any argument is {@code null},</li>
     *     <li>{@code geneNames} or {@code cellNames} contains a {@code null} or a duplicate,</li>
     *     <li>the name list sizes do not match the matrix dimensions.</li>
     * </ul>
     */
    public CountMatrix(final List<String> geneNames, final List<String> cellNames, final RealMatrix counts) {
        Utils.nonNull(counts, "the counts cannot be null");
        this.geneNames = checkNames(geneNames, "gene", counts.getRowDimension());
        this.cellNames = checkNames(cellNames, "cell", counts.getColumnDimension());
        this.counts = counts.copy();
    }

    static List<String> checkNames(final List<String> names, final String role, final int expectedSize) {
        Utils.containsNoNull(names, String.format("the %s names cannot be null or contain nulls", role));
        Utils.checkForDuplicatesAndReturnSet(names, String.format("the %s names contain duplicates.", role));
        Utils.validateArg(names.size() == expectedSize,
                () -> String.format("there are %d %s names but the matrix has %d of them", names.size(), role, expectedSize));
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    public List<String> getGeneNames() {
        return geneNames;
    }

    public List<String> getCellNames() {
        return cellNames;
    }

    /**
     * Returns a copy of the counts.
     * @return never {@code null}.
     */
    public RealMatrix getCounts() {
        return counts.copy();
    }

    /**
     * Read-only access for code in this package that only walks the counts.
     */
    RealMatrix countsView() {
        return counts;
    }
}
