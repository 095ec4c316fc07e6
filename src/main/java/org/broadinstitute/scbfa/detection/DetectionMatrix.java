package org.broadinstitute.scbfa.detection;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.scbfa.utils.Utils;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A binary genes x cells detection matrix with gene and cell names. Entry (g, n) is 1 when gene g has a nonzero
 * count in cell n.
 */
public final class DetectionMatrix {

    private final List<String> geneNames;

    private final List<String> cellNames;

    private final RealMatrix detections;

    public DetectionMatrix(final List<String> geneNames, final List<String> cellNames, final RealMatrix detections) {
        Utils.nonNull(detections, "the detection matrix cannot be null");
        DetectionMatrixUtils.validateBinary(detections);
        this.geneNames = CountMatrix.checkNames(geneNames, "gene", detections.getRowDimension());
        this.cellNames = CountMatrix.checkNames(cellNames, "cell", detections.getColumnDimension());
        this.detections = detections.copy();
    }

    public List<String> getGeneNames() {
        return geneNames;
    }

    public List<String> getCellNames() {
        return cellNames;
    }

    public int getGeneCount() {
        return geneNames.size();
    }

    public int getCellCount() {
        return cellNames.size();
    }

    /**
     * Returns a copy of the binary matrix, genes in rows and cells in columns.
     * @return never {@code null}.
     */
    public RealMatrix getDetections() {
        return detections.copy();
    }

    /**
     * Returns a new detection matrix restricted to the given gene and cell indices, in the order given.
     */
    public DetectionMatrix subset(final int[] geneIndices, final int[] cellIndices) {
        Utils.nonNull(geneIndices, "the gene indices cannot be null");
        Utils.nonNull(cellIndices, "the cell indices cannot be null");
        Utils.validateArg(geneIndices.length > 0 && cellIndices.length > 0, "the subset must keep at least one gene and one cell");
        final List<String> genes = Arrays.stream(geneIndices).mapToObj(geneNames::get).collect(Collectors.toList());
        final List<String> cells = Arrays.stream(cellIndices).mapToObj(cellNames::get).collect(Collectors.toList());
        return new DetectionMatrix(genes, cells, detections.getSubMatrix(geneIndices, cellIndices));
    }
}
