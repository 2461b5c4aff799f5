package io.griddedetl.era5.grid;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * One variable of a gridded file: its dimensions, the coordinate labels along each of them and
 * hyperslab reads of its values.
 */
public interface GriddedVariable {
    String name();

    /** Dimension names in storage order. */
    List<String> dimensions();

    int[] shape();

    /**
     * Label of every index along dimension {@code dim}: decoded timestamps for time axes, numbers
     * for the rest, the index itself when the file has no coordinate variable.
     */
    String[] coordinateLabels(int dim) throws IOException;

    /** Scalar auxiliary coordinates (CF {@code coordinates} attribute) and their single values. */
    Map<String, String> scalarCoordinates() throws IOException;

    /**
     * Values for indices {@code [start, end)} along {@code dim}, all of every other dimension,
     * row-major. Missing values are NaN. {@code dim < 0} reads the whole variable.
     */
    double[] read(int dim, int start, int end) throws IOException;

    /** Whether values are stored in single precision and should be rendered as floats. */
    boolean singlePrecision();
}
