package io.griddedetl.era5.join;

import io.griddedetl.era5.extract.VariableSelection;
import io.griddedetl.era5.table.TableEncoding;

import java.util.Objects;

/**
 * @param chunkSize        rows read from a variable table at a time
 * @param maxRowsInMemory  rows buffered per variable before they are flushed to its staging file
 * @param encoding         Parquet codec for the joined table; the format follows the output file name
 */
public record JoinOptions(VariableSelection selection, int chunkSize, int maxRowsInMemory, TableEncoding encoding) {
    public JoinOptions {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(encoding, "encoding");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        if (maxRowsInMemory < 1) throw new IllegalArgumentException("maxRowsInMemory must be >= 1");
    }

    public static JoinOptions defaults() {
        return new JoinOptions(VariableSelection.defaults(), 10_000, 30_000, TableEncoding.PARQUET);
    }
}
