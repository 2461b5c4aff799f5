package io.griddedetl.era5.extract;

import io.griddedetl.era5.table.TableEncoding;

import java.util.Objects;

/**
 * @param timeChunkSize         time steps per output file
 * @param pruneConstantColumns  drop non-key columns that hold one value across a chunk
 * @param decimalPrecision      decimals kept on latitude/longitude; negative keeps them as decoded
 */
public record ExtractOptions(VariableSelection selection,
                             int timeChunkSize,
                             boolean pruneConstantColumns,
                             int decimalPrecision,
                             TableEncoding encoding) {
    public ExtractOptions {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(encoding, "encoding");
        if (timeChunkSize < 1) throw new IllegalArgumentException("timeChunkSize must be >= 1");
    }

    public static ExtractOptions defaults() {
        return new ExtractOptions(VariableSelection.defaults(), 24, true, 4, TableEncoding.CSV);
    }
}
