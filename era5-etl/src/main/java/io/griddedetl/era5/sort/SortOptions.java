package io.griddedetl.era5.sort;

import io.griddedetl.era5.table.TableEncoding;

import java.util.Objects;

/**
 * @param chunkSize rows per read; the sort itself still holds the whole table
 * @param backup    copy the table into {@code backup/} beside it before rewriting
 * @param encoding  supplies the Parquet codec; format and gzip follow the file being sorted
 */
public record SortOptions(int chunkSize, boolean backup, TableEncoding encoding) {
    public SortOptions {
        Objects.requireNonNull(encoding, "encoding");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
    }

    public static SortOptions defaults() {
        return new SortOptions(100_000, false, TableEncoding.PARQUET);
    }
}
