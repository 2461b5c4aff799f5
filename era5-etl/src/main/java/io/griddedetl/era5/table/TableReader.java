package io.griddedetl.era5.table;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-chunked reader. Cells are strings; a missing value is {@code null}.
 */
public interface TableReader extends Closeable {
    List<Column> columns();

    /** Up to {@code maxRows} rows; empty once the table is exhausted. */
    List<String[]> read(int maxRows) throws IOException;

    default List<String[]> readAll(int chunkSize) throws IOException {
        List<String[]> all = new ArrayList<>();
        List<String[]> chunk;
        while (!(chunk = read(chunkSize)).isEmpty()) all.addAll(chunk);
        return all;
    }
}
