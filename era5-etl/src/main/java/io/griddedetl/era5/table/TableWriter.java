package io.griddedetl.era5.table;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

public interface TableWriter extends Closeable {
    void write(String[] row) throws IOException;

    default void writeAll(List<String[]> rows) throws IOException {
        for (String[] r : rows) write(r);
    }
}
