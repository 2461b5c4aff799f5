package io.griddedetl.era5.table;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/** Opens readers and writers by file extension or explicit encoding. */
public final class Tables {
    private Tables() {}

    public static TableReader open(Path file) throws IOException {
        TableFormat format = TableFormat.of(file)
                .orElseThrow(() -> new IOException("unsupported table file: " + file));
        return switch (format) {
            case CSV -> new CsvTableReader(file);
            case PARQUET -> new ParquetTableReader(file);
        };
    }

    /** Opens {@code file} for writing in {@code encoding}, whatever the file's own extension. */
    public static TableWriter create(Path file, List<Column> columns, TableEncoding encoding) throws IOException {
        return switch (encoding.format()) {
            case CSV -> new CsvTableWriter(file, columns, encoding.gzip());
            case PARQUET -> new ParquetTableWriter(file, columns, encoding.parquetCodec());
        };
    }

    public static List<String> columnNames(Path file) throws IOException {
        try (TableReader r = open(file)) {
            return Column.names(r.columns());
        }
    }

    /** Moves {@code from} over {@code to}, atomically where the filesystem allows it. */
    public static void replace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
