package io.griddedetl.era5.table;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum TableFormat {
    CSV,
    PARQUET;

    public static TableFormat parse(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }

    /** Format implied by a file name, {@code .csv}, {@code .csv.gz} or {@code .parquet}. */
    public static Optional<TableFormat> of(Path file) {
        String n = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (n.endsWith(".csv") || n.endsWith(".csv.gz")) return Optional.of(CSV);
        if (n.endsWith(".parquet")) return Optional.of(PARQUET);
        return Optional.empty();
    }

    public static boolean isTable(Path file) {
        return of(file).isPresent();
    }
}
