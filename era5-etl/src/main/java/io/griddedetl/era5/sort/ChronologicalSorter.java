package io.griddedetl.era5.sort;

import io.griddedetl.era5.model.KeyColumns;
import io.griddedetl.era5.model.TimeNormalizer;
import io.griddedetl.era5.table.Column;
import io.griddedetl.era5.table.TableReader;
import io.griddedetl.era5.table.TableWriter;
import io.griddedetl.era5.table.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sorts a table in place by (time, latitude, longitude) ascending. The sort is stable and cell
 * values are written back untouched, so re-sorting a sorted CSV reproduces it byte for byte.
 * <p>
 * The whole table is held in memory while sorting.
 */
public class ChronologicalSorter {
    private static final Logger LOG = LoggerFactory.getLogger(ChronologicalSorter.class);
    static final long LARGE_FILE = 1L << 30;
    private static final int COPY_BLOCK = 1 << 20;

    private final SortOptions options;

    public ChronologicalSorter(SortOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public SortResult sort(Path table) throws SortException {
        long started = System.currentTimeMillis();
        if (!Files.isRegularFile(table)) throw new SortException("no such table: " + table);
        Path backup = null;
        if (options.backup()) {
            try {
                backup = backup(table);
            } catch (IOException e) {
                throw new SortException("backup of " + table + " failed", e);
            }
        }

        List<Column> columns;
        List<String[]> rows;
        try (TableReader r = Tables.open(table)) {
            columns = r.columns();
            rows = r.readAll(options.chunkSize());
        } catch (IOException | RuntimeException e) {
            throw new SortException("cannot read " + table + ": " + e.getMessage(), e);
        }
        List<String> names = Column.names(columns);
        int ti = index(names, KeyColumns.TIME).orElseThrow(() -> new SortException(table + ": no time column in " + names));
        int lai = index(names, KeyColumns.LATITUDE).orElseThrow(() -> new SortException(table + ": no latitude column in " + names));
        int loi = index(names, KeyColumns.LONGITUDE).orElseThrow(() -> new SortException(table + ": no longitude column in " + names));

        List<SortRow> keyed = new ArrayList<>(rows.size());
        boolean temporal = true;
        boolean numericLat = true;
        boolean numericLon = true;
        for (String[] row : rows) {
            Optional<LocalDateTime> t = TimeNormalizer.parse(row[ti]);
            Double lat = number(row[lai]);
            Double lon = number(row[loi]);
            temporal &= t.isPresent() || row[ti] == null;
            numericLat &= lat != null || row[lai] == null;
            numericLon &= lon != null || row[loi] == null;
            keyed.add(new SortRow(row, t.orElse(null), lat, lon));
        }
        if (!temporal) LOG.warn("{}: time values not all parseable, ordering time as text", table.getFileName());
        if (!numericLat || !numericLon) LOG.warn("{}: coordinates not all numeric, ordering them as text", table.getFileName());

        Comparator<SortRow> byTime = temporal
                ? Comparator.comparing(SortRow::time, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                : text(ti);
        Comparator<SortRow> byLat = numericLat
                ? Comparator.comparing(SortRow::lat, Comparator.nullsLast(Comparator.<Double>naturalOrder()))
                : text(lai);
        Comparator<SortRow> byLon = numericLon
                ? Comparator.comparing(SortRow::lon, Comparator.nullsLast(Comparator.<Double>naturalOrder()))
                : text(loi);
        Comparator<SortRow> order = byTime.thenComparing(byLat).thenComparing(byLon);
        keyed.sort(order);

        Path tmp = table.resolveSibling(table.getFileName() + ".sorted");
        try {
            try (TableWriter w = Tables.create(tmp, columns, options.encoding().forFile(table))) {
                for (SortRow s : keyed) w.write(s.row());
            }
            Tables.replace(tmp, table);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new SortException("cannot write sorted " + table + ": " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - started;
        LOG.info("sorted {} ({} rows) in {} ms", table, keyed.size(), elapsed);
        return new SortResult(table, keyed.size(), temporal, backup, elapsed);
    }

    private static Comparator<SortRow> text(int column) {
        return Comparator.comparing((SortRow s) -> s.row()[column], Comparator.nullsLast(Comparator.<String>naturalOrder()));
    }

    private static Optional<Integer> index(List<String> names, List<String> known) {
        return KeyColumns.find(names, known).map(names::indexOf);
    }

    private static Double number(String s) {
        if (s == null) return null;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Copies {@code table} to {@code <dir>/backup/<name>}, block by block for large files. */
    static Path backup(Path table) throws IOException {
        Path dir = table.toAbsolutePath().getParent().resolve("backup");
        Files.createDirectories(dir);
        Path target = dir.resolve(table.getFileName());
        if (Files.size(table) > LARGE_FILE) {
            copyBlocks(table, target);
        } else {
            Files.copy(table, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }
        LOG.info("backed up {} to {}", table.getFileName(), target);
        return target;
    }

    static void copyBlocks(Path from, Path to) throws IOException {
        byte[] block = new byte[COPY_BLOCK];
        try (InputStream in = Files.newInputStream(from); OutputStream out = Files.newOutputStream(to)) {
            int n;
            while ((n = in.read(block)) > 0) out.write(block, 0, n);
        }
    }

    private record SortRow(String[] row, LocalDateTime time, Double lat, Double lon) {}
}
