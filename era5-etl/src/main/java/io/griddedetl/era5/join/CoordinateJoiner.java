package io.griddedetl.era5.join;

import io.griddedetl.era5.grid.Values;
import io.griddedetl.era5.model.CoordinateKey;
import io.griddedetl.era5.model.TimeNormalizer;
import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.table.Column;
import io.griddedetl.era5.table.CsvTableReader;
import io.griddedetl.era5.table.CsvTableWriter;
import io.griddedetl.era5.table.TableFormat;
import io.griddedetl.era5.table.TableReader;
import io.griddedetl.era5.table.TableWriter;
import io.griddedetl.era5.table.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Joins the per-variable tables of one processing unit into a single wide table keyed by
 * (time, latitude, longitude).
 * <p>
 * Each variable is first copied, key-normalized, into a staging CSV in bounded batches; the merge
 * then reads staging files only. The first staged variable seeds the key frame and every
 * variable is left-joined onto it, so the output has exactly the base's distinct keys.
 */
public class CoordinateJoiner {
    private static final Logger LOG = LoggerFactory.getLogger(CoordinateJoiner.class);
    private static final Pattern CHUNK = Pattern.compile("_chunk_(\\d+)_(\\d+)\\.");
    private static final List<Column> STAGING_COLUMNS = List.of(
            Column.string("time"), Column.number("latitude"), Column.number("longitude"), Column.string("value"));

    private final SchemaRegistry registry;
    private final ColumnDetector detector;
    private final JoinOptions options;

    public CoordinateJoiner(SchemaRegistry registry, ColumnDetector detector, JoinOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.options = Objects.requireNonNull(options, "options");
    }

    public JoinOptions options() { return options; }

    public JoinResult join(UnitKey unit, Path processedRoot, Path output) throws JoinException {
        Path unitDir = processedRoot.resolve(unit.yearString()).resolve(unit.monthString());
        Map<String, List<Path>> tables;
        try {
            tables = variableTables(unitDir);
        } catch (IOException e) {
            throw new JoinException(unit + ": cannot list " + unitDir, e);
        }
        if (tables.isEmpty()) throw new JoinException(unit + ": no variable tables under " + unitDir);

        Map<String, String> skipped = new LinkedHashMap<>();
        Map<String, ColumnMapping> mappings = new LinkedHashMap<>();
        for (var e : tables.entrySet()) {
            String variable = e.getKey();
            if (!options.selection().accepts(variable)) {
                LOG.info("{}: {} not selected, skipping", unit, variable);
                continue;
            }
            MappingResult m;
            try {
                m = resolve(variable, Tables.columnNames(e.getValue().get(0)));
            } catch (IOException ex) {
                m = MappingResult.unresolved("unreadable table: " + ex.getMessage());
            }
            if (m.isResolved()) {
                mappings.put(variable, m.mapping());
            } else {
                LOG.warn("{}: {} unmappable ({}): {}", unit, variable, m.status(), m.reason());
                skipped.put(variable, m.reason());
            }
        }
        if (mappings.isEmpty()) throw new JoinException(unit + ": no mappable variable, skipped " + skipped.keySet());

        JoinKeyNames keys = JoinKeyNames.plurality(mappings.values());
        LOG.info("{}: joining {} variable(s) on {}", unit, mappings.size(), keys);

        Path staging = output.toAbsolutePath().getParent().resolve("temp_joins_" + unit.compact());
        try {
            // leftovers of an interrupted join would be appended to
            deleteStaging(staging);
            Files.createDirectories(staging);
            Map<String, Path> staged = new LinkedHashMap<>();
            for (var e : mappings.entrySet()) {
                Path file = staging.resolve(e.getKey() + "_data.csv");
                try {
                    long rows = stage(unit, e.getKey(), e.getValue(), tables.get(e.getKey()), file);
                    if (rows == 0) {
                        skipped.put(e.getKey(), "no rows");
                        LOG.warn("{}: {} has no rows, skipping", unit, e.getKey());
                        Files.deleteIfExists(file);
                    } else {
                        staged.put(e.getKey(), file);
                    }
                } catch (IOException | RuntimeException ex) {
                    LOG.warn("{}: staging {} failed, skipping: {}", unit, e.getKey(), ex.toString());
                    skipped.put(e.getKey(), "staging failed: " + ex.getMessage());
                    Files.deleteIfExists(file);
                }
            }
            return merge(unit, staged, keys, output, skipped);
        } catch (IOException e) {
            throw new JoinException(unit + ": join failed: " + e.getMessage(), e);
        } finally {
            deleteStaging(staging);
        }
    }

    private MappingResult resolve(String variable, List<String> columns) {
        return registry.resolve(variable, columns).orElseGet(() -> detector.detect(variable, columns));
    }

    /** Variable directory name to its table files, chunk order. Variables in name order. */
    static Map<String, List<Path>> variableTables(Path unitDir) throws IOException {
        Map<String, List<Path>> out = new LinkedHashMap<>();
        if (!Files.isDirectory(unitDir)) return out;
        List<Path> dirs;
        try (Stream<Path> s = Files.list(unitDir)) {
            dirs = s.filter(Files::isDirectory).sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path dir : dirs) {
            List<Path> files;
            try (Stream<Path> s = Files.list(dir)) {
                files = s.filter(Files::isRegularFile).filter(TableFormat::isTable)
                        .sorted(Comparator.comparingLong(CoordinateJoiner::chunkStart)
                                .thenComparing(p -> p.getFileName().toString()))
                        .toList();
            }
            if (!files.isEmpty()) out.put(dir.getFileName().toString(), files);
        }
        return out;
    }

    private static long chunkStart(Path file) {
        Matcher m = CHUNK.matcher(file.getFileName().toString());
        return m.find() ? Long.parseLong(m.group(1)) : -1L;
    }

    private long stage(UnitKey unit, String variable, ColumnMapping mapping, List<Path> files, Path staging) throws IOException {
        List<String[]> buffer = new ArrayList<>();
        long rows = 0;
        long dropped = 0;
        for (Path f : files) {
            try (TableReader r = Tables.open(f)) {
                List<String> cols = Column.names(r.columns());
                ColumnMapping m = mapping;
                if (!m.isSatisfiedBy(cols)) {
                    MappingResult again = resolve(variable, cols);
                    if (!again.isResolved()) {
                        LOG.warn("{}: {} file {} unmappable, skipping it: {}", unit, variable, f.getFileName(), again.reason());
                        continue;
                    }
                    m = again.mapping();
                }
                int ti = cols.indexOf(m.time());
                int lai = cols.indexOf(m.latitude());
                int loi = cols.indexOf(m.longitude());
                int vi = cols.indexOf(m.value());
                List<String[]> chunk;
                while (!(chunk = r.read(options.chunkSize())).isEmpty()) {
                    for (String[] row : chunk) {
                        String[] key = normalizedKey(row[ti], row[lai], row[loi]);
                        if (key == null) {
                            dropped++;
                            continue;
                        }
                        String value = row[vi];
                        if (!isNumeric(value)) {
                            throw new IOException(variable + " has a non-numeric value '" + value + "' in " + f.getFileName());
                        }
                        buffer.add(new String[]{key[0], key[1], key[2], value});
                        if (buffer.size() >= options.maxRowsInMemory()) {
                            rows += flush(buffer, staging);
                        }
                    }
                }
            }
        }
        rows += flush(buffer, staging);
        if (dropped > 0) LOG.warn("{}: {} dropped {} row(s) with an invalid key", unit, variable, dropped);
        LOG.info("{}: staged {} row(s) of {}", unit, rows, variable);
        return rows;
    }

    private static String[] normalizedKey(String time, String lat, String lon) {
        if (time == null || lat == null || lon == null) return null;
        try {
            return new String[]{
                    TimeNormalizer.normalize(time),
                    Values.plain(Double.parseDouble(lat.trim()) + 0.0),
                    Values.plain(Double.parseDouble(lon.trim()) + 0.0)};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isNumeric(String value) {
        if (value == null || value.isBlank()) return true;
        try {
            Double.parseDouble(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static int flush(List<String[]> buffer, Path staging) throws IOException {
        if (buffer.isEmpty()) return 0;
        int n = buffer.size();
        try (CsvTableWriter w = new CsvTableWriter(staging, STAGING_COLUMNS, false, true)) {
            w.writeAll(buffer);
        }
        buffer.clear();
        return n;
    }

    private JoinResult merge(UnitKey unit, Map<String, Path> staged, JoinKeyNames keys, Path output,
                             Map<String, String> skipped) throws IOException, JoinException {
        Map<CoordinateKey, Integer> index = null;
        String base = null;
        for (var e : staged.entrySet()) {
            try {
                index = frame(e.getValue());
                base = e.getKey();
                break;
            } catch (IOException | RuntimeException ex) {
                LOG.warn("{}: {} cannot seed the key frame, skipping: {}", unit, e.getKey(), ex.toString());
                skipped.put(e.getKey(), "merge failed: " + ex.getMessage());
            }
        }
        if (index == null) throw new JoinException(unit + ": no joinable variable, skipped " + skipped.keySet());
        LOG.info("{}: base variable {} gives {} key(s)", unit, base, index.size());

        Map<String, String[]> columns = new LinkedHashMap<>();
        for (var e : staged.entrySet()) {
            if (skipped.containsKey(e.getKey())) continue;
            try {
                columns.put(e.getKey(), leftJoin(e.getValue(), index));
            } catch (IOException | RuntimeException ex) {
                LOG.warn("{}: merging {} failed, skipping: {}", unit, e.getKey(), ex.toString());
                skipped.put(e.getKey(), "merge failed: " + ex.getMessage());
            }
        }

        List<Column> header = new ArrayList<>();
        header.add(Column.string(keys.time()));
        header.add(Column.number(keys.latitude()));
        header.add(Column.number(keys.longitude()));
        columns.keySet().forEach(v -> header.add(Column.number(v)));

        Files.createDirectories(output.toAbsolutePath().getParent());
        Path part = output.resolveSibling(output.getFileName() + ".part");
        try (TableWriter w = Tables.create(part, header, options.encoding().forFile(output))) {
            List<String[]> values = new ArrayList<>(columns.values());
            for (var e : index.entrySet()) {
                CoordinateKey k = e.getKey();
                int i = e.getValue();
                String[] row = new String[3 + values.size()];
                row[0] = k.time();
                row[1] = Values.plain(k.latitude());
                row[2] = Values.plain(k.longitude());
                for (int c = 0; c < values.size(); c++) row[3 + c] = values.get(c)[i];
                w.write(row);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(part);
            throw e;
        }
        Tables.replace(part, output);
        LOG.info("{}: wrote {} row(s), {} variable(s) to {}", unit, index.size(), columns.size(), output);
        return new JoinResult(unit, output, index.size(), keys, new ArrayList<>(columns.keySet()), skipped);
    }

    /** Distinct keys of a staging file, first-seen order. */
    private Map<CoordinateKey, Integer> frame(Path staging) throws IOException {
        Map<CoordinateKey, Integer> index = new LinkedHashMap<>();
        try (TableReader r = new CsvTableReader(staging)) {
            List<String[]> chunk;
            while (!(chunk = r.read(options.maxRowsInMemory())).isEmpty()) {
                for (String[] row : chunk) index.putIfAbsent(key(row), index.size());
            }
        }
        return index;
    }

    private String[] leftJoin(Path staging, Map<CoordinateKey, Integer> index) throws IOException {
        String[] column = new String[index.size()];
        BitSet filled = new BitSet(index.size());
        try (TableReader r = new CsvTableReader(staging)) {
            List<String[]> chunk;
            while (!(chunk = r.read(options.maxRowsInMemory())).isEmpty()) {
                for (String[] row : chunk) {
                    Integer i = index.get(key(row));
                    if (i == null || filled.get(i)) continue;
                    filled.set(i);
                    column[i] = row[3];
                }
            }
        }
        return column;
    }

    private static CoordinateKey key(String[] staged) {
        return new CoordinateKey(staged[0], Double.parseDouble(staged[1]), Double.parseDouble(staged[2]));
    }

    private static void deleteStaging(Path staging) {
        if (!Files.exists(staging)) return;
        try (Stream<Path> s = Files.walk(staging)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.warn("could not remove staging directory {}: {}", staging, e.toString());
        }
    }
}
