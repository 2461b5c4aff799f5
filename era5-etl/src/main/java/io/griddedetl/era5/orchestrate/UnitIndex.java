package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.model.UnitState;
import io.griddedetl.era5.table.Column;
import io.griddedetl.era5.table.CsvTableReader;
import io.griddedetl.era5.table.CsvTableWriter;
import io.griddedetl.era5.table.TableReader;
import io.griddedetl.era5.table.TableWriter;
import io.griddedetl.era5.table.Tables;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Last known state and joined output of every unit, persisted as {@code unit-index.csv}. The files
 * on disk stay authoritative: a resumed unit is only trusted if its joined file still exists.
 */
public class UnitIndex {
    private static final List<Column> COLUMNS = List.of(
            Column.string("year"), Column.string("month"), Column.string("state"),
            Column.string("joined_file"), Column.string("updated_at"));

    public record Entry(UnitKey unit, UnitState state, Path joinedFile, Instant updatedAt) {}

    private final Path file;
    private final Map<UnitKey, Entry> entries = new TreeMap<>();

    private UnitIndex(Path file) {
        this.file = file;
    }

    /** Reads {@code file} when it exists, otherwise starts empty. */
    public static UnitIndex load(Path file) throws IOException {
        UnitIndex index = new UnitIndex(file);
        if (!Files.exists(file)) return index;
        try (TableReader r = new CsvTableReader(file)) {
            for (String[] row : r.readAll(10_000)) {
                UnitKey key = new UnitKey(Integer.parseInt(row[0]), Integer.parseInt(row[1]));
                Path joined = row[3] == null ? null : Paths.get(row[3]);
                Instant at = row[4] == null ? Instant.EPOCH : Instant.parse(row[4]);
                index.entries.put(key, new Entry(key, UnitState.valueOf(row[2]), joined, at));
            }
        } catch (RuntimeException e) {
            throw new IOException("corrupt unit index " + file + ": " + e.getMessage(), e);
        }
        return index;
    }

    public synchronized Optional<Entry> lookup(UnitKey unit) {
        return Optional.ofNullable(entries.get(unit));
    }

    public synchronized void update(UnitKey unit, UnitState state, Path joinedFile) {
        entries.put(unit, new Entry(unit, state, joinedFile, Instant.now()));
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Writes the whole index beside the old one, then swaps it in. */
    public synchronized void save() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(file.getFileName() + ".tmp");
        try (TableWriter w = new CsvTableWriter(tmp, COLUMNS, false)) {
            for (Entry e : entries.values()) {
                w.write(new String[]{
                        Integer.toString(e.unit().year()), Integer.toString(e.unit().month()), e.state().name(),
                        e.joinedFile() == null ? null : e.joinedFile().toString(), e.updatedAt().toString()});
            }
        }
        Tables.replace(tmp, file);
    }
}
