package io.griddedetl.era5.sort;

import io.griddedetl.era5.table.TableEncoding;
import io.griddedetl.era5.table.TableFixtures;
import io.griddedetl.era5.table.TableFormat;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.griddedetl.era5.table.TableFixtures.row;
import static io.griddedetl.era5.table.TableFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class ChronologicalSorterTest {
    private static final List<String> HEADER = List.of("time", "latitude", "longitude", "t2m");

    @TempDir
    Path tmp;

    private static ChronologicalSorter sorter(boolean backup) {
        return new ChronologicalSorter(new SortOptions(2, backup, TableEncoding.CSV));
    }

    private Path unsorted() throws Exception {
        return TableFixtures.write(tmp.resolve("joined_202105.csv"), HEADER, rows(
                row("2021-05-01 01:00:00", "10.0", "20.0", "a"),
                row("2021-05-01T00:00:00", "10.5", "20.0", "b"),
                row("2021-05-01 00:00:00", "10.0", "20.25", "c"),
                row("2021-05-01 00:00:00", "10.0", "20.0", "d"),
                row("2021-05-01 00:00:00", "10.0", "20.0", "e"),
                row(null, "9.0", "20.0", "f")));
    }

    private static List<String> values(Path file) throws Exception {
        return TableFixtures.read(file).stream().map(r -> r[3]).toList();
    }

    @Test
    void orders_by_time_then_latitude_then_longitude() throws Exception {
        Path f = unsorted();

        SortResult r = sorter(false).sort(f);

        assertEquals(6, r.rows());
        assertTrue(r.temporal());
        assertEquals(List.of("d", "e", "c", "b", "a", "f"), values(f));
        assertEquals("2021-05-01T00:00:00", TableFixtures.read(f).get(3)[0]);
        assertFalse(Files.exists(tmp.resolve("joined_202105.csv.sorted")));
    }

    @Test
    void sorting_twice_changes_nothing() throws Exception {
        Path f = unsorted();
        sorter(false).sort(f);
        byte[] once = Files.readAllBytes(f);
        sorter(false).sort(f);
        assertArrayEquals(once, Files.readAllBytes(f));
    }

    @Test
    void falls_back_to_text_order_for_unparseable_times() throws Exception {
        Path f = TableFixtures.write(tmp.resolve("t.csv"), HEADER, rows(
                row("step-2", "1", "1", "x"), row("step-1", "1", "1", "y"), row("2021-05-01", "1", "1", "z")));

        SortResult r = sorter(false).sort(f);

        assertFalse(r.temporal());
        assertEquals(List.of("z", "y", "x"), values(f));
    }

    @Test
    void backs_up_before_sorting() throws Exception {
        Path f = unsorted();
        byte[] original = Files.readAllBytes(f);

        SortResult r = sorter(true).sort(f);

        assertEquals(tmp.resolve("backup").resolve("joined_202105.csv").toAbsolutePath(), r.backup());
        assertArrayEquals(original, Files.readAllBytes(r.backup()));
    }

    @Test
    void block_copy_matches_the_source() throws Exception {
        Path f = unsorted();
        Path copy = tmp.resolve("copy.csv");
        ChronologicalSorter.copyBlocks(f, copy);
        assertArrayEquals(Files.readAllBytes(f), Files.readAllBytes(copy));
    }

    @Test
    void requires_key_columns() throws Exception {
        Path f = TableFixtures.write(tmp.resolve("t.csv"), List.of("when", "latitude", "longitude"), rows(row("1", "2", "3")));
        SortException e = assertThrows(SortException.class, () -> sorter(false).sort(f));
        assertTrue(e.getMessage().contains("no time column"));
        assertThrows(SortException.class, () -> sorter(false).sort(tmp.resolve("missing.csv")));
    }

    @Test
    void sorts_parquet_in_place() throws Exception {
        var encoding = new TableEncoding(TableFormat.PARQUET, false, CompressionCodecName.UNCOMPRESSED);
        Path f = TableFixtures.write(tmp.resolve("joined_202105.parquet"), HEADER, rows(
                row("2021-05-02 00:00:00", "1", "1", "late"),
                row("2021-05-01 00:00:00", "1", "1", "early")), encoding);

        new ChronologicalSorter(new SortOptions(100, false, encoding)).sort(f);

        assertEquals(List.of("early", "late"), values(f));
    }
}
