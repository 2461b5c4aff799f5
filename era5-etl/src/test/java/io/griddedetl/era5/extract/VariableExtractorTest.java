package io.griddedetl.era5.extract;

import io.griddedetl.era5.grid.InMemoryGriddedFile;
import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.table.TableEncoding;
import io.griddedetl.era5.table.TableFixtures;
import io.griddedetl.era5.table.Tables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static io.griddedetl.era5.grid.InMemoryGriddedFile.grid;
import static org.junit.jupiter.api.Assertions.*;

class VariableExtractorTest {
    private static final UnitKey MAY = UnitKey.of(2021, 5);
    private static final String[] TIMES = {"2021-05-01 00:00:00", "2021-05-01 01:00:00", "2021-05-01 02:00:00"};
    private static final String[] LATS = {"10.123456", "10.5"};
    private static final String[] LONS = {"20.0", "20.25"};

    @TempDir
    Path tmp;

    private static ExtractOptions options(int timeChunk, boolean prune) {
        return new ExtractOptions(VariableSelection.all(), timeChunk, prune, 4, TableEncoding.CSV);
    }

    private Path unitDir() {
        return tmp.resolve("processed").resolve("2021").resolve("05");
    }

    @Test
    void writes_one_file_per_time_window() throws Exception {
        var file = new InMemoryGriddedFile().add(grid("t2m", TIMES, LATS, LONS, (t, la, lo) -> t * 100 + la * 10 + lo));
        var extractor = new VariableExtractor(p -> file, options(2, true));

        ExtractResult r = extractor.extract(tmp.resolve("era5_2021_05.nc"), MAY, tmp.resolve("processed"));

        assertEquals(List.of("t2m"), r.extracted());
        assertEquals(12, r.rows());
        Path first = unitDir().resolve("t2m").resolve("202105_t2m_era5_2021_05_chunk_0_2.csv");
        Path second = unitDir().resolve("t2m").resolve("202105_t2m_era5_2021_05_chunk_2_3.csv");
        assertEquals(List.of(first, second), r.written());
        assertEquals(List.of("time", "latitude", "longitude", "value"), Tables.columnNames(first));

        List<String[]> rows = TableFixtures.read(first);
        assertEquals(8, rows.size());
        assertArrayEquals(new String[]{"2021-05-01 00:00:00", "10.1235", "20.0", "0.0"}, rows.get(0));
        assertArrayEquals(new String[]{"2021-05-01 01:00:00", "10.5", "20.25", "111.0"}, rows.get(7));
        assertEquals(4, TableFixtures.read(second).size());
        assertTrue(file.closed());
        try (var s = Files.list(unitDir().resolve("t2m"))) {
            assertTrue(s.noneMatch(p -> p.toString().endsWith(".part")));
        }
    }

    @Test
    void prunes_constant_dimensions_unless_asked_to_keep_them() throws Exception {
        double[] values = new double[TIMES.length * LATS.length * LONS.length];
        var ensemble = new InMemoryGriddedFile.Var("t2m", List.of("number", "time", "latitude", "longitude"),
                new String[][]{{"0"}, TIMES, LATS, LONS}, values).scalar("surface", "0.0");

        Path pruned = new VariableExtractor(p -> new InMemoryGriddedFile().add(ensemble), options(24, true))
                .extract(tmp.resolve("a.nc"), MAY, tmp.resolve("processed")).written().get(0);
        assertEquals(List.of("time", "latitude", "longitude", "value"), Tables.columnNames(pruned));

        Path kept = new VariableExtractor(p -> new InMemoryGriddedFile().add(ensemble), options(24, false))
                .extract(tmp.resolve("a.nc"), MAY, tmp.resolve("kept")).written().get(0);
        assertEquals(List.of("number", "time", "latitude", "longitude", "surface", "value"), Tables.columnNames(kept));
        assertArrayEquals(new String[]{"0", "2021-05-01 00:00:00", "10.1235", "20.0", "0.0", "0.0"},
                TableFixtures.read(kept).get(0));
    }

    @Test
    void a_failing_variable_does_not_stop_the_others() throws Exception {
        var file = new InMemoryGriddedFile()
                .add(grid("t2m", TIMES, LATS, LONS, (t, la, lo) -> 1))
                .add(grid("u10", TIMES, LATS, LONS, (t, la, lo) -> 2).failing("corrupt message"));

        ExtractResult r = new VariableExtractor(p -> file, options(24, true))
                .extract(tmp.resolve("era5_2021_05.nc"), MAY, tmp.resolve("processed"));

        assertEquals(List.of("t2m"), r.extracted());
        assertEquals(Set.of("u10"), r.failed().keySet());
        assertTrue(r.failed().get("u10").contains("corrupt"));
        assertFalse(Files.exists(unitDir().resolve("u10")));
    }

    @Test
    void nothing_decoded_is_a_decode_error() {
        var file = new InMemoryGriddedFile().add(grid("u10", TIMES, LATS, LONS, (t, la, lo) -> 2).failing("corrupt"));
        assertThrows(DecodeException.class, () -> new VariableExtractor(p -> file, options(24, true))
                .extract(tmp.resolve("x.nc"), MAY, tmp.resolve("processed")));

        var unreadable = new VariableExtractor(p -> { throw new IOException("not a grib file"); }, options(24, true));
        DecodeException e = assertThrows(DecodeException.class,
                () -> unreadable.extract(tmp.resolve("x.grib"), MAY, tmp.resolve("processed")));
        assertTrue(e.getMessage().contains("not a grib file"));
    }

    @Test
    void variables_without_time_get_a_single_file() throws Exception {
        var orog = new InMemoryGriddedFile.Var("z", List.of("latitude", "longitude"),
                new String[][]{LATS, LONS}, new double[]{1, 2, 3, Double.NaN}).single();

        ExtractResult r = new VariableExtractor(p -> new InMemoryGriddedFile().add(orog), options(24, true))
                .extract(tmp.resolve("x.nc"), MAY, tmp.resolve("processed"));

        Path out = unitDir().resolve("z").resolve("202105_z.csv");
        assertEquals(List.of(out), r.written());
        List<String[]> rows = TableFixtures.read(out);
        assertEquals("1.0", rows.get(0)[2]);
        assertNull(rows.get(3)[2]);
    }

    @Test
    void requested_variables_missing_from_the_file_are_reported() throws Exception {
        var file = new InMemoryGriddedFile()
                .add(grid("t2m", TIMES, LATS, LONS, (t, la, lo) -> 1))
                .add(grid("tp", TIMES, LATS, LONS, (t, la, lo) -> 1));
        var only = new ExtractOptions(new VariableSelection(List.of("t2m", "sp"), Set.of()), 24, true, 4, TableEncoding.CSV);

        ExtractResult r = new VariableExtractor(p -> file, only).extract(tmp.resolve("x.nc"), MAY, tmp.resolve("processed"));

        assertEquals(List.of("t2m"), r.extracted());
        assertEquals("not present in file", r.failed().get("sp"));
        assertFalse(Files.exists(unitDir().resolve("tp")));
    }

    @Test
    void default_selection_skips_accumulated_fields() {
        var defaults = VariableSelection.defaults();
        assertEquals(List.of("t2m", "u10"), defaults.apply(List.of("t2m", "tp", "u10", "cp")));
        assertEquals(List.of("sp"), new VariableSelection(List.of("t2m", "sp"), Set.of()).missingFrom(List.of("t2m")));
    }

    @Test
    void parquet_output_uses_the_parquet_extension() throws Exception {
        var file = new InMemoryGriddedFile().add(grid("2t", TIMES, LATS, LONS, (t, la, lo) -> 280.5));
        var parquet = new ExtractOptions(VariableSelection.all(), 24, true, 4, TableEncoding.PARQUET);

        ExtractResult r = new VariableExtractor(p -> file, parquet).extract(tmp.resolve("x.nc"), MAY, tmp.resolve("processed"));

        Path out = unitDir().resolve("2t").resolve("202105_2t_x_chunk_0_3.parquet");
        assertEquals(List.of(out), r.written());
        List<String[]> rows = TableFixtures.read(out);
        assertEquals(12, rows.size());
        assertEquals("280.5", rows.get(0)[3]);
        assertEquals("10.1235", rows.get(0)[1]);
    }

    @Test
    void files_of_one_month_write_side_by_side() throws Exception {
        var a = new InMemoryGriddedFile().add(grid("t2m", TIMES, LATS, LONS, (t, la, lo) -> 1));
        var b = new InMemoryGriddedFile().add(grid("t2m", TIMES, LATS, LONS, (t, la, lo) -> 2));
        var extractor = new VariableExtractor(p -> p.getFileName().toString().equals("era5_2021_05_a.nc") ? a : b, options(24, true));

        ExtractResult first = extractor.extract(tmp.resolve("era5_2021_05_a.nc"), MAY, tmp.resolve("processed"));
        ExtractResult second = extractor.extract(tmp.resolve("era5_2021_05_b.nc"), MAY, tmp.resolve("processed"));

        Path fromA = unitDir().resolve("t2m").resolve("202105_t2m_era5_2021_05_a_chunk_0_3.csv");
        Path fromB = unitDir().resolve("t2m").resolve("202105_t2m_era5_2021_05_b_chunk_0_3.csv");
        assertEquals(List.of(fromA), first.written());
        assertEquals(List.of(fromB), second.written());
        assertEquals("1.0", TableFixtures.read(fromA).get(0)[3]);
        assertEquals("2.0", TableFixtures.read(fromB).get(0)[3]);
        assertEquals("era5_2021-05_x", VariableExtractor.sourceTag(Path.of("in", "era5_2021-05 x.grib")));
    }
}
