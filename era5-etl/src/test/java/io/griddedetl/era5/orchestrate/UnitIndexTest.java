package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.model.UnitState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnitIndexTest {
    @TempDir
    Path tmp;

    @Test
    void survives_a_save_and_load() throws Exception {
        Path file = tmp.resolve("out").resolve("unit-index.csv");
        UnitIndex index = UnitIndex.load(file);
        assertEquals(0, index.size());
        index.update(UnitKey.of(2021, 5), UnitState.SORTED, tmp.resolve("joined_202105.csv"));
        index.update(UnitKey.of(2021, 6), UnitState.EXTRACT_FAILED, null);
        index.save();

        UnitIndex again = UnitIndex.load(file);
        assertEquals(2, again.size());
        UnitIndex.Entry may = again.lookup(UnitKey.of(2021, 5)).orElseThrow();
        assertEquals(UnitState.SORTED, may.state());
        assertEquals(tmp.resolve("joined_202105.csv"), may.joinedFile());
        assertNull(again.lookup(UnitKey.of(2021, 6)).orElseThrow().joinedFile());
        assertFalse(Files.exists(file.resolveSibling("unit-index.csv.tmp")));
    }

    @Test
    void corrupt_index_is_reported() throws Exception {
        Path file = Files.writeString(tmp.resolve("unit-index.csv"), "year,month,state,joined_file,updated_at\n2021,5,BOGUS,,\n");
        assertThrows(IOException.class, () -> UnitIndex.load(file));
    }

    @Test
    void task_ids_name_the_unit() {
        UnitKey may = UnitKey.of(2021, 5);
        assertEquals("extract_2021_05_era5_2021_05.nc", new ExtractTask(may, Path.of("raw", "era5_2021_05.nc")).id());
        assertEquals("join_2021_05", new JoinTask(may, Path.of("j.csv")).id());
        assertEquals("sort_2021_05_and_1_more", new SortTask(List.of(may, UnitKey.of(2021, 6)),
                List.of(Path.of("a.csv"), Path.of("b.csv"))).id());
        List<UnitKey> none = new ArrayList<>();
        none.add(null);
        assertEquals("sort_t.csv", new SortTask(none, List.of(Path.of("t.csv"))).id());
    }
}
