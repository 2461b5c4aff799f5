package io.griddedetl.era5.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingUnitTest {

    @Test
    void walks_the_happy_path() {
        ProcessingUnit u = new ProcessingUnit(UnitKey.of(2021, 5));
        u.addRawFile(Path.of("era5_2021_05.nc"));
        u.moveTo(UnitState.EXTRACTING);
        u.moveTo(UnitState.EXTRACTED);
        u.moveTo(UnitState.JOINING);
        u.joinedFile(Path.of("joined_202105.csv"));
        u.moveTo(UnitState.JOINED);
        u.moveTo(UnitState.CLEANED);
        u.moveTo(UnitState.SORTED);
        assertEquals(UnitState.SORTED, u.state());
        assertTrue(u.state().hasJoinedOutput());
        assertEquals(1, u.rawFiles().size());
    }

    @Test
    void rejects_skipping_a_stage() {
        ProcessingUnit u = new ProcessingUnit(UnitKey.of(2021, 5));
        assertThrows(IllegalStateException.class, () -> u.moveTo(UnitState.JOINING));
        u.moveTo(UnitState.EXTRACTING);
        u.fail(UnitState.EXTRACT_FAILED, "corrupt");
        assertEquals("corrupt", u.failure());
        assertTrue(u.state().isFailure());
        assertThrows(IllegalStateException.class, () -> u.moveTo(UnitState.JOINING));
    }

    @Test
    void unit_key_formats_and_orders() {
        UnitKey k = UnitKey.of(2021, 5);
        assertEquals("2021", k.yearString());
        assertEquals("05", k.monthString());
        assertEquals("202105", k.compact());
        assertEquals("2021-05", k.toString());
        assertTrue(k.compareTo(UnitKey.of(2021, 12)) < 0);
        assertTrue(k.compareTo(UnitKey.of(2020, 12)) > 0);
        assertThrows(IllegalArgumentException.class, () -> UnitKey.of(2021, 13));
    }

    @Test
    void key_columns_follow_preference_order() {
        var cols = List.of("valid_time", "Time", "lat", "lon", "value");
        assertEquals("Time", KeyColumns.find(cols, KeyColumns.TIME).orElseThrow());
        assertEquals("lat", KeyColumns.find(cols, KeyColumns.LATITUDE).orElseThrow());
        assertTrue(KeyColumns.isMetadata("number"));
        assertFalse(KeyColumns.isKey("value"));
    }
}
