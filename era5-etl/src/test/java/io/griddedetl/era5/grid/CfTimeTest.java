package io.griddedetl.era5.grid;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CfTimeTest {

    @Test
    void decodes_hours_since_reference() {
        CfTime t = CfTime.parse("hours since 1900-01-01 00:00:00.0").orElseThrow();
        assertEquals(3600L, t.unitSeconds());
        assertEquals(LocalDateTime.of(1900, 1, 1, 0, 0), t.reference());
        assertEquals("2021-05-01 00:00:00", t.label(1_063_560));
    }

    @Test
    void accepts_other_units_and_utc_suffix() {
        assertEquals("1970-01-02 00:00:00", CfTime.parse("seconds since 1970-01-01 UTC").orElseThrow().label(86_400));
        assertEquals("2021-05-03 12:00:00", CfTime.parse("days since 2021-05-01").orElseThrow().label(2.5));
    }

    @Test
    void rejects_non_time_units() {
        assertTrue(CfTime.parse("degrees_north").isEmpty());
        assertTrue(CfTime.parse("fortnights since 2021-05-01").isEmpty());
        assertTrue(CfTime.parse(null).isEmpty());
    }

    @Test
    void renders_values() {
        assertNull(Values.render(Double.NaN, true));
        assertEquals("280.1", Values.render(280.1f, true));
        assertEquals("10.1235", Values.round("10.123456", 4));
        assertEquals("10.0", Values.round("10", 4));
        assertEquals("abc", Values.round("abc", 4));
        assertEquals("10.123456", Values.round("10.123456", -1));
        assertEquals("0.0001", Values.round("0.0001", 4));
        assertEquals("-0.0001", Values.plain(-1.0E-4));
        assertEquals("10000000.0", Values.plain(1.0E7));
        assertEquals("20.25", Values.plain(20.25));
    }
}
