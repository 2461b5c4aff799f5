package io.griddedetl.era5.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeNormalizerTest {

    @Test
    void accepts_common_spellings() {
        LocalDateTime expected = LocalDateTime.of(2021, 5, 1, 6, 0, 0);
        assertEquals(Optional.of(expected), TimeNormalizer.parse("2021-05-01 06:00:00"));
        assertEquals(Optional.of(expected), TimeNormalizer.parse("2021-05-01T06:00:00"));
        assertEquals(Optional.of(expected), TimeNormalizer.parse("2021-05-01T06:00"));
        assertEquals(Optional.of(LocalDateTime.of(2021, 5, 1, 0, 0)), TimeNormalizer.parse("2021-05-01"));
    }

    @Test
    void converts_offsets_to_utc() {
        assertEquals(Optional.of(LocalDateTime.of(2021, 5, 1, 6, 0)), TimeNormalizer.parse("2021-05-01T06:00:00Z"));
        assertEquals(Optional.of(LocalDateTime.of(2021, 5, 1, 4, 0)), TimeNormalizer.parse("2021-05-01T06:00:00+02:00"));
    }

    @Test
    void normalize_keeps_unparseable_values() {
        assertEquals("2021-05-01 06:00:00", TimeNormalizer.normalize("2021-05-01T06:00"));
        assertEquals("step-3", TimeNormalizer.normalize("step-3"));
        assertTrue(TimeNormalizer.parse(null).isEmpty());
        assertTrue(TimeNormalizer.parse("  ").isEmpty());
    }
}
