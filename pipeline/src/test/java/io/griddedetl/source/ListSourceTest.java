package io.griddedetl.source;

import io.griddedetl.core.Record;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListSourceTest {
    @Test
    void emits_items_in_order_then_finishes() {
        var src = new ListSource<>(List.of("a", "b"));
        assertFalse(src.isFinished());
        Record<String> r1 = src.poll().orElseThrow();
        Record<String> r2 = src.poll().orElseThrow();
        assertEquals(0, r1.seq());
        assertEquals("a", r1.payload());
        assertEquals(1, r2.seq());
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
    }
}
