package io.griddedetl.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimpleBudgetManagerTest {
    @Test
    void hands_out_at_most_configured_slots() {
        var budget = new SimpleBudgetManager(2);
        assertTrue(budget.tryAcquireCpu());
        assertTrue(budget.tryAcquireCpu());
        assertFalse(budget.tryAcquireCpu());
        budget.releaseCpu();
        assertEquals(1, budget.availableCpu());
    }

    @Test
    void extra_release_does_not_grow_the_budget() {
        var budget = new SimpleBudgetManager(1);
        budget.releaseCpu();
        assertEquals(1, budget.availableCpu());
    }

    @Test
    void zero_slots_is_raised_to_one() {
        assertEquals(1, new SimpleBudgetManager(0).cpuSlots());
    }
}
