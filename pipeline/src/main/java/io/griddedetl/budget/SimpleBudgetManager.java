package io.griddedetl.budget;

import java.util.concurrent.Semaphore;

/**
 * Semaphore-backed CPU slot budget.
 */
public class SimpleBudgetManager implements Budget {
    private final Semaphore cpu;
    private final int cpuSlots;

    public SimpleBudgetManager(int cpuSlots) {
        this.cpuSlots = Math.max(1, cpuSlots);
        this.cpu = new Semaphore(this.cpuSlots);
    }

    /** Budget sized to the machine's processors. */
    public static SimpleBudgetManager forAvailableProcessors() {
        return new SimpleBudgetManager(Runtime.getRuntime().availableProcessors());
    }

    @Override
    public boolean tryAcquireCpu() {
        return cpu.tryAcquire();
    }

    @Override
    public void releaseCpu() {
        // never hand out more than configured, even on an unbalanced release
        if (cpu.availablePermits() < cpuSlots) cpu.release();
    }

    @Override
    public int availableCpu() {
        return cpu.availablePermits();
    }

    public int cpuSlots() { return cpuSlots; }
}
