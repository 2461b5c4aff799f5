package io.griddedetl.budget;

/**
 * Shared cap on how many tasks may run at once across every pipeline holding the same budget.
 * Each pipeline still has its own worker pool; the budget bounds their sum.
 */
public interface Budget extends AutoCloseable {
    /** Take a CPU slot without blocking. Returns false when all slots are in use. */
    boolean tryAcquireCpu();

    void releaseCpu();

    /** Slots currently free. */
    int availableCpu();

    @Override
    default void close() {}
}
