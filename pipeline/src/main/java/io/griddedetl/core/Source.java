package io.griddedetl.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * Produces the records a pipeline works on. Sources used by the ETL stages are finite: they
 * return empty once drained and report {@link #isFinished()}.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record if one is available now; empty when drained or temporarily idle.
     */
    Optional<Record<T>> poll();

    /** True once no more records will ever be produced. */
    boolean isFinished();

    @Override
    default void close() {}
}
