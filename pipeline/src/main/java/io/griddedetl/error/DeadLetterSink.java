package io.griddedetl.error;

import io.griddedetl.core.Record;

/**
 * Receives records whose processing failed for good, after retries are exhausted.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);

    @Override
    default void close() {}
}
