package io.griddedetl.core;

import java.io.Closeable;

/**
 * Consumes transform outputs. The pipeline calls a sink from a single thread in (seq, subSeq) order.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
