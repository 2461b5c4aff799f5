package io.griddedetl.core;

import java.util.List;

/** Sink that prefers to receive several records per call. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;
}
