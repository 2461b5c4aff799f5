package io.griddedetl.sink;

import io.griddedetl.core.BatchSink;
import io.griddedetl.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every payload it receives, in delivery order. Used by the ETL stages to hand task
 * outcomes back to the thread that started the pipeline.
 */
public class CollectingSink<T> implements BatchSink<T> {
    private final List<T> received = new ArrayList<>();

    @Override
    public synchronized void accept(Record<T> record) {
        received.add(record.payload());
    }

    @Override
    public synchronized void acceptBatch(List<Record<T>> records) {
        for (Record<T> r : records) received.add(r.payload());
    }

    public synchronized List<T> results() {
        return List.copyOf(received);
    }
}
