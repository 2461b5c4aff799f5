package io.griddedetl.source;

import io.griddedetl.core.Record;
import io.griddedetl.core.Source;

import java.util.List;
import java.util.Optional;

/**
 * Emits a fixed list of payloads in list order, seq = list index.
 */
public class ListSource<T> implements Source<T> {
    private final List<T> items;
    private int idx = 0;

    public ListSource(List<T> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public synchronized Optional<Record<T>> poll() {
        if (idx >= items.size()) return Optional.empty();
        Record<T> r = new Record<>(idx, 0, items.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public synchronized boolean isFinished() {
        return idx >= items.size();
    }

    public int size() { return items.size(); }
}
