package io.griddedetl.core;

import java.util.Comparator;

/**
 * A unit of work flowing through a {@link io.griddedetl.runtime.Pipeline}: the payload plus the
 * ordering information the sink uses to emit results in submission order.
 *
 * @param seq    position assigned by the source, monotonically increasing
 * @param subSeq position within the outputs a transform produced for one input
 * @param payload the task or result carried by this record
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {
    private static final Comparator<Record<?>> ORDER =
            Comparator.<Record<?>>comparingLong(Record::seq).thenComparingInt(Record::subSeq);

    /** Output record for the same position as {@code input}. */
    public static <T> Record<T> of(Record<?> input, T payload) {
        return new Record<>(input.seq(), 0, payload);
    }

    @Override
    public int compareTo(Record<?> o) {
        return ORDER.compare(this, o);
    }
}
