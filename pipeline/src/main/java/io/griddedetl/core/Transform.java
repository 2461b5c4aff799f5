package io.griddedetl.core;

import java.util.List;

/**
 * Turns one input record into zero or more outputs. Outputs keep the input's seq; subSeq orders
 * them when there is more than one.
 */
@FunctionalInterface
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;
}
