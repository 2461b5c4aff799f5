package io.griddedetl.era5.orchestrate;

import io.griddedetl.core.Record;
import io.griddedetl.error.DeadLetterSink;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers which tasks of one stage failed for good, and forwards each to the run's dead-letter file.
 */
final class StageFailures<T extends StageTask> implements DeadLetterSink<T> {
    private final DeadLetterSink<StageTask> deadLetters;
    private final Map<T, Exception> failures = new LinkedHashMap<>();

    StageFailures(DeadLetterSink<StageTask> deadLetters) {
        this.deadLetters = deadLetters;
    }

    @Override
    public void acceptFailure(String stage, Record<T> record, Exception e) {
        synchronized (this) {
            failures.put(record.payload(), e);
        }
        deadLetters.acceptFailure(stage, new Record<>(record.seq(), record.subSeq(), record.payload()), e);
    }

    synchronized Map<T, Exception> failures() {
        return new LinkedHashMap<>(failures);
    }
}
