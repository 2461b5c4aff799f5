package io.griddedetl.runtime;

import com.codahale.metrics.MetricRegistry;
import io.griddedetl.budget.SimpleBudgetManager;
import io.griddedetl.core.Record;
import io.griddedetl.core.Transform;
import io.griddedetl.error.DeadLetterSink;
import io.griddedetl.retry.ExponentialBackoffRetryPolicy;
import io.griddedetl.sink.CollectingSink;
import io.griddedetl.source.ListSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PipelineTest {

    @Test
    void transform_retries_then_succeeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Transform<String, String> flaky = r -> {
            if (calls.getAndIncrement() == 0) throw new IOException("transient");
            return List.of(Record.of(r, r.payload().toUpperCase()));
        };
        var sink = new CollectingSink<String>();
        var pipeline = new PipelineBuilder<String, String>()
                .name("flaky")
                .source(new ListSource<>(List.of("a")))
                .transform(flaky)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 10))
                .workers(1)
                .build();
        pipeline.run();

        assertEquals(List.of("A"), sink.results());
        assertEquals(2, calls.get());
        assertFalse(pipeline.isRunning());
        assertEquals(0, pipeline.getInflight());
        assertEquals(0, pipeline.getQueueSize());
    }

    @Test
    void preserves_submission_order_with_parallel_workers() throws Exception {
        List<Integer> input = new ArrayList<>();
        for (int i = 0; i < 40; i++) input.add(i);
        Transform<Integer, Integer> slowForEvens = r -> {
            if (r.payload() % 2 == 0) Thread.sleep(5);
            return List.of(Record.of(r, r.payload()));
        };
        var sink = new CollectingSink<Integer>();
        var pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(input))
                .transform(slowForEvens)
                .sink(sink)
                .budget(new SimpleBudgetManager(8))
                .workers(8)
                .queueCapacity(8)
                .metrics(new MetricRegistry())
                .build();
        pipeline.run();

        assertEquals(input, sink.results());
    }

    @Test
    void failed_record_goes_to_dead_letters_without_stalling_later_records() throws Exception {
        List<String> failedStages = Collections.synchronizedList(new ArrayList<>());
        DeadLetterSink<Integer> dlq = (stage, record, e) -> failedStages.add(stage + ":" + record.payload());
        Transform<Integer, Integer> failOnTwo = r -> {
            if (r.payload() == 2) throw new IllegalStateException("boom");
            return List.of(Record.of(r, r.payload() * 10));
        };
        var sink = new CollectingSink<Integer>();
        var pipeline = new PipelineBuilder<Integer, Integer>()
                .name("extract")
                .source(new ListSource<>(List.of(1, 2, 3, 4)))
                .transform(failOnTwo)
                .sink(sink)
                .workers(2)
                .sinkBatchSize(1)
                .deadLetters(dlq)
                .build();
        pipeline.run();

        assertEquals(List.of(10, 30, 40), sink.results());
        assertEquals(List.of("extract:2"), failedStages);
    }

    @Test
    void workers_never_exceed_shared_budget() throws Exception {
        var budget = new SimpleBudgetManager(2);
        AtomicInteger concurrent = new AtomicInteger();
        Peak peak = new Peak();
        Transform<Integer, Integer> t = r -> {
            int now = concurrent.incrementAndGet();
            peak.record(now);
            Thread.sleep(10);
            concurrent.decrementAndGet();
            return List.of(Record.of(r, r.payload()));
        };
        var pipeline = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(List.of(1, 2, 3, 4, 5, 6, 7, 8)))
                .transform(t)
                .sink(new CollectingSink<>())
                .budget(budget)
                .workers(6)
                .build();
        pipeline.run();

        assertTrue(peak.max() <= 2, "peak concurrency " + peak.max());
        assertEquals(2, budget.availableCpu());
    }

    private static final class Peak {
        private final ConcurrentHashMap<String, Integer> max = new ConcurrentHashMap<>();
        void record(int v) { max.merge("max", v, Math::max); }
        int max() { return max.getOrDefault("max", 0); }
    }
}
