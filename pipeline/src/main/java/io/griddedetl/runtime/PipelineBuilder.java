package io.griddedetl.runtime;

import com.codahale.metrics.MetricRegistry;
import io.griddedetl.budget.Budget;
import io.griddedetl.budget.SimpleBudgetManager;
import io.griddedetl.core.Sink;
import io.griddedetl.core.Source;
import io.griddedetl.core.Transform;
import io.griddedetl.error.DeadLetterSink;
import io.griddedetl.metrics.Metrics;
import io.griddedetl.retry.RetryPolicy;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private String name = "pipeline";
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private Budget budget;
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private int workers = 4;
    private int queueCapacity = 1024;
    private int maxInFlight = 1024;
    private int sinkBatchSize = 16;
    private int sinkFlushEveryMillis = 100;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> deadLetters;

    public PipelineBuilder<I, O> name(String n) { this.name = n; return this; }
    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> budget(Budget b) { this.budget = b; return this; }
    public PipelineBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = w; return this; }
    public PipelineBuilder<I, O> queueCapacity(int c) { this.queueCapacity = c; return this; }
    public PipelineBuilder<I, O> maxInFlight(int n) { this.maxInFlight = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> sinkBatchSize(int n) { this.sinkBatchSize = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> sinkFlushEveryMillis(int ms) { this.sinkFlushEveryMillis = Math.max(0, ms); return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> deadLetters(DeadLetterSink<I> d) { this.deadLetters = d; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Budget b = budget != null ? budget : new SimpleBudgetManager(workers);
        return new Pipeline<>(name, source, transform, sink, b, retryPolicy, workers, queueCapacity, maxInFlight,
                sinkBatchSize, sinkFlushEveryMillis, new Metrics(metricRegistry, MetricRegistry.name("pipeline", name)), deadLetters);
    }
}
