package io.griddedetl.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.griddedetl.budget.Budget;
import io.griddedetl.core.BatchSink;
import io.griddedetl.core.Record;
import io.griddedetl.core.Sink;
import io.griddedetl.core.Source;
import io.griddedetl.core.Transform;
import io.griddedetl.error.DeadLetterSink;
import io.griddedetl.metrics.Metrics;
import io.griddedetl.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-source -> single-transform -> single-sink pipeline over a bounded worker pool.
 * <p>
 * A source thread hands records to {@code workers} threads; each worker applies the transform
 * (with retries, holding a CPU slot from the shared {@link Budget}) and queues the outputs; one
 * sink thread restores seq order and flushes in batches. A record that fails for good goes to the
 * dead-letter sink and leaves an empty slot in the ordering, so later records are not held back.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final Budget budget;
    private final RetryPolicy retryPolicy;
    private final int workers;
    private final int maxInFlight;
    private final int sinkBatchSize;
    private final int sinkFlushEveryMillis;
    private final DeadLetterSink<I> deadLetters;

    private final ExecutorService workerPool;
    private final ArrayBlockingQueue<Batch<O>> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private volatile Thread srcThread;
    private volatile Thread sinkThread;

    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Counter retryCounter;
    private final Counter sinkFlushes;

    Pipeline(String name,
             Source<I> source,
             Transform<I, O> transform,
             Sink<O> sink,
             Budget budget,
             RetryPolicy retryPolicy,
             int workers,
             int queueCapacity,
             int maxInFlight,
             int sinkBatchSize,
             int sinkFlushEveryMillis,
             Metrics metrics,
             DeadLetterSink<I> deadLetters) {
        this.name = Objects.requireNonNull(name);
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.budget = Objects.requireNonNull(budget);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.workers = Math.max(1, workers);
        this.maxInFlight = Math.max(1, maxInFlight);
        this.sinkBatchSize = Math.max(1, sinkBatchSize);
        this.sinkFlushEveryMillis = Math.max(0, sinkFlushEveryMillis);
        this.deadLetters = deadLetters;
        this.workerPool = Executors.newFixedThreadPool(this.workers, r -> {
            Thread t = new Thread(r);
            t.setName(name + "-worker-" + t.getId());
            return t;
        });
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        Objects.requireNonNull(metrics);
        this.transformTimer = metrics.timer("transform.time");
        this.sinkTimer = metrics.timer("sink.time");
        this.inMeter = metrics.meter("input.rate");
        this.outMeter = metrics.meter("output.rate");
        this.errorMeter = metrics.meter("error.rate");
        this.retryCounter = metrics.counter("retries");
        this.sinkFlushes = metrics.counter("sink.flushes");
    }

    public String name() { return name; }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        srcThread = new Thread(this::runSource, name + "-source");
        srcThread.start();
        // single sink thread keeps delivery ordered
        sinkThread = new Thread(this::runSink, name + "-sink");
        sinkThread.start();
    }

    /**
     * Blocks until the source is drained and every output has reached the sink, then releases
     * the worker pool. Only meaningful for finite sources.
     */
    public void awaitCompletion() throws InterruptedException {
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st != null) st.join();
        if (kt != null) kt.join();
        running.set(false);
        workerPool.shutdown();
        workerPool.awaitTermination(1, TimeUnit.MINUTES);
    }

    /** Start, then wait for a finite source to be fully processed. */
    public void run() throws InterruptedException {
        start();
        awaitCompletion();
    }

    public void stop() {
        running.set(false);
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st != null) { try { st.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        if (kt != null) { try { kt.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        workerPool.shutdown();
    }

    public boolean isRunning() { return running.get(); }
    public int getQueueSize() { return queue.size(); }
    public int getInflight() { return inflight.get(); }

    private void runSource() {
        try {
            while (running.get()) {
                // backpressure: cap submitted but unfinished tasks
                if (inflight.get() >= maxInFlight) { sleepQuiet(1); continue; }
                Optional<Record<I>> opt = source.poll();
                if (opt.isEmpty()) {
                    if (source.isFinished()) break;
                    sleepQuiet(1);
                    continue;
                }
                inMeter.mark();
                Record<I> in = opt.get();
                inflight.incrementAndGet();
                workerPool.submit(() -> process(in));
            }
            while (inflight.get() > 0) { sleepQuiet(5); }
        } finally {
            offerQuiet(Batch.poison());
        }
    }

    private void process(Record<I> in) {
        while (!budget.tryAcquireCpu()) {
            sleepQuiet(1);
        }
        try {
            int attempt = 0;
            while (true) {
                attempt++;
                try (Timer.Context ignored = transformTimer.time()) {
                    List<Record<O>> outputs = transform.apply(in);
                    List<Record<O>> ordered = outputs == null ? new ArrayList<>() : new ArrayList<>(outputs);
                    ordered.sort(Comparator.comparingInt(Record::subSeq));
                    queue.put(Batch.of(in.seq(), ordered));
                    return;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    offerQuiet(Batch.of(in.seq(), List.of()));
                    return;
                } catch (Exception e) {
                    errorMeter.mark();
                    if (retryPolicy.shouldRetry(attempt, e)) {
                        retryCounter.inc();
                        LOG.warn("{}: attempt {} for record {} failed, retrying: {}", name, attempt, in.seq(), e.toString());
                        sleepQuiet(retryPolicy.backoffMillis(attempt));
                        continue;
                    }
                    LOG.error("{}: record {} failed after {} attempt(s)", name, in.seq(), attempt, e);
                    if (deadLetters != null) deadLetters.acceptFailure(name, in, e);
                    offerQuiet(Batch.of(in.seq(), List.of()));
                    return;
                }
            }
        } finally {
            budget.releaseCpu();
            inflight.decrementAndGet();
        }
    }

    private void runSink() {
        List<Record<O>> emitBuffer = new ArrayList<>();
        TreeMap<Long, Batch<O>> pending = new TreeMap<>();
        long expectedSeq = 0;
        try {
            while (true) {
                Batch<O> batch = sinkFlushEveryMillis > 0
                        ? queue.poll(sinkFlushEveryMillis, TimeUnit.MILLISECONDS)
                        : queue.take();
                if (batch == null) {
                    flushQuiet(emitBuffer);
                    continue;
                }
                if (batch.isPoison()) {
                    // anything still pending belongs to a gap that will never fill; deliver it in order
                    for (Batch<O> rest : pending.values()) emitBuffer.addAll(rest.items);
                    flushQuiet(emitBuffer);
                    return;
                }
                pending.put(batch.seq, batch);
                Batch<O> ready;
                while ((ready = pending.remove(expectedSeq)) != null) {
                    emitBuffer.addAll(ready.items);
                    if (emitBuffer.size() >= sinkBatchSize) flushQuiet(emitBuffer);
                    expectedSeq++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void flushQuiet(List<Record<O>> records) {
        if (records.isEmpty()) return;
        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> bs) {
                bs.acceptBatch(records);
            } else {
                for (Record<O> r : records) sink.accept(r);
            }
            outMeter.mark(records.size());
            sinkFlushes.inc();
        } catch (Exception e) {
            errorMeter.mark();
            LOG.error("{}: sink rejected {} record(s)", name, records.size(), e);
        } finally {
            records.clear();
        }
    }

    private void offerQuiet(Batch<O> batch) {
        try {
            queue.put(batch);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    @Override
    public void close() {
        stop();
        workerPool.shutdownNow();
    }

    static final class Batch<T> {
        final long seq;
        final List<Record<T>> items;
        private final boolean poison;

        private Batch(long seq, List<Record<T>> items, boolean poison) {
            this.seq = seq; this.items = items; this.poison = poison;
        }
        static <T> Batch<T> of(long seq, List<Record<T>> items) { return new Batch<>(seq, items, false); }
        static <T> Batch<T> poison() { return new Batch<>(Long.MAX_VALUE, List.of(), true); }
        boolean isPoison() { return poison; }
    }
}
