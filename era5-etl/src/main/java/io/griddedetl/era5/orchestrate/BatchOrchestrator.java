package io.griddedetl.era5.orchestrate;

import com.codahale.metrics.MetricRegistry;
import io.griddedetl.budget.Budget;
import io.griddedetl.core.Record;
import io.griddedetl.core.Transform;
import io.griddedetl.error.DeadLetterSink;
import io.griddedetl.error.FileDeadLetterSink;
import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.extract.DecodeException;
import io.griddedetl.era5.extract.ExtractResult;
import io.griddedetl.era5.extract.VariableExtractor;
import io.griddedetl.era5.join.CoordinateJoiner;
import io.griddedetl.era5.join.JoinException;
import io.griddedetl.era5.join.JoinResult;
import io.griddedetl.era5.logging.TaskLogs;
import io.griddedetl.era5.model.OutputLayout;
import io.griddedetl.era5.model.ProcessingUnit;
import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.model.UnitState;
import io.griddedetl.era5.sort.ChronologicalSorter;
import io.griddedetl.era5.sort.SortException;
import io.griddedetl.era5.sort.SortResult;
import io.griddedetl.metrics.Metrics;
import io.griddedetl.retry.ExponentialBackoffRetryPolicy;
import io.griddedetl.retry.RetryPolicy;
import io.griddedetl.runtime.Pipeline;
import io.griddedetl.runtime.PipelineBuilder;
import io.griddedetl.sink.CollectingSink;
import io.griddedetl.source.ListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Drives discovered raw files through extract, join, cleanup and the optional sort pass, one batch
 * of processing units at a time. Each stage runs on its own bounded {@link Pipeline}; all of them
 * draw CPU slots from one shared {@link Budget}. Failures stay with the unit (or batch) they hit.
 */
public class BatchOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EtlConfig config;
    private final OutputLayout layout;
    private final FileDiscovery discovery;
    private final VariableExtractor extractor;
    private final CoordinateJoiner joiner;
    private final ChronologicalSorter sorter;
    private final Budget budget;
    private final MetricRegistry registry;
    private final Metrics metrics;

    public BatchOrchestrator(EtlConfig config,
                             FileDiscovery discovery,
                             VariableExtractor extractor,
                             CoordinateJoiner joiner,
                             ChronologicalSorter sorter,
                             Budget budget,
                             MetricRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.layout = new OutputLayout(config.outputDir());
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.joiner = Objects.requireNonNull(joiner, "joiner");
        this.sorter = Objects.requireNonNull(sorter, "sorter");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = new Metrics(registry, "etl");
    }

    public OutputLayout layout() { return layout; }

    public RunSummary run() throws DiscoveryException, IOException {
        long started = System.currentTimeMillis();
        Files.createDirectories(layout.logs());
        Path runLog = layout.logs().resolve("pipeline_" + RUN_STAMP.format(LocalDateTime.now()) + ".log");
        try (TaskLogs.Handle ignored = TaskLogs.run(runLog)) {
            RunSummary summary = execute(started);
            LOG.info("run finished: {}", summary.describe());
            if (!summary.failedUnits().isEmpty()) LOG.warn("failed units: {}", summary.failedUnits());
            return summary;
        }
    }

    private RunSummary execute(long started) throws DiscoveryException, IOException {
        LOG.info("input {}, output {}", config.inputDir(), config.outputDir());
        List<Path> undated = new ArrayList<>();
        List<DiscoveredFile> files = discovery.discover(config.inputDir(), undated);

        Map<UnitKey, ProcessingUnit> units = new TreeMap<>();
        for (DiscoveredFile f : files) units.computeIfAbsent(f.unit(), ProcessingUnit::new).addRawFile(f.path());
        LOG.info("{} raw file(s) in {} unit(s), {} file(s) without a derivable month", files.size(), units.size(), undated.size());

        UnitIndex index = UnitIndex.load(layout.unitIndex());
        List<ProcessingUnit> pending = new ArrayList<>();
        int resumed = 0;
        for (ProcessingUnit u : units.values()) {
            if (config.resume() && restore(u, index)) {
                resumed++;
                LOG.info("{}: resumed as {}", u.key(), u.state());
            } else {
                pending.add(u);
            }
        }

        FileDeadLetterSink<StageTask> deadLetters = new FileDeadLetterSink<>(layout.deadLetters(), StageTask::id);
        Counts counts = new Counts();
        List<CleanupWarning> warnings = new ArrayList<>();
        int failedBatches = 0;
        int batches = (pending.size() + config.batchSize() - 1) / config.batchSize();
        for (int b = 0; b < batches; b++) {
            List<ProcessingUnit> batch = pending.subList(b * config.batchSize(), Math.min(pending.size(), (b + 1) * config.batchSize()));
            LOG.info("batch {}/{}: {} unit(s) from {} to {}", b + 1, batches, batch.size(),
                    batch.get(0).key(), batch.get(batch.size() - 1).key());

            extract(batch, deadLetters, counts);
            List<ProcessingUnit> extracted = batch.stream().filter(u -> u.state() == UnitState.EXTRACTED).toList();
            if (extracted.isEmpty()) {
                failedBatches++;
                LOG.error("batch {}/{}: no unit extracted, skipping join", b + 1, batches);
                record(index, batch);
                continue;
            }
            join(extracted, deadLetters, counts);
            if (!config.keepProcessed()) warnings.addAll(cleanup(extracted, counts));
            record(index, batch);

            if (b + 1 < batches && config.batchDelaySeconds() > 0) {
                LOG.info("waiting {}s before the next batch", config.batchDelaySeconds());
                try {
                    Thread.sleep(config.batchDelaySeconds() * 1000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("interrupted between batches, stopping after batch {}", b + 1);
                    break;
                }
            }
        }

        if (config.sort()) {
            List<ProcessingUnit> sortable = units.values().stream()
                    .filter(u -> u.state() == UnitState.JOINED || u.state() == UnitState.CLEANED)
                    .filter(u -> u.joinedFile() != null)
                    .toList();
            sortUnits(sortable, deadLetters, counts);
            record(index, sortable);
        }

        List<UnitKey> failed = units.values().stream().filter(u -> u.state().isFailure()).map(ProcessingUnit::key).toList();
        return new RunSummary(files.size(), undated.size(), units.size(), resumed,
                counts.extract(), counts.join(), counts.sort(), counts.cleaned, warnings, failedBatches, failed,
                System.currentTimeMillis() - started);
    }

    /** Takes a unit's state from the index when its joined output is still on disk. */
    private boolean restore(ProcessingUnit unit, UnitIndex index) {
        return index.lookup(unit.key())
                .filter(e -> e.state().hasJoinedOutput() && !e.state().isFailure())
                .filter(e -> e.joinedFile() != null && Files.isRegularFile(e.joinedFile()))
                .map(e -> {
                    unit.restore(e.state(), e.joinedFile());
                    return true;
                })
                .orElse(false);
    }

    private void extract(List<ProcessingUnit> batch, DeadLetterSink<StageTask> deadLetters, Counts counts) throws IOException {
        List<ExtractTask> tasks = new ArrayList<>();
        for (ProcessingUnit u : batch) {
            u.moveTo(UnitState.EXTRACTING);
            for (Path f : u.rawFiles()) tasks.add(new ExtractTask(u.key(), f));
        }
        StageRun<ExtractTask, ExtractResult> run = runStage("extract", tasks, config.extractWorkers(), this::extractOne, deadLetters);

        Set<UnitKey> ok = new HashSet<>();
        for (ExtractResult r : run.results()) ok.add(r.unit());
        Map<UnitKey, String> reasons = new HashMap<>();
        run.failures().forEach((t, e) -> reasons.merge(t.unit(), t.file().getFileName() + ": " + e.getMessage(), (a, c) -> a + "; " + c));
        for (ProcessingUnit u : batch) {
            if (ok.contains(u.key())) {
                u.moveTo(UnitState.EXTRACTED);
                counts.extractOk++;
                metrics.counter("extract.succeeded").inc();
            } else {
                u.fail(UnitState.EXTRACT_FAILED, reasons.getOrDefault(u.key(), "no file extracted"));
                counts.extractFailed++;
                metrics.counter("extract.failed").inc();
                LOG.error("{}: extraction failed: {}", u.key(), u.failure());
            }
        }
    }

    private List<Record<ExtractResult>> extractOne(Record<ExtractTask> in) throws DecodeException {
        ExtractTask t = in.payload();
        try (TaskLogs.Handle ignored = TaskLogs.task(t.id(), layout.logs().resolve(t.id() + ".log"))) {
            LOG.info("extracting {} for {}", t.file(), t.unit());
            try {
                ExtractResult r = extractor.extract(t.file(), t.unit(), layout.processed());
                LOG.info("extracted {} variable(s), {} failed, {} row(s)", r.extracted().size(), r.failed().size(), r.rows());
                return List.of(Record.of(in, r));
            } catch (DecodeException e) {
                LOG.error("extraction of {} failed: {}", t.file().getFileName(), e.getMessage());
                throw e;
            }
        }
    }

    private void join(List<ProcessingUnit> units, DeadLetterSink<StageTask> deadLetters, Counts counts) throws IOException {
        List<JoinTask> tasks = new ArrayList<>();
        for (ProcessingUnit u : units) {
            u.moveTo(UnitState.JOINING);
            tasks.add(new JoinTask(u.key(), layout.joinedFile(u.key(), config.encoding().extension())));
        }
        StageRun<JoinTask, JoinResult> run = runStage("join", tasks, config.joinWorkers(), this::joinOne, deadLetters);

        Map<UnitKey, JoinResult> ok = new HashMap<>();
        for (JoinResult r : run.results()) ok.put(r.unit(), r);
        Map<UnitKey, String> reasons = new HashMap<>();
        run.failures().forEach((t, e) -> reasons.put(t.unit(), e.getMessage()));
        for (ProcessingUnit u : units) {
            JoinResult r = ok.get(u.key());
            if (r != null) {
                u.joinedFile(r.output());
                u.moveTo(UnitState.JOINED);
                counts.joinOk++;
                metrics.counter("join.succeeded").inc();
            } else {
                u.fail(UnitState.JOIN_FAILED, reasons.getOrDefault(u.key(), "join produced no output"));
                counts.joinFailed++;
                metrics.counter("join.failed").inc();
                LOG.error("{}: join failed: {}", u.key(), u.failure());
            }
        }
    }

    private List<Record<JoinResult>> joinOne(Record<JoinTask> in) throws JoinException {
        JoinTask t = in.payload();
        try (TaskLogs.Handle ignored = TaskLogs.task(t.id(), layout.logs().resolve(t.id() + ".log"))) {
            LOG.info("joining {} into {}", t.unit(), t.output());
            try {
                JoinResult r = joiner.join(t.unit(), layout.processed(), t.output());
                if (!r.skipped().isEmpty()) LOG.warn("variables left out: {}", r.skipped());
                return List.of(Record.of(in, r));
            } catch (JoinException e) {
                LOG.error("join of {} failed: {}", t.unit(), e.getMessage());
                throw e;
            }
        }
    }

    /** Removes processed data of joined units whose joined file is on disk. */
    private List<CleanupWarning> cleanup(List<ProcessingUnit> units, Counts counts) {
        List<CleanupWarning> warnings = new ArrayList<>();
        for (ProcessingUnit u : units) {
            if (u.state() != UnitState.JOINED) continue;
            if (u.joinedFile() == null || !Files.isRegularFile(u.joinedFile())) {
                warnings.add(warn(u.key(), "joined file missing, processed data kept"));
                continue;
            }
            Path dir = layout.processedUnit(u.key());
            try {
                deleteTree(dir);
                u.moveTo(UnitState.CLEANED);
                counts.cleaned++;
                LOG.info("{}: removed {}", u.key(), dir);
            } catch (IOException e) {
                warnings.add(warn(u.key(), "could not remove " + dir + ": " + e.getMessage()));
            }
        }
        return warnings;
    }

    private static CleanupWarning warn(UnitKey unit, String message) {
        LOG.warn("{}: cleanup: {}", unit, message);
        return new CleanupWarning(unit, message);
    }

    private void sortUnits(List<ProcessingUnit> units, DeadLetterSink<StageTask> deadLetters, Counts counts) throws IOException {
        List<SortTask> tasks = new ArrayList<>();
        for (int i = 0; i < units.size(); i += config.sortBatchSize()) {
            List<ProcessingUnit> group = units.subList(i, Math.min(units.size(), i + config.sortBatchSize()));
            tasks.add(new SortTask(group.stream().map(ProcessingUnit::key).toList(),
                    group.stream().map(ProcessingUnit::joinedFile).toList()));
        }
        LOG.info("sorting {} joined table(s) in {} task(s)", units.size(), tasks.size());
        StageRun<SortTask, SortOutcome> run = runStage("sort", tasks, config.sortWorkers(), this::sortBatch, deadLetters);

        Map<UnitKey, SortOutcome> outcomes = new HashMap<>();
        for (SortOutcome o : run.results()) outcomes.put(o.unit(), o);
        run.failures().forEach((t, e) -> {
            for (int i = 0; i < t.files().size(); i++) {
                outcomes.put(t.units().get(i), SortOutcome.failed(t.units().get(i), t.files().get(i), String.valueOf(e.getMessage())));
            }
        });
        for (ProcessingUnit u : units) {
            SortOutcome o = outcomes.get(u.key());
            if (o != null && o.succeeded()) {
                u.moveTo(UnitState.SORTED);
                counts.sortOk++;
                metrics.counter("sort.succeeded").inc();
            } else {
                u.fail(UnitState.SORT_FAILED, o == null ? "no sort outcome" : o.error());
                counts.sortFailed++;
                metrics.counter("sort.failed").inc();
            }
        }
    }

    /** Sorts tables outside any run, for the {@code sort} subcommand. */
    public StageCount sortTables(List<Path> tables) throws IOException {
        Files.createDirectories(layout.logs());
        FileDeadLetterSink<StageTask> deadLetters = new FileDeadLetterSink<>(layout.deadLetters(), StageTask::id);
        List<SortTask> tasks = new ArrayList<>();
        for (int i = 0; i < tables.size(); i += config.sortBatchSize()) {
            List<Path> group = tables.subList(i, Math.min(tables.size(), i + config.sortBatchSize()));
            List<UnitKey> none = new ArrayList<>();
            group.forEach(g -> none.add(null));
            tasks.add(new SortTask(none, group));
        }
        StageRun<SortTask, SortOutcome> run = runStage("sort", tasks, config.sortWorkers(), this::sortBatch, deadLetters);
        int ok = (int) run.results().stream().filter(SortOutcome::succeeded).count();
        int failed = run.results().size() - ok;
        for (SortTask t : run.failures().keySet()) failed += t.files().size();
        LOG.info("sorted {} table(s), {} failed", ok, failed);
        return new StageCount(ok, failed);
    }

    private List<Record<SortOutcome>> sortBatch(Record<SortTask> in) {
        SortTask t = in.payload();
        List<Record<SortOutcome>> out = new ArrayList<>();
        try (TaskLogs.Handle ignored = TaskLogs.task(t.id(), layout.logs().resolve(t.id() + ".log"))) {
            for (int i = 0; i < t.files().size(); i++) {
                Path file = t.files().get(i);
                UnitKey unit = t.units().get(i);
                SortOutcome o;
                try {
                    SortResult r = sorter.sort(file);
                    o = SortOutcome.sorted(unit, r);
                } catch (SortException e) {
                    LOG.error("sorting {} failed: {}", file, e.getMessage());
                    o = SortOutcome.failed(unit, file, e.getMessage());
                } catch (RuntimeException e) {
                    // keep the other files of this task
                    LOG.error("sorting {} failed unexpectedly", file, e);
                    o = SortOutcome.failed(unit, file, String.valueOf(e));
                }
                out.add(new Record<>(in.seq(), i, o));
            }
        }
        return out;
    }

    private <T extends StageTask, R> StageRun<T, R> runStage(String stage, List<T> tasks, int workers,
                                                             Transform<T, R> transform,
                                                             DeadLetterSink<StageTask> deadLetters) throws IOException {
        CollectingSink<R> sink = new CollectingSink<>();
        StageFailures<T> failures = new StageFailures<>(deadLetters);
        if (tasks.isEmpty()) return new StageRun<>(List.of(), Map.of());
        Pipeline<T, R> pipeline = new PipelineBuilder<T, R>()
                .name(stage)
                .source(new ListSource<>(tasks))
                .transform(transform)
                .sink(sink)
                .budget(budget)
                .retry(retryPolicy())
                .workers(Math.max(1, Math.min(workers, tasks.size())))
                .metrics(registry)
                .deadLetters(failures)
                .build();
        try {
            pipeline.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipeline.close();
            throw new IOException(stage + " stage interrupted", e);
        }
        return new StageRun<>(sink.results(), failures.failures());
    }

    private RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(1 + config.taskRetries(), 1_000, 30_000);
    }

    private static void record(UnitIndex index, List<ProcessingUnit> units) throws IOException {
        for (ProcessingUnit u : units) index.update(u.key(), u.state(), u.joinedFile());
        index.save();
    }

    static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> s = Files.walk(dir)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) Files.delete(p);
        }
    }

    private record StageRun<T, R>(List<R> results, Map<T, Exception> failures) {}

    private static final class Counts {
        int extractOk, extractFailed, joinOk, joinFailed, sortOk, sortFailed, cleaned;

        StageCount extract() { return new StageCount(extractOk, extractFailed); }
        StageCount join() { return new StageCount(joinOk, joinFailed); }
        StageCount sort() { return new StageCount(sortOk, sortFailed); }
    }
}
