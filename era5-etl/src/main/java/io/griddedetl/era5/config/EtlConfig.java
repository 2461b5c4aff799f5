package io.griddedetl.era5.config;

import io.griddedetl.era5.extract.ExtractOptions;
import io.griddedetl.era5.extract.VariableSelection;
import io.griddedetl.era5.join.JoinOptions;
import io.griddedetl.era5.sort.SortOptions;
import io.griddedetl.era5.table.TableEncoding;
import io.griddedetl.era5.table.TableFormat;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Everything a run needs. {@link #fromEnv()} reads {@code -Detl.*} system properties, then
 * {@code ETL_*} environment variables, then defaults; command-line flags override on top.
 */
public record EtlConfig(
        Path inputDir,
        Path outputDir,
        List<String> variables,
        List<String> excludeVariables,
        int decimalPrecision,
        TableFormat format,
        boolean gzip,
        CompressionCodecName parquetCodec,
        int timeChunk,
        boolean keepConstants,
        int chunkSize,
        int maxMemoryRows,
        int extractWorkers,
        int joinWorkers,
        int sortWorkers,
        int cpuSlots,
        int taskRetries,
        int batchSize,
        int batchDelaySeconds,
        boolean keepProcessed,
        boolean sort,
        int sortChunkSize,
        boolean sortBackup,
        int sortBatchSize,
        Integer startYear,
        Integer endYear,
        Path schemaRegistry,
        boolean resume
) {
    public EtlConfig {
        variables = List.copyOf(variables);
        excludeVariables = List.copyOf(excludeVariables);
        if (startYear != null && endYear != null && startYear > endYear) {
            throw new IllegalArgumentException("start year " + startYear + " after end year " + endYear);
        }
        if (batchSize < 1) throw new IllegalArgumentException("batch size must be >= 1");
        if (sortBatchSize < 1) throw new IllegalArgumentException("sort batch size must be >= 1");
        if (taskRetries < 0) throw new IllegalArgumentException("task retries must be >= 0");
    }

    public static EtlConfig fromEnv() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return new EtlConfig(
                Path.of(get("input", "./raw")),
                Path.of(get("output", "./era5")),
                list(get("variables", "")),
                list(get("exclude.variables", String.join(",", VariableSelection.DEFAULT_EXCLUDES.stream().sorted().toList()))),
                Integer.parseInt(get("decimal.precision", "4")),
                TableFormat.parse(get("format", "parquet")),
                "gzip".equalsIgnoreCase(get("compress", "none")),
                CompressionCodecName.valueOf(get("parquet.codec", "snappy").toUpperCase(Locale.ROOT)),
                Integer.parseInt(get("time.chunk", "24")),
                Boolean.parseBoolean(get("keep.constants", "false")),
                Integer.parseInt(get("chunk.size", "10000")),
                Integer.parseInt(get("max.memory.rows", "30000")),
                Integer.parseInt(get("extract.workers", Integer.toString(cpus))),
                Integer.parseInt(get("join.workers", Integer.toString(cpus))),
                Integer.parseInt(get("sort.workers", "1")),
                Integer.parseInt(get("cpu.slots", Integer.toString(cpus))),
                Integer.parseInt(get("task.retries", "0")),
                Integer.parseInt(get("batch.size", "10")),
                Integer.parseInt(get("batch.delay", "0")),
                Boolean.parseBoolean(get("keep.processed", "false")),
                Boolean.parseBoolean(get("sort", "false")),
                Integer.parseInt(get("sort.chunk.size", "100000")),
                Boolean.parseBoolean(get("sort.backup", "false")),
                Integer.parseInt(get("sort.batch.size", "1")),
                optionalInt(get("start.year", "")),
                optionalInt(get("end.year", "")),
                optionalPath(get("schema.registry", "")),
                Boolean.parseBoolean(get("resume", "false")));
    }

    /** {@code etl.max.memory.rows} falls back to {@code ETL_MAX_MEMORY_ROWS}. */
    static String get(String key, String def) {
        String env = "ETL_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
        return System.getProperty("etl." + key, System.getenv().getOrDefault(env, def));
    }

    static List<String> list(String csv) {
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private static Integer optionalInt(String s) {
        return s.isBlank() ? null : Integer.valueOf(s.trim());
    }

    private static Path optionalPath(String s) {
        return s.isBlank() ? null : Path.of(s.trim());
    }

    public TableEncoding encoding() {
        return new TableEncoding(format, gzip, parquetCodec);
    }

    public VariableSelection selection() {
        return new VariableSelection(variables, Set.copyOf(excludeVariables));
    }

    public ExtractOptions extractOptions() {
        return new ExtractOptions(selection(), timeChunk, !keepConstants, decimalPrecision, encoding());
    }

    public JoinOptions joinOptions() {
        return new JoinOptions(selection(), chunkSize, maxMemoryRows, encoding());
    }

    public SortOptions sortOptions() {
        return new SortOptions(sortChunkSize, sortBackup, encoding());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** Copy-and-override, used to lay command-line flags over the environment defaults. */
    public static final class Builder {
        private Path inputDir;
        private Path outputDir;
        private List<String> variables;
        private List<String> excludeVariables;
        private int decimalPrecision;
        private TableFormat format;
        private boolean gzip;
        private CompressionCodecName parquetCodec;
        private int timeChunk;
        private boolean keepConstants;
        private int chunkSize;
        private int maxMemoryRows;
        private int extractWorkers;
        private int joinWorkers;
        private int sortWorkers;
        private int cpuSlots;
        private int taskRetries;
        private int batchSize;
        private int batchDelaySeconds;
        private boolean keepProcessed;
        private boolean sort;
        private int sortChunkSize;
        private boolean sortBackup;
        private int sortBatchSize;
        private Integer startYear;
        private Integer endYear;
        private Path schemaRegistry;
        private boolean resume;

        private Builder(EtlConfig c) {
            inputDir = c.inputDir; outputDir = c.outputDir; variables = c.variables; excludeVariables = c.excludeVariables;
            decimalPrecision = c.decimalPrecision; format = c.format; gzip = c.gzip; parquetCodec = c.parquetCodec;
            timeChunk = c.timeChunk; keepConstants = c.keepConstants; chunkSize = c.chunkSize; maxMemoryRows = c.maxMemoryRows;
            extractWorkers = c.extractWorkers; joinWorkers = c.joinWorkers; sortWorkers = c.sortWorkers; cpuSlots = c.cpuSlots;
            taskRetries = c.taskRetries; batchSize = c.batchSize; batchDelaySeconds = c.batchDelaySeconds;
            keepProcessed = c.keepProcessed; sort = c.sort; sortChunkSize = c.sortChunkSize; sortBackup = c.sortBackup;
            sortBatchSize = c.sortBatchSize; startYear = c.startYear; endYear = c.endYear; schemaRegistry = c.schemaRegistry;
            resume = c.resume;
        }

        public Builder inputDir(Path p) { this.inputDir = p; return this; }
        public Builder outputDir(Path p) { this.outputDir = p; return this; }
        public Builder variables(List<String> v) { this.variables = v; return this; }
        public Builder excludeVariables(List<String> v) { this.excludeVariables = v; return this; }
        public Builder decimalPrecision(int n) { this.decimalPrecision = n; return this; }
        public Builder format(TableFormat f) { this.format = f; return this; }
        public Builder gzip(boolean b) { this.gzip = b; return this; }
        public Builder parquetCodec(CompressionCodecName c) { this.parquetCodec = c; return this; }
        public Builder timeChunk(int n) { this.timeChunk = n; return this; }
        public Builder keepConstants(boolean b) { this.keepConstants = b; return this; }
        public Builder chunkSize(int n) { this.chunkSize = n; return this; }
        public Builder maxMemoryRows(int n) { this.maxMemoryRows = n; return this; }
        public Builder extractWorkers(int n) { this.extractWorkers = n; return this; }
        public Builder joinWorkers(int n) { this.joinWorkers = n; return this; }
        public Builder sortWorkers(int n) { this.sortWorkers = n; return this; }
        public Builder cpuSlots(int n) { this.cpuSlots = n; return this; }
        public Builder taskRetries(int n) { this.taskRetries = n; return this; }
        public Builder batchSize(int n) { this.batchSize = n; return this; }
        public Builder batchDelaySeconds(int n) { this.batchDelaySeconds = n; return this; }
        public Builder keepProcessed(boolean b) { this.keepProcessed = b; return this; }
        public Builder sort(boolean b) { this.sort = b; return this; }
        public Builder sortChunkSize(int n) { this.sortChunkSize = n; return this; }
        public Builder sortBackup(boolean b) { this.sortBackup = b; return this; }
        public Builder sortBatchSize(int n) { this.sortBatchSize = n; return this; }
        public Builder startYear(Integer y) { this.startYear = y; return this; }
        public Builder endYear(Integer y) { this.endYear = y; return this; }
        public Builder schemaRegistry(Path p) { this.schemaRegistry = p; return this; }
        public Builder resume(boolean b) { this.resume = b; return this; }

        public EtlConfig build() {
            return new EtlConfig(inputDir, outputDir, variables, excludeVariables, decimalPrecision, format, gzip,
                    parquetCodec, timeChunk, keepConstants, chunkSize, maxMemoryRows, extractWorkers, joinWorkers,
                    sortWorkers, cpuSlots, taskRetries, batchSize, batchDelaySeconds, keepProcessed, sort, sortChunkSize,
                    sortBackup, sortBatchSize, startYear, endYear, schemaRegistry, resume);
        }
    }
}
