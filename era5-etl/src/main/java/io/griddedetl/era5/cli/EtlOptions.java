package io.griddedetl.era5.cli;

import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.table.TableFormat;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Flags shared by the subcommands. Unset flags keep the value from {@link EtlConfig#fromEnv()}.
 */
public class EtlOptions {
    @CommandLine.Option(names = "--variables", split = ",", description = "Only these variables (comma-separated)")
    List<String> variables;

    @CommandLine.Option(names = "--exclude-variables", split = ",", description = "Skip these variables; default 10fg,cbh,cin,cp,i10fg,lsp,tp,vimd")
    List<String> excludeVariables;

    @CommandLine.Option(names = "--decimal-precision", description = "Decimals kept on latitude/longitude (default 4, negative keeps all)")
    Integer decimalPrecision;

    @CommandLine.Option(names = "--format", description = "Table format: csv or parquet")
    String format;

    @CommandLine.Option(names = "--compress", description = "CSV compression: none or gzip")
    String compress;

    @CommandLine.Option(names = "--parquet-codec", description = "Parquet codec, e.g. snappy, gzip, zstd, uncompressed")
    String parquetCodec;

    @CommandLine.Option(names = "--time-chunk", description = "Time steps per extracted file (default 24)")
    Integer timeChunk;

    @CommandLine.Option(names = "--keep-constants", description = "Keep columns that are constant within a chunk")
    Boolean keepConstants;

    @CommandLine.Option(names = "--chunk-size", description = "Rows read at a time while joining (default 10000)")
    Integer chunkSize;

    @CommandLine.Option(names = "--max-memory-rows", description = "Rows buffered per variable before staging (default 30000)")
    Integer maxMemoryRows;

    @CommandLine.Option(names = "--extract-workers", description = "Extraction pool size")
    Integer extractWorkers;

    @CommandLine.Option(names = "--join-workers", description = "Join pool size")
    Integer joinWorkers;

    @CommandLine.Option(names = "--sort-workers", description = "Sort pool size (default 1)")
    Integer sortWorkers;

    @CommandLine.Option(names = "--cpu-slots", description = "CPU slots shared by all pools")
    Integer cpuSlots;

    @CommandLine.Option(names = "--task-retries", description = "Extra attempts per failed task (default 0)")
    Integer taskRetries;

    @CommandLine.Option(names = "--schema-registry", description = "Properties file of variable=time,latitude,longitude,value")
    Path schemaRegistry;

    @CommandLine.Option(names = "--sort-chunk-size", description = "Rows read at a time while sorting (default 100000)")
    Integer sortChunkSize;

    @CommandLine.Option(names = "--sort-backup", description = "Copy each table into backup/ before sorting it")
    Boolean sortBackup;

    @CommandLine.Option(names = "--sort-batch-size", description = "Tables per sort task (default 1)")
    Integer sortBatchSize;

    EtlConfig.Builder apply(EtlConfig.Builder b) {
        if (variables != null) b.variables(variables);
        if (excludeVariables != null) b.excludeVariables(excludeVariables);
        if (decimalPrecision != null) b.decimalPrecision(decimalPrecision);
        if (format != null) b.format(TableFormat.parse(format));
        if (compress != null) {
            if (!compress.equalsIgnoreCase("gzip") && !compress.equalsIgnoreCase("none")) {
                throw new CommandLine.PicocliException("--compress must be none or gzip");
            }
            b.gzip(compress.equalsIgnoreCase("gzip"));
        }
        if (parquetCodec != null) b.parquetCodec(CompressionCodecName.valueOf(parquetCodec.toUpperCase(Locale.ROOT)));
        if (timeChunk != null) b.timeChunk(timeChunk);
        if (keepConstants != null) b.keepConstants(keepConstants);
        if (chunkSize != null) b.chunkSize(chunkSize);
        if (maxMemoryRows != null) b.maxMemoryRows(maxMemoryRows);
        if (extractWorkers != null) b.extractWorkers(extractWorkers);
        if (joinWorkers != null) b.joinWorkers(joinWorkers);
        if (sortWorkers != null) b.sortWorkers(sortWorkers);
        if (cpuSlots != null) b.cpuSlots(cpuSlots);
        if (taskRetries != null) b.taskRetries(taskRetries);
        if (schemaRegistry != null) b.schemaRegistry(schemaRegistry);
        if (sortChunkSize != null) b.sortChunkSize(sortChunkSize);
        if (sortBackup != null) b.sortBackup(sortBackup);
        if (sortBatchSize != null) b.sortBatchSize(sortBatchSize);
        return b;
    }
}
