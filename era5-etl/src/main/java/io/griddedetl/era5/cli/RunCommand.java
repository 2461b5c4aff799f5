package io.griddedetl.era5.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Stage;
import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.config.EtlModule;
import io.griddedetl.era5.orchestrate.BatchOrchestrator;
import io.griddedetl.era5.orchestrate.RunSummary;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/** The full pipeline over every raw file under the input directory. */
@CommandLine.Command(name = "run", mixinStandardHelpOptions = true, description = "Extract, join, clean up and optionally sort")
final class RunCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-i", "--input"}, description = "Directory of raw gridded files")
    Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output root (processed/, joined/, logs/)")
    Path output;

    @CommandLine.Option(names = "--batch-size", description = "Months per batch (default 10)")
    Integer batchSize;

    @CommandLine.Option(names = "--batch-delay", description = "Seconds to wait between batches (default 0)")
    Integer batchDelay;

    @CommandLine.Option(names = "--keep-processed", description = "Keep per-variable tables after joining")
    Boolean keepProcessed;

    @CommandLine.Option(names = "--sort", description = "Sort every joined table at the end")
    Boolean sort;

    @CommandLine.Option(names = "--start-year", description = "First year to process")
    Integer startYear;

    @CommandLine.Option(names = "--end-year", description = "Last year to process")
    Integer endYear;

    @CommandLine.Option(names = "--resume", description = "Skip months already joined by an earlier run")
    Boolean resume;

    @CommandLine.Mixin
    EtlOptions options = new EtlOptions();

    @Override
    public Integer call() throws Exception {
        EtlConfig config = config(EtlConfig.fromEnv());
        Injector injector = Guice.createInjector(Stage.PRODUCTION, new EtlModule(config));
        RunSummary summary = injector.getInstance(BatchOrchestrator.class).run();
        System.out.println(summary.describe());
        return summary.exitCode();
    }

    EtlConfig config(EtlConfig base) {
        EtlConfig.Builder b = options.apply(base.toBuilder());
        if (input != null) b.inputDir(input);
        if (output != null) b.outputDir(output);
        if (batchSize != null) b.batchSize(batchSize);
        if (batchDelay != null) b.batchDelaySeconds(batchDelay);
        if (keepProcessed != null) b.keepProcessed(keepProcessed);
        if (sort != null) b.sort(sort);
        if (startYear != null) b.startYear(startYear);
        if (endYear != null) b.endYear(endYear);
        if (resume != null) b.resume(resume);
        return b.build();
    }
}
