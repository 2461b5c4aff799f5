package io.griddedetl.era5.cli;

import com.google.inject.Guice;
import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.config.EtlModule;
import io.griddedetl.era5.orchestrate.BatchOrchestrator;
import io.griddedetl.era5.orchestrate.FileDiscovery;
import io.griddedetl.era5.orchestrate.StageCount;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/** Sorts joined tables in place. */
@CommandLine.Command(name = "sort", mixinStandardHelpOptions = true, description = "Sort joined tables by (time, latitude, longitude)")
final class SortCommand implements Callable<Integer> {
    @CommandLine.Parameters(arity = "1..*", description = "Tables, or directories searched for joined_* tables")
    List<Path> targets;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Where logs/ goes (default: current directory)", defaultValue = ".")
    Path output;

    @CommandLine.Mixin
    EtlOptions options = new EtlOptions();

    @Override
    public Integer call() throws Exception {
        List<Path> tables = new ArrayList<>();
        for (Path t : targets) {
            if (Files.isDirectory(t)) tables.addAll(FileDiscovery.joinedTables(t));
            else tables.add(t);
        }
        if (tables.isEmpty()) {
            System.err.println("no tables found in " + targets);
            return 1;
        }
        EtlConfig config = options.apply(EtlConfig.fromEnv().toBuilder()).outputDir(output).build();
        BatchOrchestrator orchestrator = Guice.createInjector(new EtlModule(config)).getInstance(BatchOrchestrator.class);
        StageCount count = orchestrator.sortTables(tables);
        System.out.println("sorted " + count.succeeded() + " table(s), " + count.failed() + " failed");
        return count.failed() == 0 ? 0 : 1;
    }
}
