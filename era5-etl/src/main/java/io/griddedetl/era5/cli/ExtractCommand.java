package io.griddedetl.era5.cli;

import com.google.inject.Guice;
import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.config.EtlModule;
import io.griddedetl.era5.extract.DecodeException;
import io.griddedetl.era5.extract.ExtractResult;
import io.griddedetl.era5.extract.VariableExtractor;
import io.griddedetl.era5.model.OutputLayout;
import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.orchestrate.DiscoveryException;
import io.griddedetl.era5.orchestrate.FileDiscovery;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/** One raw file into per-variable tables. */
@CommandLine.Command(name = "extract", mixinStandardHelpOptions = true, description = "Decode one raw file into per-variable tables")
final class ExtractCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Raw gridded file")
    Path input;

    @CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Output root; tables go under processed/")
    Path output;

    @CommandLine.Option(names = "--year", description = "Year, when the file name does not carry it")
    Integer year;

    @CommandLine.Option(names = "--month", description = "Month, when the file name does not carry it")
    Integer month;

    @CommandLine.Mixin
    EtlOptions options = new EtlOptions();

    @Override
    public Integer call() throws Exception {
        EtlConfig config = options.apply(EtlConfig.fromEnv().toBuilder()).outputDir(output).build();
        UnitKey unit = unit();
        VariableExtractor extractor = Guice.createInjector(new EtlModule(config)).getInstance(VariableExtractor.class);
        try {
            ExtractResult r = extractor.extract(input, unit, new OutputLayout(output).processed());
            System.out.println("extracted " + r.extracted() + (r.failed().isEmpty() ? "" : ", failed " + r.failed().keySet()));
            return r.failed().isEmpty() ? 0 : 1;
        } catch (DecodeException e) {
            System.err.println(e.getMessage());
            return 1;
        }
    }

    private UnitKey unit() throws DiscoveryException {
        if (year != null && month != null) return UnitKey.of(year, month);
        Path file = input.toAbsolutePath();
        return FileDiscovery.unitOf(file.getRoot(), file);
    }
}
