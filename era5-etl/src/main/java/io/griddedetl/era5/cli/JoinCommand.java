package io.griddedetl.era5.cli;

import com.google.inject.Guice;
import io.griddedetl.era5.config.EtlConfig;
import io.griddedetl.era5.config.EtlModule;
import io.griddedetl.era5.join.CoordinateJoiner;
import io.griddedetl.era5.join.JoinException;
import io.griddedetl.era5.join.JoinResult;
import io.griddedetl.era5.model.OutputLayout;
import io.griddedetl.era5.model.UnitKey;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/** One month's per-variable tables into a joined table. */
@CommandLine.Command(name = "join", mixinStandardHelpOptions = true, description = "Join one month's variable tables on (time, latitude, longitude)")
final class JoinCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Output root holding processed/")
    Path input;

    @CommandLine.Option(names = "--year", required = true)
    int year;

    @CommandLine.Option(names = "--month", required = true)
    int month;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Joined file; default joined/<year>/joined_<year><month> under the input root")
    Path output;

    @CommandLine.Mixin
    EtlOptions options = new EtlOptions();

    @Override
    public Integer call() throws Exception {
        EtlConfig config = options.apply(EtlConfig.fromEnv().toBuilder()).outputDir(input).build();
        UnitKey unit = UnitKey.of(year, month);
        OutputLayout layout = new OutputLayout(input);
        Path target = output != null ? output : layout.joinedFile(unit, config.encoding().extension());
        CoordinateJoiner joiner = Guice.createInjector(new EtlModule(config)).getInstance(CoordinateJoiner.class);
        try {
            JoinResult r = joiner.join(unit, layout.processed(), target);
            System.out.println("joined " + r.joined() + " into " + r.output() + " (" + r.rows() + " rows)"
                    + (r.skipped().isEmpty() ? "" : ", skipped " + r.skipped().keySet()));
            return 0;
        } catch (JoinException e) {
            System.err.println(e.getMessage());
            return 1;
        }
    }
}
