package io.griddedetl.era5.cli;

import picocli.CommandLine;

/**
 * Entry point: {@code era5-etl run|extract|join|sort}.
 */
@CommandLine.Command(name = "era5-etl", mixinStandardHelpOptions = true,
        description = "Turn monthly ERA5 gridded files into sorted, variable-joined tables",
        subcommands = {RunCommand.class, ExtractCommand.class, JoinCommand.class, SortCommand.class})
public final class Era5EtlMain implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new Era5EtlMain());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }
}
