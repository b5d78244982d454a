package com.intervista.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Intervista.
 * Routes to subcommands: analyze, history, inspect, params.
 */
@Command(
        name = "intervista",
        mixinStandardHelpOptions = true,
        version = "Intervista 0.1.0",
        description = "Multimodal interview analysis engine",
        subcommands = {
                AnalyzeCommand.class,
                HistoryCommand.class,
                InspectCommand.class,
                ParamsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class IntervistaCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
