package com.intervista.dispatch.cli;

import com.intervista.core.adaptation.AdaptationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.TreeMap;

/**
 * CLI command: intervista params
 * <p>
 * Shows the live analysis parameters with their bounds and the adaptation event log.
 * {@code --cycle} runs one adaptation cycle now; {@code --rollback} restores the parameters
 * in effect before the most recent adjustment.
 */
@Command(name = "params", mixinStandardHelpOptions = true, description = "Show or adjust analysis parameters")
@Component
public class ParamsCommand implements Runnable {

    @Option(names = "--cycle", description = "Run one adaptation cycle before printing")
    private boolean cycle;

    @Option(names = "--rollback", description = "Roll back the most recent adjustment")
    private boolean rollback;

    private final AdaptationEngine adaptationEngine;

    public ParamsCommand(AdaptationEngine adaptationEngine) {
        this.adaptationEngine = adaptationEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (cycle) {
            var fired = adaptationEngine.runCycle();
            ConsoleOutput.info("Adaptation cycle fired " + fired.size() + " rule" + (fired.size() != 1 ? "s" : ""));
        }
        if (rollback) {
            adaptationEngine.rollbackLastAdjustment().ifPresentOrElse(
                    state -> ConsoleOutput.success("Rolled back to parameters of revision " + state.revision()),
                    () -> ConsoleOutput.error("No adjustment to roll back"));
        }

        var bounds = adaptationEngine.bounds();
        System.out.println();
        System.out.printf("  %-28s %-8s %s%n", "PARAMETER", "VALUE", "BOUNDS");
        System.out.println("  " + "-".repeat(56));
        new TreeMap<>(adaptationEngine.currentParameters()).forEach((name, value) -> {
            var b = bounds.get(name);
            System.out.printf("  %-28s %-8s %s%n", name, ConsoleOutput.formatScore(value),
                    b != null ? "[" + b.min() + ", " + b.max() + "]" : "-");
        });

        var log = adaptationEngine.eventLog();
        if (!log.compacted().isEmpty()) {
            System.out.println();
            System.out.println("  COMPACTED:");
            log.compacted().forEach((parameter, stats) -> System.out.printf("    %-28s %d events, net %s%n",
                    parameter, stats.count(), ConsoleOutput.formatScore(stats.netDelta())));
        }
        var events = log.events();
        if (!events.isEmpty()) {
            System.out.println();
            System.out.println("  EVENTS:");
            events.forEach(ConsoleOutput::adaptationEvent);
        }
    }
}
