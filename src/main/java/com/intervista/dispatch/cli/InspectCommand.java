package com.intervista.dispatch.cli;

import com.intervista.core.model.Task;
import com.intervista.core.persistence.SnapshotQueryService;
import com.intervista.core.state.GraphState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.Optional;

/**
 * CLI command: intervista inspect &lt;session-id&gt;
 * <p>
 * Shows the stored state of a session, its tasks with status, attempts and errors, and the
 * collected results. With {@code --revision} shows the session as it was at that revision.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a stored session")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--revision", "-r"}, description = "Stored revision to show")
    private Long revision;

    @Option(names = "--timeline", description = "List every stored revision")
    private boolean timeline;

    private final SnapshotQueryService queryService;

    public InspectCommand(SnapshotQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (timeline) {
            var states = queryService.timeline(sessionId);
            if (states.isEmpty()) {
                ConsoleOutput.error("Session not found: " + sessionId);
                return;
            }
            for (GraphState state : states) {
                System.out.printf("  rev %-5d %-10s %s%n", state.revision(), state.sessionStatus(), state.updatedAt());
            }
            return;
        }

        Optional<GraphState> stateOpt = revision != null
                ? queryService.atRevision(sessionId, revision)
                : queryService.latest(sessionId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error(revision != null
                    ? "Revision " + revision + " of session " + sessionId + " is not stored"
                    : "Session not found: " + sessionId);
            return;
        }

        GraphState state = stateOpt.get();
        System.out.println();
        System.out.println("SESSION " + state.sessionId() + " (revision " + state.revision() + ")");
        System.out.println("──────────────────────────────────");
        System.out.println("  Status:   " + state.sessionStatus());
        if (state.userContext() != null) {
            System.out.println("  Mode:     " + state.userContext().mode());
            System.out.println("  Position: " + (state.userContext().jobPosition() != null
                    ? state.userContext().jobPosition() : "-"));
        }
        System.out.println("  Created:  " + state.createdAt());
        System.out.println("  Updated:  " + state.updatedAt());

        System.out.println();
        System.out.println("  TASKS:");
        for (Task task : state.taskState().ordered()) {
            var deps = state.taskState().dependenciesOf(task.id());
            System.out.printf("    %-36s %-9s %-8s attempts %d/%d %s%n", task.id(), task.status(), task.priority(),
                    task.attemptCount(), task.maxAttempts(), elapsed(task));
            if (!deps.isEmpty()) {
                System.out.println("      depends on: " + String.join(", ", deps.stream().sorted().toList()));
            }
            if (task.lastError() != null) {
                ConsoleOutput.error("      " + task.lastError());
            }
        }

        var results = state.analysisState().results();
        if (!results.isEmpty()) {
            System.out.println();
            System.out.println("  RESULTS:");
            results.forEach((modality, result) -> System.out.printf("    %-8s overall %s confidence %s %s%n",
                    modality.key(), ConsoleOutput.formatScore(result.overallScore()),
                    ConsoleOutput.formatScore(result.confidence()), result.scores()));
        }
    }

    private static String elapsed(Task task) {
        if (task.startedAt() == null || task.finishedAt() == null) return "";
        return ConsoleOutput.formatDuration(Duration.between(task.startedAt(), task.finishedAt()).toMillis());
    }
}
