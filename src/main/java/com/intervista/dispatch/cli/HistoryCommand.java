package com.intervista.dispatch.cli;

import com.intervista.core.persistence.SnapshotQueryService;
import com.intervista.core.persistence.SnapshotQueryService.SessionSummary;
import com.intervista.core.state.StateManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Comparator;
import java.util.List;

/**
 * CLI command: intervista history
 * <p>
 * Lists stored sessions, newest first: Session ID | Status | Tasks | Score | Revision | Updated.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List analyzed sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final SnapshotQueryService queryService;

    public HistoryCommand(SnapshotQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SessionSummary> sessions = queryService.listSessions().stream()
                .filter(s -> !StateManager.GLOBAL_SESSION_ID.equals(s.sessionId()))
                .sorted(Comparator.comparing(SessionSummary::updatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<SessionSummary> display = sessions.size() > limit ? sessions.subList(0, limit) : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-10s %-6s %-6s %-5s %s%n", "SESSION ID", "STATUS", "TASKS", "SCORE", "REV", "UPDATED");
        System.out.println("  " + "-".repeat(80));

        for (SessionSummary s : display) {
            System.out.printf("  %-24s %-10s %-6d %-6s %-5d %s%n", s.sessionId(), s.status(), s.taskCount(),
                    ConsoleOutput.formatScore(s.overallScore()), s.revision(), s.updatedAt());
        }
    }
}
