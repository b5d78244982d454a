package com.intervista.dispatch.cli;

import com.intervista.core.model.AdaptationEvent;
import com.intervista.core.model.ModalityStatus;
import com.intervista.core.model.ProgressEvent;
import com.intervista.core.model.SessionReport;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Intervista CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) INTERVISTA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [INTERVISTA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(ProgressEvent event) {
        String color = switch (event.status()) {
            case SUCCEEDED -> "fg(green)";
            case FAILED, CANCELLED -> "fg(red)";
            case SKIPPED -> "fg(yellow)";
            case PENDING, RUNNING -> "fg(blue)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-9s", event.status()) + "|@ " + event.taskId()));
    }

    public static void report(SessionReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Session " + report.sessionId() + "|@ " + statusLabel(report)));
        System.out.println("  Overall: " + formatScore(report.overallScore()));
        for (var entry : report.modalityStatus().entrySet()) {
            String label = entry.getValue() == ModalityStatus.OK
                    ? "@|fg(green) " + formatScore(report.modalityScores().get(entry.getKey())) + "|@"
                    : "@|fg(red) DEGRADED|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + String.format("%-8s", entry.getKey().key()) + " " + label));
        }
        list("Strengths", report.strengths(), "fg(green)");
        list("Weaknesses", report.weaknesses(), "fg(red)");
        list("Suggestions", report.suggestions(), "fg(cyan)");
        if (!report.taskErrors().isEmpty()) {
            System.out.println();
            error("Task errors (" + report.taskErrors().size() + "):");
            for (Map.Entry<String, String> entry : report.taskErrors().entrySet()) {
                error("  " + entry.getKey() + ": " + entry.getValue());
            }
        }
    }

    public static void adaptationEvent(AdaptationEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [" + event.ruleName() + "]|@ " + event.triggerCondition()
                        + " " + event.parameterDeltas() + " at " + event.timestamp()));
    }

    static String formatScore(Double score) {
        return score == null ? "-" : String.format(Locale.ROOT, "%.2f", score);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String statusLabel(SessionReport report) {
        return switch (report.status()) {
            case COMPLETED -> CommandLine.Help.Ansi.AUTO.string("@|fg(green),bold COMPLETED|@");
            case PARTIAL -> CommandLine.Help.Ansi.AUTO.string("@|fg(yellow),bold PARTIAL|@");
            case RUNNING -> CommandLine.Help.Ansi.AUTO.string("@|fg(blue) RUNNING|@");
            case FAILED, CANCELLED -> CommandLine.Help.Ansi.AUTO.string("@|fg(red),bold " + report.status() + "|@");
        };
    }

    private static void list(String title, List<String> items, String color) {
        if (items.isEmpty()) return;
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|bold " + title + ":|@"));
        for (String item : items) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|" + color + " -|@ " + item));
        }
    }
}
