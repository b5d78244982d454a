package com.intervista.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intervista.core.engine.AnalysisEngine;
import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.UserContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: intervista analyze &lt;submission.json&gt;
 * <p>
 * Reads a submission (transcript plus extracted audio and visual features), runs a session to
 * completion while printing task progress, and prints the scored report.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze an interview submission")
@Component
public class AnalyzeCommand implements Runnable {

    @Parameters(index = "0", description = "Submission JSON: {transcript, audioFeatures, visualFeatures}")
    private File submission;

    @Option(names = {"--mode", "-m"}, description = "Analysis mode: QUICK, FULL", defaultValue = "QUICK")
    private String mode;

    @Option(names = {"--job", "-j"}, description = "Target job position")
    private String jobPosition;

    @Option(names = {"--session", "-s"}, description = "Session id to use instead of a generated one")
    private String sessionId;

    @Option(names = "--focus", description = "Modality emphasis, e.g. --focus speech=2.0")
    private Map<String, Double> focus = new LinkedHashMap<>();

    @Option(names = {"--timeout", "-t"}, description = "Seconds to wait for the session", defaultValue = "300")
    private long timeoutSeconds;

    private final AnalysisEngine analysisEngine;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(AnalysisEngine analysisEngine, ObjectMapper objectMapper) {
        this.analysisEngine = analysisEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        AnalysisMode analysisMode;
        try {
            analysisMode = AnalysisMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: QUICK, FULL");
            return;
        }

        AvailableInputs inputs;
        try {
            inputs = objectMapper.readValue(submission, AvailableInputs.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read submission " + submission + ": " + e.getMessage());
            return;
        }

        var context = new UserContext(sessionId, jobPosition, analysisMode, focus);
        String id;
        try {
            id = analysisEngine.startSession(context, inputs);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        ConsoleOutput.info("Session " + id + " started (" + analysisMode + ")");

        var subscription = analysisEngine.subscribeProgress(id, ConsoleOutput::progress);
        long start = System.currentTimeMillis();
        try {
            analysisEngine.awaitCompletion(id, Duration.ofSeconds(timeoutSeconds));
        } catch (TimeoutException e) {
            ConsoleOutput.error("Session " + id + " still running after " + timeoutSeconds + "s, cancelling");
            analysisEngine.cancelSession(id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted, cancelling session " + id);
            analysisEngine.cancelSession(id);
            return;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.report(analysisEngine.getReport(id));
        ConsoleOutput.info("Finished in " + ConsoleOutput.formatDuration(System.currentTimeMillis() - start));
    }
}
