package com.intervista.core.analyzer;

import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.UserContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.intervista.core.TestSupport.T0;
import static com.intervista.core.TestSupport.context;
import static com.intervista.core.TestSupport.fullSubmission;
import static org.junit.jupiter.api.Assertions.*;

class KeywordContentAnalyzerTest {

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final KeywordContentAnalyzer analyzer = new KeywordContentAnalyzer(clock);
    private final Deadline deadline = Deadline.after(Duration.ofSeconds(30), clock);

    private AnalysisInput input(UserContext context, AvailableInputs inputs) {
        return new AnalysisInput("S-1", "S-1-CONTENT_ANALYSIS", context, inputs);
    }

    @Test
    @DisplayName("a STAR-structured answer scores well on structure")
    void starAnswer() {
        var result = analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), fullSubmission()),
                Map.of("content.analysis_depth", 2.0), deadline);

        assertTrue(result.scores().get("structure") >= 0.8, "structure " + result.scores());
        assertEquals(List.of("action", "result", "situation", "task"),
                ((List<?>) result.rawFeatures().get("star_parts")).stream().map(Object::toString).sorted().toList());
        assertTrue(result.scores().containsKey("key_points"));
    }

    @Test
    @DisplayName("relevance reflects the job position's vocabulary")
    void relevance() {
        var backend = analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), fullSubmission()), Map.of(), deadline);
        var noJob = analyzer.analyze(input(new UserContext("S-1", null, AnalysisMode.QUICK, Map.of()), fullSubmission()),
                Map.of(), deadline);

        assertEquals(0.6, backend.scores().get("relevance"), 1e-9);
        assertEquals(0.5, noJob.scores().get("relevance"), 1e-9);
    }

    @Test
    @DisplayName("analysis depth 1 skips key points")
    void shallow() {
        var result = analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), fullSubmission()),
                Map.of("content.analysis_depth", 1.0), deadline);
        assertFalse(result.scores().containsKey("key_points"));
    }

    @Test
    @DisplayName("a short answer lowers confidence")
    void shortAnswer() {
        var inputs = new AvailableInputs("I like Java.", Map.of(), Map.of());
        var result = analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), inputs), Map.of(), deadline);
        assertEquals(0.56, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("the transcribed audio track stands in for a missing transcript")
    void speechTranscript() {
        var inputs = new AvailableInputs(null, Map.of("speech_rate_wpm", 130.0), Map.of(), "I like Java.");
        var result = analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), inputs), Map.of(), deadline);
        assertEquals(0.56, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("audio without a transcript is not analyzable here")
    void noTranscript() {
        var inputs = new AvailableInputs(null, Map.of("speech_rate_wpm", 130.0), Map.of());
        assertThrows(InputUnavailableException.class,
                () -> analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), inputs), Map.of(), deadline));
    }

    @Test
    @DisplayName("analysis depth out of range is invalid")
    void invalidDepth() {
        assertThrows(InvalidParamsException.class,
                () -> analyzer.analyze(input(context("S-1", AnalysisMode.QUICK), fullSubmission()),
                        Map.of("content.analysis_depth", 0.0), deadline));
    }
}
