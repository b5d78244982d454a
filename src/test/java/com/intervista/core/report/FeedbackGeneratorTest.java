package com.intervista.core.report;

import com.intervista.core.model.Modality;
import com.intervista.core.model.ModalityStatus;
import com.intervista.core.model.SessionStatus;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import com.intervista.core.state.AnalysisState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.intervista.core.TestSupport.T0;
import static com.intervista.core.TestSupport.result;
import static com.intervista.core.TestSupport.task;
import static com.intervista.core.report.ResultIntegratorTest.state;
import static com.intervista.core.report.ResultIntegratorTest.succeeded;
import static org.junit.jupiter.api.Assertions.*;

class FeedbackGeneratorTest {

    private final FeedbackGenerator generator = new FeedbackGenerator();

    @Test
    void reportsStrengthsWeaknessesAndDegradedModalities() {
        var speechResult = result("speech", Modality.SPEECH,
                Map.of("clarity", 0.9, "pace", 0.5, "fluency", 0.75, "overall", 0.7), 0.9);
        var visual = task("visual", TaskType.VISUAL_ANALYSIS)
                .transitionTo(TaskStatus.RUNNING, T0, null, null, false)
                .transitionTo(TaskStatus.FAILED, T0, "camera feed corrupt", null, true);
        var state = state(List.of(succeeded("speech", TaskType.SPEECH_ANALYSIS), visual),
                AnalysisState.empty().with(speechResult), Map.of());

        var report = generator.generate(state);

        assertEquals("S-1", report.sessionId());
        assertEquals(SessionStatus.PARTIAL, report.status());
        assertTrue(report.partial());
        assertEquals(0.7, report.overallScore(), 1e-9);
        assertEquals(List.of("speech.clarity"), report.strengths());
        assertEquals(List.of("speech.pace"), report.weaknesses());
        assertEquals(1, report.suggestions().size());
        assertTrue(report.suggestions().get(0).contains("words per minute"));
        assertEquals(ModalityStatus.DEGRADED, report.modalityStatus().get(Modality.VISUAL));
        assertEquals(List.of(Modality.VISUAL), report.degradedModalities());
        assertEquals(Map.of("visual", "camera feed corrupt"), report.taskErrors());
    }

    @Test
    void thresholdsComeFromTheSessionParameters() {
        var speechResult = result("speech", Modality.SPEECH, Map.of("pace", 0.6, "overall", 0.6), 0.9);
        var state = state(List.of(succeeded("speech", TaskType.SPEECH_ANALYSIS)),
                AnalysisState.empty().with(speechResult), Map.of("speech.threshold", 0.5));

        var report = generator.generate(state);

        assertTrue(report.weaknesses().isEmpty());
        assertTrue(report.strengths().isEmpty());
        assertEquals(SessionStatus.COMPLETED, report.status());
        assertFalse(report.partial());
    }
}
