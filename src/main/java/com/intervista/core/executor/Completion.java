package com.intervista.core.executor;

import com.intervista.core.analyzer.AnalyzerException;
import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Task;

/**
 * Message posted to a session's coordinator when an attempt settles. A successful attempt carries the
 * analyzer's result, or for an integration task the integrated score.
 */
record Completion(Kind kind, Task task, AnalysisResult result, IntegratedScore integration,
                  RuntimeException error, long elapsedMs) {

    enum Kind { SUCCEEDED, FAILED, TIMED_OUT, WAKE_UP }

    static Completion success(Task task, AnalysisResult result, long elapsedMs) {
        return new Completion(Kind.SUCCEEDED, task, result, null, null, elapsedMs);
    }

    static Completion integrated(Task task, IntegratedScore score, long elapsedMs) {
        return new Completion(Kind.SUCCEEDED, task, null, score, null, elapsedMs);
    }

    static Completion failure(Task task, RuntimeException error, long elapsedMs) {
        return new Completion(Kind.FAILED, task, null, null, error, elapsedMs);
    }

    static Completion timeout(Task task, AnalyzerException error, long elapsedMs) {
        return new Completion(Kind.TIMED_OUT, task, null, null, error, elapsedMs);
    }

    static Completion wakeUp() {
        return new Completion(Kind.WAKE_UP, null, null, null, null, 0L);
    }
}
