package com.intervista.core.analyzer;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.Modality;

import java.util.Map;

/**
 * One analyzer behind the engine. Implementations must be thread-safe, must return before the
 * deadline (throwing {@link DeadlineExceededException} rather than hanging) and must respond to
 * interruption.
 * <p>
 * Failures are reported through the {@link AnalyzerException} family:
 * {@link InputUnavailableException}, {@link TransientProviderException},
 * {@link DeadlineExceededException} and {@link InvalidParamsException}.
 */
public interface AnalyzerCapability {

    Modality modality();

    /**
     * @param input    the submission and task identity
     * @param params   frozen task parameters, keyed like {@code speech.detail_level}
     * @param deadline when the attempt must be done
     * @return a result for {@code input.taskId()} with scores in [0, 1], including {@code overall}
     */
    AnalysisResult analyze(AnalysisInput input, Map<String, Double> params, Deadline deadline);
}
