package com.intervista.core.analyzer;

import com.intervista.core.model.Modality;

/**
 * Analyzer for the speech modality.
 */
public interface SpeechCapability extends AnalyzerCapability {

    @Override
    default Modality modality() {
        return Modality.SPEECH;
    }
}
