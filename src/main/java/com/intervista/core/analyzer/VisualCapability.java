package com.intervista.core.analyzer;

import com.intervista.core.model.Modality;

/**
 * Analyzer for the visual modality.
 */
public interface VisualCapability extends AnalyzerCapability {

    @Override
    default Modality modality() {
        return Modality.VISUAL;
    }
}
