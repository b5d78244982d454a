package com.intervista.core.analyzer;

import com.intervista.core.model.Modality;

/**
 * Analyzer for the content modality.
 */
public interface ContentCapability extends AnalyzerCapability {

    @Override
    default Modality modality() {
        return Modality.CONTENT;
    }
}
