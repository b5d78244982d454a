package com.intervista.core.model;

/**
 * Kind of work a {@link Task} performs. The three analysis types map onto a {@link Modality};
 * INTEGRATION and FEEDBACK run in-process over the collected results.
 */
public enum TaskType {
    SPEECH_ANALYSIS(Modality.SPEECH),
    VISUAL_ANALYSIS(Modality.VISUAL),
    CONTENT_ANALYSIS(Modality.CONTENT),
    INTEGRATION(null),
    FEEDBACK(null);

    private final Modality modality;

    TaskType(Modality modality) {
        this.modality = modality;
    }

    /** The analyzed modality, or {@code null} for INTEGRATION and FEEDBACK. */
    public Modality modality() {
        return modality;
    }

    public boolean isModality() {
        return modality != null;
    }
}
