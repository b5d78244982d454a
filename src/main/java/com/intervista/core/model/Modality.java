package com.intervista.core.model;

/**
 * One analysis channel of an interview submission.
 */
public enum Modality {
    SPEECH("speech"),
    VISUAL("visual"),
    CONTENT("content");

    private final String key;

    Modality(String key) {
        this.key = key;
    }

    /**
     * Lower-case key used as the prefix of parameter and metric names (e.g. {@code speech.threshold}).
     */
    public String key() {
        return key;
    }

    public TaskType taskType() {
        return switch (this) {
            case SPEECH -> TaskType.SPEECH_ANALYSIS;
            case VISUAL -> TaskType.VISUAL_ANALYSIS;
            case CONTENT -> TaskType.CONTENT_ANALYSIS;
        };
    }
}
