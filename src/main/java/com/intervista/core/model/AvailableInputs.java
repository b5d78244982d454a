package com.intervista.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * The interview submission as seen by the engine: a written transcript, precomputed audio and video
 * features, and the speech-to-text of the audio track when the extraction step produced one.
 * Any part may be absent.
 *
 * @param transcript       written answer text, or null
 * @param audioFeatures    extracted audio features (e.g. {@code speech_rate_wpm}); empty when there is no audio track
 * @param visualFeatures   extracted video features (e.g. {@code eye_contact_ratio}); empty when there is no video
 * @param speechTranscript speech-to-text of the audio track, or null
 */
public record AvailableInputs(
    String transcript,
    Map<String, Double> audioFeatures,
    Map<String, Double> visualFeatures,
    String speechTranscript
) implements Serializable {

    @JsonCreator
    public AvailableInputs {
        audioFeatures = audioFeatures == null ? Map.of() : Map.copyOf(audioFeatures);
        visualFeatures = visualFeatures == null ? Map.of() : Map.copyOf(visualFeatures);
    }

    public AvailableInputs(String transcript, Map<String, Double> audioFeatures, Map<String, Double> visualFeatures) {
        this(transcript, audioFeatures, visualFeatures, null);
    }

    @JsonIgnore
    public boolean hasText() {
        return transcript != null && !transcript.isBlank();
    }

    @JsonIgnore
    public boolean hasAudio() {
        return !audioFeatures.isEmpty();
    }

    @JsonIgnore
    public boolean hasVideo() {
        return !visualFeatures.isEmpty();
    }

    /** Text for content analysis: the written transcript, else the transcribed audio track. */
    @JsonIgnore
    public Optional<String> answerText() {
        if (hasText()) {
            return Optional.of(transcript);
        }
        if (hasAudio() && speechTranscript != null && !speechTranscript.isBlank()) {
            return Optional.of(speechTranscript);
        }
        return Optional.empty();
    }
}
