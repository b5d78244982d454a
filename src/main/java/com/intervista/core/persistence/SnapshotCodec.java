package com.intervista.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intervista.core.state.GraphState;

/**
 * JSON form of a {@link GraphState} as stored inside a checkpoint. Derived views (feedback, session
 * status) are not part of the document.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String encode(GraphState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException(
                    "Failed to serialize state of session " + state.sessionId() + " at revision " + state.revision(), e);
        }
    }

    public GraphState decode(String json) {
        try {
            return objectMapper.readValue(json, GraphState.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException("Failed to deserialize session snapshot", e);
        }
    }
}
