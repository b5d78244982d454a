package com.intervista.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one analyzer run. Immutable once created.
 *
 * @param taskId      the task that produced the result
 * @param modality    analyzed modality
 * @param scores      named scores in [0, 1], always including {@code overall}
 * @param rawFeatures provider-specific features, opaque to the engine. Values are held in their JSON
 *                    shape (numbers as {@code Double}, collections as lists, anything else as a string)
 *                    so a result reads back from a snapshot equal to the one written
 * @param confidence  analyzer confidence in [0, 1]
 * @param producedAt  when the result was produced
 */
public record AnalysisResult(
    String taskId,
    Modality modality,
    Map<String, Double> scores,
    Map<String, Object> rawFeatures,
    double confidence,
    Instant producedAt
) implements Serializable {

    public static final String OVERALL = "overall";

    public AnalysisResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(modality, "modality");
        scores = scores == null ? Map.of() : Map.copyOf(scores);
        rawFeatures = rawFeatures == null ? Map.of() : jsonShaped(rawFeatures);
    }

    public double overallScore() {
        return scores.getOrDefault(OVERALL, 0.0);
    }

    private static Map<String, Object> jsonShaped(Map<?, ?> map) {
        var shaped = new LinkedHashMap<String, Object>();
        map.forEach((key, value) -> shaped.put(String.valueOf(key), jsonShaped(value)));
        return Collections.unmodifiableMap(shaped);
    }

    private static Object jsonShaped(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            return jsonShaped(map);
        }
        if (value instanceof Collection<?> collection) {
            var list = new ArrayList<Object>(collection.size());
            collection.forEach(item -> list.add(jsonShaped(item)));
            return Collections.unmodifiableList(list);
        }
        return String.valueOf(value);
    }
}
