package com.intervista.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Audit record of one fired adaptation rule. Never mutated.
 *
 * @param id               unique event id
 * @param timestamp        when the rule fired
 * @param ruleName         the rule that fired
 * @param triggerCondition human-readable condition that matched
 * @param parameterDeltas  applied change per parameter, after clamping
 * @param scope            session id, or the global parameters pseudo-session
 */
public record AdaptationEvent(
    String id,
    Instant timestamp,
    String ruleName,
    String triggerCondition,
    Map<String, Double> parameterDeltas,
    String scope
) implements Serializable {

    public AdaptationEvent {
        parameterDeltas = parameterDeltas == null ? Map.of() : Map.copyOf(parameterDeltas);
    }
}
