package com.intervista.core.adaptation;

import java.util.List;
import java.util.Map;

/**
 * Trigger of an {@link AdaptationRule}.
 */
public interface RuleCondition {

    /**
     * @param history per-metric statistics of recent cycles, oldest first; the last entry is the
     *                current cycle
     */
    boolean matches(List<Map<String, WindowStats>> history);

    String describe();
}
