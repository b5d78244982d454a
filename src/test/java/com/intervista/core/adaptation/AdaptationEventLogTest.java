package com.intervista.core.adaptation;

import com.intervista.core.model.AdaptationEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdaptationEventLogTest {

    private static AdaptationEvent event(String id, String parameter, double delta) {
        return new AdaptationEvent(id, Instant.parse("2026-03-01T10:00:00Z"), "rule-" + id, "cond",
                Map.of(parameter, delta), "__global__");
    }

    @Test
    void keepsNewestEventsAndFoldsTheRest() {
        var log = new AdaptationEventLog(2);
        log.append(event("1", "speech.threshold", -0.05));
        log.append(event("2", "speech.threshold", -0.05));
        log.append(event("3", "visual.frame_rate", 1.0));
        log.append(event("4", "visual.frame_rate", 1.0));

        assertEquals(2, log.size());
        assertEquals("3", log.events().get(0).id());
        assertEquals("4", log.last().orElseThrow().id());

        var folded = log.compacted().get("speech.threshold");
        assertEquals(2, folded.count());
        assertEquals(-0.1, folded.netDelta(), 1e-9);
        assertFalse(log.compacted().containsKey("visual.frame_rate"));
    }

    @Test
    void emptyLog() {
        var log = new AdaptationEventLog(5);
        assertTrue(log.last().isEmpty());
        assertTrue(log.compacted().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new AdaptationEventLog(0));
    }
}
