package com.intervista.core.adaptation;

import com.intervista.core.model.AdaptationEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Append-only audit trail of adaptation events. Holds at most {@code maxEvents}; older events are
 * folded into per-parameter totals so the net effect of adaptation stays visible.
 */
public class AdaptationEventLog {

    private final int maxEvents;
    private final Deque<AdaptationEvent> events = new ArrayDeque<>();
    private final Map<String, CompactedStats> compacted = new TreeMap<>();

    public AdaptationEventLog(int maxEvents) {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be >= 1");
        }
        this.maxEvents = maxEvents;
    }

    public synchronized void append(AdaptationEvent event) {
        events.addLast(event);
        while (events.size() > maxEvents) {
            var oldest = events.removeFirst();
            oldest.parameterDeltas().forEach((parameter, delta) ->
                    compacted.merge(parameter, new CompactedStats(1, delta), CompactedStats::plus));
        }
    }

    /** Retained events, oldest first. */
    public synchronized List<AdaptationEvent> events() {
        return List.copyOf(events);
    }

    public synchronized Optional<AdaptationEvent> last() {
        return Optional.ofNullable(events.peekLast());
    }

    public synchronized Map<String, CompactedStats> compacted() {
        return Map.copyOf(compacted);
    }

    public synchronized int size() {
        return events.size();
    }

    /**
     * Totals of events that were dropped from the log.
     */
    public record CompactedStats(long count, double netDelta) {
        CompactedStats plus(CompactedStats other) {
            return new CompactedStats(count + other.count, netDelta + other.netDelta);
        }
    }
}
