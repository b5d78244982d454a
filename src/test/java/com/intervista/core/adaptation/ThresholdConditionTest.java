package com.intervista.core.adaptation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdConditionTest {

    private static Map<String, WindowStats> window(double mean) {
        return Map.of("speech.confidence", new WindowStats(mean, mean, 10));
    }

    @Test
    void windowStatsUseNearestRankPercentile() {
        var stats = WindowStats.of(IntStream.rangeClosed(1, 20).asDoubleStream().boxed().toList());
        assertEquals(10.5, stats.mean(), 1e-9);
        assertEquals(19.0, stats.p95(), 1e-9);
        assertEquals(20, stats.count());
        assertEquals(new WindowStats(0.0, 0.0, 0), WindowStats.of(List.of()));
    }

    @Test
    void comparesTheChosenStatistic() {
        var below = new ThresholdCondition("speech.confidence", ThresholdCondition.Statistic.MEAN,
                ThresholdCondition.Comparison.BELOW, 0.5, 1);
        var p95Above = new ThresholdCondition("speech.confidence", ThresholdCondition.Statistic.P95,
                ThresholdCondition.Comparison.ABOVE, 0.9, 1);

        assertTrue(below.matches(List.of(window(0.4))));
        assertFalse(below.matches(List.of(window(0.5))));
        assertFalse(p95Above.matches(List.of(Map.of("speech.confidence", new WindowStats(0.5, 0.9, 5)))));
        assertTrue(p95Above.matches(List.of(Map.of("speech.confidence", new WindowStats(0.5, 0.95, 5)))));
    }

    @Test
    void requiresConsecutiveWindows() {
        var condition = new ThresholdCondition("speech.confidence", ThresholdCondition.Statistic.MEAN,
                ThresholdCondition.Comparison.BELOW, 0.5, 2);

        assertFalse(condition.matches(List.of(window(0.4))));
        assertTrue(condition.matches(List.of(window(0.9), window(0.4), window(0.3))));
        assertFalse(condition.matches(List.of(window(0.4), window(0.6), window(0.3))));
        assertFalse(condition.matches(List.of(window(0.4), Map.of(), window(0.3))));
        assertEquals("mean(speech.confidence) below 0.5 for 2 windows", condition.describe());
    }

    @Test
    void rejectsZeroWindows() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdCondition("overall_score",
                ThresholdCondition.Statistic.MEAN, ThresholdCondition.Comparison.ABOVE, 0.5, 0));
    }
}
