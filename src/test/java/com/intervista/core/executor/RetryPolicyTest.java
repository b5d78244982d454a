package com.intervista.core.executor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofMillis(200), Duration.ofMillis(5_000));

    @Test
    void doublesPerAttempt() {
        assertEquals(Duration.ofMillis(400), policy.backoff(1));
        assertEquals(Duration.ofMillis(800), policy.backoff(2));
        assertEquals(Duration.ofMillis(3_200), policy.backoff(4));
    }

    @Test
    void neverExceedsTheCap() {
        assertEquals(Duration.ofMillis(5_000), policy.backoff(5));
        assertEquals(Duration.ofMillis(5_000), policy.backoff(40));
        assertEquals(Duration.ofMillis(5_000), policy.backoff(Integer.MAX_VALUE));
    }

    @Test
    void zeroBaseMeansImmediateRetry() {
        assertEquals(Duration.ZERO, new RetryPolicy(Duration.ZERO, Duration.ofSeconds(1)).backoff(3));
    }

    @Test
    void readsExecutorProperties() {
        var properties = new ExecutorProperties();
        properties.setBackoffBaseMs(10);
        properties.setBackoffMaxMs(50);
        assertEquals(new RetryPolicy(Duration.ofMillis(10), Duration.ofMillis(50)), RetryPolicy.from(properties));
    }
}
