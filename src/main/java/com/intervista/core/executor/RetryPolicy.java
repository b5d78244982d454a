package com.intervista.core.executor;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base * 2^attempts, cap)}.
 */
public record RetryPolicy(Duration base, Duration cap) {

    public static RetryPolicy from(ExecutorProperties properties) {
        return new RetryPolicy(Duration.ofMillis(properties.getBackoffBaseMs()),
                Duration.ofMillis(properties.getBackoffMaxMs()));
    }

    /**
     * @param attempts failed attempts so far, including the one that just failed
     */
    public Duration backoff(int attempts) {
        if (attempts >= 31) {
            return cap;
        }
        long millis = base.toMillis() * (1L << Math.max(0, attempts));
        return millis < 0 || millis > cap.toMillis() ? cap : Duration.ofMillis(millis);
    }
}
