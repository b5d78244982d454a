package com.intervista.core.analyzer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time by which an analyzer attempt must return. Analyzers call {@link #check} between
 * steps; the executor additionally interrupts the worker when the deadline passes.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws DeadlineExceededException if the deadline has passed or the thread was interrupted
     */
    public void check(String step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DeadlineExceededException("Interrupted during " + step);
        }
        if (isExpired()) {
            throw new DeadlineExceededException("Deadline " + expiresAt + " passed during " + step);
        }
    }

    @Override
    public String toString() {
        return "Deadline[" + expiresAt + "]";
    }
}
