package com.netbet.trustedsession.generation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Overall deadline of one generation cycle, passed down to every strategy and attempt.
 */
public final class Deadline {

    private final Clock clock;
    private final Duration timeout;
    private final Instant expiresAt;

    private Deadline(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
        this.expiresAt = clock.instant().plus(timeout);
    }

    public static Deadline after(Clock clock, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        return new Deadline(clock, timeout);
    }

    public Duration timeout() {
        return timeout;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /** Time left, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /** The shorter of {@code duration} and the time left. */
    public Duration cap(Duration duration) {
        Duration left = remaining();
        return duration.compareTo(left) < 0 ? duration : left;
    }
}
