package com.easydev.mail.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time after which no further attempt, back-off sleep or
 * pool wait may start.
 *
 * <p>Threaded through verification and dispatch so that the worst-case
 * latency of a call is bounded by the caller rather than by the sum of every
 * configured timeout and back-off delay.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt; // null = unbounded
    private final Clock   clock;

    private Deadline(final Instant expiresAt, final Clock clock) {
        this.expiresAt = expiresAt;
        this.clock     = clock;
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(final Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(final Duration timeout, final Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * Time left before expiry, never negative. Unbounded deadlines report
     * {@code Long.MAX_VALUE} milliseconds.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        final Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** Whether a wait of {@code delayMs} would still finish before expiry. */
    public boolean allows(final long delayMs) {
        return expiresAt == null || remaining().toMillis() > delayMs;
    }

    /**
     * @throws DeadlineExceededException if the deadline has passed
     */
    public void check(final String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException("Deadline exceeded before " + operation);
        }
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline{none}" : "Deadline{" + expiresAt + "}";
    }
}
