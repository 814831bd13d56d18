package com.easydev.mail.verify;

import com.easydev.mail.config.MailConfig;

/**
 * Retry schedule for connection verification: a fixed number of attempts
 * against the primary transporter with exponential back-off between them.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   delay(attempt) = baseDelay × 2^(attempt - 1)
 * </pre>
 * No jitter is added, so the schedule is exact and repeatable.
 */
public final class VerifyRetryPolicy {

    private final int  maxAttempts;
    private final long baseDelayMs;

    public VerifyRetryPolicy(final int maxAttempts, final long baseDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative, was " + baseDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
    }

    /** Defaults from {@code mail.verify.*}. */
    public static VerifyRetryPolicy from(final MailConfig config) {
        return new VerifyRetryPolicy(config.getVerifyMaxAttempts(), config.getVerifyBaseDelayMs());
    }

    public int  getMaxAttempts() { return maxAttempts; }
    public long getBaseDelayMs() { return baseDelayMs; }

    /** Whether another primary attempt follows attempt number {@code attempt} (1-based). */
    public boolean hasNext(final int attempt) {
        return attempt < maxAttempts;
    }

    /** Sleep before attempt {@code attempt + 1}. */
    public long backoffDelay(final int attempt) {
        final int shift = attempt - 1;
        if (shift >= 62 || baseDelayMs > (Long.MAX_VALUE >> shift)) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs << shift;
    }

    @Override
    public String toString() {
        return "VerifyRetryPolicy{maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs + "}";
    }
}
