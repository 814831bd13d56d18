package com.easydev.mail.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic connection and send counters.
 *
 * <p>One instance is owned by each {@link com.easydev.mail.MailService} and
 * handed to its verifier and dispatcher, so independent services in the same
 * process keep independent counts. Increments are atomic; there is no reset.
 */
public class DeliveryMetrics {

    private final AtomicLong connectionAttempts  = new AtomicLong();
    private final AtomicLong connectionSuccesses = new AtomicLong();
    private final AtomicLong connectionFailures  = new AtomicLong();
    private final AtomicLong emailsSent          = new AtomicLong();
    private final AtomicLong emailsFailed        = new AtomicLong();

    /** Records the start of one verification call. */
    public void recordConnectionAttempt() {
        connectionAttempts.incrementAndGet();
    }

    public void recordConnectionSuccess() {
        connectionSuccesses.incrementAndGet();
    }

    public void recordConnectionFailure() {
        connectionFailures.incrementAndGet();
    }

    public void recordEmailSent() {
        emailsSent.incrementAndGet();
    }

    public void recordEmailFailed() {
        emailsFailed.incrementAndGet();
    }

    /**
     * Point-in-time copy of every counter. Each counter is read atomically;
     * the snapshot as a whole is not a single atomic cut across counters.
     */
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                connectionAttempts.get(),
                connectionSuccesses.get(),
                connectionFailures.get(),
                emailsSent.get(),
                emailsFailed.get());
    }
}
