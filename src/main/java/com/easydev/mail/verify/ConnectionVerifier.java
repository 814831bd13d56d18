package com.easydev.mail.verify;

import com.easydev.mail.metrics.DeliveryMetrics;
import com.easydev.mail.retry.Deadline;
import com.easydev.mail.retry.DeadlineExceededException;
import com.easydev.mail.retry.Sleeper;
import com.easydev.mail.transport.Transporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Checks that the configured provider accepts an authenticated connection.
 *
 * <p>The primary transporter is tried up to {@code maxAttempts} times with
 * exponential back-off ({@link VerifyRetryPolicy}). Once the primary is
 * exhausted, the fallback transporter, if configured, gets exactly one
 * attempt. Verification failures are reported in the returned
 * {@link VerificationResult}, never thrown.
 *
 * <h2>Metrics per call</h2>
 * <ul>
 *   <li>{@code connectionAttempts} +1 on entry</li>
 *   <li>{@code connectionSuccesses} +1 when either route succeeds</li>
 *   <li>{@code connectionFailures} +1 once when the primary is given up on</li>
 * </ul>
 */
public class ConnectionVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionVerifier.class);

    private final Transporter     primary;
    private final Transporter     fallback; // null when no fallback profile
    private final DeliveryMetrics metrics;
    private final Sleeper         sleeper;

    public ConnectionVerifier(
            final Transporter primary,
            final Optional<Transporter> fallback,
            final DeliveryMetrics metrics) {
        this(primary, fallback, metrics, Sleeper.THREAD);
    }

    public ConnectionVerifier(
            final Transporter primary,
            final Optional<Transporter> fallback,
            final DeliveryMetrics metrics,
            final Sleeper sleeper) {
        this.primary  = primary;
        this.fallback = fallback.orElse(null);
        this.metrics  = metrics;
        this.sleeper  = sleeper;
    }

    public VerificationResult verify(final VerifyRetryPolicy policy) {
        return verify(policy, Deadline.none());
    }

    public VerificationResult verify(final int maxAttempts, final long baseDelayMs) {
        return verify(maxAttempts, baseDelayMs, Deadline.none());
    }

    /**
     * @throws IllegalArgumentException if {@code maxAttempts < 1} or the delay is negative
     */
    public VerificationResult verify(final int maxAttempts, final long baseDelayMs, final Deadline deadline) {
        return verify(new VerifyRetryPolicy(maxAttempts, baseDelayMs), deadline);
    }

    public VerificationResult verify(final VerifyRetryPolicy policy, final Deadline deadline) {
        metrics.recordConnectionAttempt();
        final int maxAttempts = policy.getMaxAttempts();

        String lastError = null;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                primary.verify(deadline);
                metrics.recordConnectionSuccess();
                LOG.info("Email service connection verified: provider={} attempt={}/{}",
                        primary.providerName(), attempt, maxAttempts);
                return result(VerificationResult.Outcome.SUCCEEDED, attempt, false,
                        "Connected to " + primary.providerName());
            } catch (DeadlineExceededException e) {
                return abandoned(attempt, e.getMessage());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                LOG.warn("Email service verification failed (attempt {}/{}): provider={} error={}",
                        attempt, maxAttempts, primary.providerName(), lastError);
            }

            if (!policy.hasNext(attempt)) break;

            final long delay = policy.backoffDelay(attempt);
            if (!deadline.allows(delay)) {
                return abandoned(attempt, "Deadline exceeded before retry in " + delay + "ms; last error: " + lastError);
            }
            LOG.debug("Retrying verification of {} in {}ms", primary.providerName(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return abandoned(attempt, "Interrupted during back-off; last error: " + lastError);
            }
        }

        metrics.recordConnectionFailure();
        final String primaryDetail = "Failed to verify email service after " + attempt + " attempts: " + lastError;

        if (fallback == null) {
            LOG.error(primaryDetail);
            return result(VerificationResult.Outcome.FAILED, attempt, false, primaryDetail);
        }

        LOG.info("Attempting fallback email service: provider={}", fallback.providerName());
        try {
            fallback.verify(deadline);
        } catch (RuntimeException e) {
            final String detail = primaryDetail + "; fallback " + fallback.providerName() + " failed: " + e.getMessage();
            LOG.error(detail);
            return result(VerificationResult.Outcome.FAILED, attempt, true, detail);
        }
        metrics.recordConnectionSuccess();
        LOG.info("Fallback email service connection verified: provider={}", fallback.providerName());
        return result(VerificationResult.Outcome.SUCCEEDED_FALLBACK, attempt, true,
                "Connected to fallback " + fallback.providerName());
    }

    // ── Private ───────────────────────────────────────────────────────────────

    /** Deadline or interrupt: one failure, no fallback. */
    private VerificationResult abandoned(final int attempts, final String detail) {
        metrics.recordConnectionFailure();
        LOG.warn("Email service verification abandoned after {} attempt(s): {}", attempts, detail);
        return result(VerificationResult.Outcome.FAILED, attempts, false, detail);
    }

    private VerificationResult result(
            final VerificationResult.Outcome outcome,
            final int attempts,
            final boolean fallbackAttempted,
            final String detail) {
        return new VerificationResult(outcome, attempts, fallbackAttempted, detail, metrics.snapshot());
    }
}
