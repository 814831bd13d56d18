package com.easydev.mail.dispatch;

import com.easydev.mail.retry.Deadline;
import com.easydev.mail.transport.Transporter;

import java.util.Optional;

/**
 * Delivery routing: one try on the primary transporter, then at most one try
 * on the fallback. No back-off between them.
 *
 * <p>Kept apart from {@link com.easydev.mail.verify.VerifyRetryPolicy}: a send
 * is never retried on the same route.
 */
public final class DispatchFailoverPolicy {

    private final Transporter primary;
    private final Transporter fallback; // null when no fallback profile

    public DispatchFailoverPolicy(final Transporter primary, final Optional<Transporter> fallback) {
        if (primary == null) {
            throw new IllegalArgumentException("primary transporter is required");
        }
        this.primary  = primary;
        this.fallback = fallback.orElse(null);
    }

    public Transporter primary() {
        return primary;
    }

    public Optional<Transporter> fallback() {
        return Optional.ofNullable(fallback);
    }

    /** Whether a failed primary send should be repeated on the fallback. */
    public boolean shouldFailOver(final Deadline deadline) {
        return fallback != null && !deadline.isExpired();
    }
}
