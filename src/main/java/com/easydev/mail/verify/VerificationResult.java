package com.easydev.mail.verify;

import com.easydev.mail.metrics.MetricsSnapshot;

/**
 * Outcome of one {@link ConnectionVerifier#verify} call.
 */
public final class VerificationResult {

    /** Terminal states of the verification state machine. */
    public enum Outcome { SUCCEEDED, SUCCEEDED_FALLBACK, FAILED }

    private final Outcome         outcome;
    private final int             attempts;          // primary attempts made
    private final boolean         fallbackAttempted;
    private final String          detail;
    private final MetricsSnapshot metrics;

    VerificationResult(
            final Outcome outcome,
            final int attempts,
            final boolean fallbackAttempted,
            final String detail,
            final MetricsSnapshot metrics) {
        this.outcome           = outcome;
        this.attempts          = attempts;
        this.fallbackAttempted = fallbackAttempted;
        this.detail            = detail;
        this.metrics           = metrics;
    }

    public Outcome         getOutcome()          { return outcome; }
    public int             getAttempts()         { return attempts; }
    public boolean         isFallbackAttempted() { return fallbackAttempted; }
    public String          getDetail()           { return detail; }
    public MetricsSnapshot getMetrics()          { return metrics; }
    public boolean         isSuccess()           { return outcome != Outcome.FAILED; }
    public boolean         isUsedFallback()      { return outcome == Outcome.SUCCEEDED_FALLBACK; }

    @Override
    public String toString() {
        return "VerificationResult{outcome=" + outcome
             + ", attempts=" + attempts
             + (fallbackAttempted ? ", fallbackAttempted" : "")
             + ", detail=" + detail + "}";
    }
}
