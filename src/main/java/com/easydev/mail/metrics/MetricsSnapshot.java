package com.easydev.mail.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of {@link DeliveryMetrics} at one point in time.
 */
public final class MetricsSnapshot {

    private final long connectionAttempts;
    private final long connectionSuccesses;
    private final long connectionFailures;
    private final long emailsSent;
    private final long emailsFailed;

    public MetricsSnapshot(
            final long connectionAttempts,
            final long connectionSuccesses,
            final long connectionFailures,
            final long emailsSent,
            final long emailsFailed) {
        this.connectionAttempts  = connectionAttempts;
        this.connectionSuccesses = connectionSuccesses;
        this.connectionFailures  = connectionFailures;
        this.emailsSent          = emailsSent;
        this.emailsFailed        = emailsFailed;
    }

    public long getConnectionAttempts()  { return connectionAttempts; }
    public long getConnectionSuccesses() { return connectionSuccesses; }
    public long getConnectionFailures()  { return connectionFailures; }
    public long getEmailsSent()          { return emailsSent; }
    public long getEmailsFailed()        { return emailsFailed; }

    /** Counter names to values, in declaration order. */
    public Map<String, Long> asMap() {
        final Map<String, Long> map = new LinkedHashMap<>();
        map.put("connectionAttempts",  connectionAttempts);
        map.put("connectionSuccesses", connectionSuccesses);
        map.put("connectionFailures",  connectionFailures);
        map.put("emailsSent",          emailsSent);
        map.put("emailsFailed",        emailsFailed);
        return map;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricsSnapshot)) return false;
        final MetricsSnapshot that = (MetricsSnapshot) o;
        return connectionAttempts == that.connectionAttempts
            && connectionSuccesses == that.connectionSuccesses
            && connectionFailures == that.connectionFailures
            && emailsSent == that.emailsSent
            && emailsFailed == that.emailsFailed;
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "MetricsSnapshot" + asMap();
    }
}
