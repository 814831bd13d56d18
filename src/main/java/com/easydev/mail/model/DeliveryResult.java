package com.easydev.mail.model;

import java.time.Instant;

/**
 * Immutable outcome of one dispatch call.
 *
 * <p>Returned by {@link com.easydev.mail.dispatch.MailDispatcher#send} for
 * every delivery attempt, successful or not; delivery failures are captured
 * in {@link #getError()} rather than thrown. {@code usedFallback} tells the
 * caller which route delivered (or last failed).
 */
public final class DeliveryResult {

    public enum Status { SUCCESS, FAILURE }

    private final Status  status;
    private final String  provider;
    private final String  messageId;    // null on failure
    private final String  error;        // null on success
    private final boolean usedFallback;
    private final Instant completedAt;

    private DeliveryResult(final Builder b) {
        this.status       = b.status;
        this.provider     = b.provider;
        this.messageId    = b.messageId;
        this.error        = b.error;
        this.usedFallback = b.usedFallback;
        this.completedAt  = Instant.now();
    }

    public static Builder builder(final String provider) {
        return new Builder(provider);
    }

    public static final class Builder {
        private final String provider;
        private Status  status = Status.FAILURE;
        private String  messageId;
        private String  error;
        private boolean usedFallback;

        private Builder(final String provider) {
            this.provider = provider;
        }

        public Builder success(final String id) {
            this.status    = Status.SUCCESS;
            this.messageId = id;
            this.error     = null;
            return this;
        }

        public Builder failure(final String message) {
            this.status    = Status.FAILURE;
            this.error     = message;
            this.messageId = null;
            return this;
        }

        public Builder usedFallback(final boolean v) {
            this.usedFallback = v;
            return this;
        }

        public DeliveryResult build() { return new DeliveryResult(this); }
    }

    public Status  getStatus()      { return status; }
    public String  getProvider()    { return provider; }
    public String  getMessageId()   { return messageId; }
    public String  getError()       { return error; }
    public boolean isUsedFallback() { return usedFallback; }
    public Instant getCompletedAt() { return completedAt; }
    public boolean isSuccess()      { return status == Status.SUCCESS; }

    @Override
    public String toString() {
        return "DeliveryResult{provider=" + provider
             + ", status=" + status
             + (messageId != null ? ", msgId=" + messageId : "")
             + (error != null ? ", error=" + error : "")
             + (usedFallback ? ", fallback" : "")
             + "}";
    }
}
