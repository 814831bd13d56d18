package com.easydev.mail.dispatch;

import com.easydev.mail.error.ValidationException;
import com.easydev.mail.metrics.DeliveryMetrics;
import com.easydev.mail.model.DeliveryResult;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.SendReceipt;
import com.easydev.mail.retry.Deadline;
import com.easydev.mail.transport.Transporter;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one {@link MailMessage} with a single failover.
 *
 * <h2>Routing logic</h2>
 * <ol>
 *   <li>Reject a missing or malformed recipient list with {@link ValidationException}
 *       before any I/O. Metrics are untouched.</li>
 *   <li>Add correlation headers ({@link EnvelopeBuilder}).</li>
 *   <li>Try the primary transporter once. On any failure, and only when the
 *       {@link DispatchFailoverPolicy} has a fallback and the deadline has not
 *       passed, try the fallback once.</li>
 * </ol>
 * Exactly one of {@code emailsSent} / {@code emailsFailed} is recorded per
 * call. Delivery failures come back as a {@link DeliveryResult}, never thrown.
 */
public class MailDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(MailDispatcher.class);

    private final DispatchFailoverPolicy policy;
    private final DeliveryMetrics        metrics;
    private final EnvelopeBuilder        envelopes;

    public MailDispatcher(
            final DispatchFailoverPolicy policy,
            final DeliveryMetrics metrics,
            final EnvelopeBuilder envelopes) {
        this.policy    = policy;
        this.metrics   = metrics;
        this.envelopes = envelopes;
    }

    public DeliveryResult send(final MailMessage message) {
        return send(message, Deadline.none());
    }

    /**
     * @throws ValidationException if the recipient is empty or not a valid address
     */
    public DeliveryResult send(final MailMessage message, final Deadline deadline) {
        validate(message);
        final MailMessage envelope = envelopes.build(message);
        final String to = maskEmail(message.getTo());

        final Transporter primary = policy.primary();
        final String primaryError;
        try {
            final SendReceipt receipt = primary.sendMail(envelope, deadline);
            metrics.recordEmailSent();
            LOG.info("Email sent: to={} provider={} msgId={}", to, primary.providerName(), receipt.getMessageId());
            return DeliveryResult.builder(primary.providerName())
                    .success(receipt.getMessageId())
                    .build();
        } catch (RuntimeException e) {
            primaryError = e.getMessage();
        }

        if (policy.fallback().isEmpty()) {
            metrics.recordEmailFailed();
            LOG.error("Email delivery failed: to={} provider={} error={}", to, primary.providerName(), primaryError);
            return DeliveryResult.builder(primary.providerName())
                    .failure("Failed to send email: " + primaryError)
                    .build();
        }

        if (!policy.shouldFailOver(deadline)) {
            metrics.recordEmailFailed();
            LOG.error("Email delivery failed: to={} provider={} error={}; deadline reached before fallback",
                    to, primary.providerName(), primaryError);
            return DeliveryResult.builder(primary.providerName())
                    .failure("Failed to send email: " + primaryError + "; deadline exceeded before fallback")
                    .build();
        }

        final Transporter fallback = policy.fallback().get();
        LOG.warn("Primary provider {} failed, trying fallback {} for to={}: {}",
                primary.providerName(), fallback.providerName(), to, primaryError);
        try {
            final SendReceipt receipt = fallback.sendMail(envelope, deadline);
            metrics.recordEmailSent();
            LOG.info("Email sent via fallback: to={} provider={} msgId={}",
                    to, fallback.providerName(), receipt.getMessageId());
            return DeliveryResult.builder(fallback.providerName())
                    .success(receipt.getMessageId())
                    .usedFallback(true)
                    .build();
        } catch (RuntimeException e) {
            metrics.recordEmailFailed();
            LOG.error("Email delivery failed on primary and fallback: to={} primary={} fallback={} error={}",
                    to, primary.providerName(), fallback.providerName(), e.getMessage());
            return DeliveryResult.builder(fallback.providerName())
                    .failure("Failed to send email with primary and fallback: "
                            + primaryError + "; fallback: " + e.getMessage())
                    .usedFallback(true)
                    .build();
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static void validate(final MailMessage message) {
        if (!message.hasRecipient()) {
            throw new ValidationException("Recipient email is required");
        }
        try {
            final InternetAddress[] recipients = InternetAddress.parse(message.getTo(), true);
            if (recipients.length == 0) {
                throw new ValidationException("Recipient email is required");
            }
            for (final InternetAddress recipient : recipients) {
                recipient.validate();
            }
        } catch (AddressException e) {
            throw new ValidationException("Invalid recipient address '" + message.getTo() + "': " + e.getMessage(), e);
        }
    }

    static String maskEmail(final String email) {
        if (email == null) return "null";
        final int at = email.indexOf('@');
        if (at <= 1) return "***";
        return email.substring(0, Math.min(3, at)) + "***" + email.substring(at);
    }
}
