package com.easydev.mail;

import com.easydev.mail.config.ConnectionProfile;
import com.easydev.mail.config.MailConfig;
import com.easydev.mail.config.ProfileResolver;
import com.easydev.mail.dispatch.DispatchFailoverPolicy;
import com.easydev.mail.dispatch.EnvelopeBuilder;
import com.easydev.mail.dispatch.MailDispatcher;
import com.easydev.mail.error.ValidationException;
import com.easydev.mail.metrics.DeliveryMetrics;
import com.easydev.mail.metrics.MetricsSnapshot;
import com.easydev.mail.model.DeliveryResult;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.RenderedContent;
import com.easydev.mail.retry.Deadline;
import com.easydev.mail.retry.Sleeper;
import com.easydev.mail.template.MessageTemplate;
import com.easydev.mail.transport.TransportFactory;
import com.easydev.mail.transport.Transporter;
import com.easydev.mail.verify.ConnectionVerifier;
import com.easydev.mail.verify.VerificationResult;
import com.easydev.mail.verify.VerifyRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for application code that sends email.
 *
 * <p>Owns the resolved primary and optional fallback transporters, one
 * {@link DeliveryMetrics} register, the {@link ConnectionVerifier} and the
 * {@link MailDispatcher}. Thread-safe; build one per process and share it.
 *
 * <h2>Template data keys</h2>
 * <ul>
 *   <li>{@code email} recipient, required</li>
 *   <li>{@code sender} overrides the configured default sender</li>
 *   <li>{@code customHeaders} map of extra message headers</li>
 * </ul>
 */
public class MailService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MailService.class);

    public static final String KEY_EMAIL          = "email";
    public static final String KEY_SENDER         = "sender";
    public static final String KEY_CUSTOM_HEADERS = "customHeaders";

    private final MailConfig            config;
    private final ConnectionProfile     primaryProfile;
    private final Transporter           primary;
    private final Optional<Transporter> fallback;
    private final DeliveryMetrics       metrics = new DeliveryMetrics();
    private final ConnectionVerifier    verifier;
    private final MailDispatcher        dispatcher;
    private final String                defaultSender;

    public MailService(final MailConfig config) {
        this(config, new TransportFactory());
    }

    public MailService(final MailConfig config, final TransportFactory factory) {
        this(config, factory, Sleeper.THREAD);
    }

    MailService(final MailConfig config, final TransportFactory factory, final Sleeper sleeper) {
        final ProfileResolver resolver = new ProfileResolver(config);
        final ConnectionProfile primaryProfile = resolver.resolve();
        final Optional<ConnectionProfile> fallbackProfile = resolver.resolveFallback();

        this.config         = config;
        this.primaryProfile = primaryProfile;
        this.primary        = factory.createTransporter(primaryProfile);
        this.fallback       = fallbackProfile.map(factory::createTransporter);
        this.verifier       = new ConnectionVerifier(primary, fallback, metrics, sleeper);
        this.dispatcher     = new MailDispatcher(
                new DispatchFailoverPolicy(primary, fallback),
                metrics,
                new EnvelopeBuilder(primaryProfile.getProviderName().orElse(null)));
        this.defaultSender  = "\"" + config.getSenderName() + "\" <"
                + config.getSenderAddress().orElse(primaryProfile.getUser()) + ">";

        LOG.info("Mail service ready: primary={} fallback={} sender={}",
                primary.providerName(),
                fallback.map(Transporter::providerName).orElse("none"),
                defaultSender);
    }

    // ── Sending ───────────────────────────────────────────────────────────────

    /**
     * Render {@code template} with {@code data} and deliver the result.
     *
     * @return the delivery outcome; delivery failures are reported here
     * @throws ValidationException if {@code data.email} is missing or malformed
     */
    public DeliveryResult sendEmail(final MessageTemplate template, final Map<String, Object> data) {
        return sendEmail(template, data, Deadline.none());
    }

    public DeliveryResult sendEmail(
            final MessageTemplate template,
            final Map<String, Object> data,
            final Deadline deadline) {
        final Object email = data != null ? data.get(KEY_EMAIL) : null;
        if (email == null || email.toString().isBlank()) {
            throw new ValidationException("Recipient email is required");
        }

        final RenderedContent content = template.render(data);
        final Object sender = data.get(KEY_SENDER);

        final MailMessage message = MailMessage.builder()
                .from(sender != null && !sender.toString().isBlank() ? sender.toString() : defaultSender)
                .to(email.toString().trim())
                .content(content)
                .headers(customHeaders(data.get(KEY_CUSTOM_HEADERS)))
                .build();
        return dispatcher.send(message, deadline);
    }

    // ── Verification ──────────────────────────────────────────────────────────

    /** Verify with the configured {@code mail.verify.*} schedule. */
    public VerificationResult verifyEmailConnection() {
        return verifier.verify(VerifyRetryPolicy.from(config));
    }

    public VerificationResult verifyEmailConnection(final int retries, final long baseDelayMs) {
        return verifyEmailConnection(retries, baseDelayMs, Deadline.none());
    }

    public VerificationResult verifyEmailConnection(
            final int retries,
            final long baseDelayMs,
            final Deadline deadline) {
        return verifier.verify(retries, baseDelayMs, deadline);
    }

    // ── Metrics ───────────────────────────────────────────────────────────────

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public ConnectionProfile getPrimaryProfile() {
        return primaryProfile;
    }

    public String getDefaultSender() {
        return defaultSender;
    }

    @Override
    public void close() {
        primary.close();
        fallback.ifPresent(Transporter::close);
        LOG.info("Mail service closed. Final metrics: {}", metrics.snapshot());
    }

    private static Map<String, String> customHeaders(final Object value) {
        final Map<String, String> headers = new LinkedHashMap<>();
        if (value == null) return headers;
        if (!(value instanceof Map)) {
            throw new ValidationException("customHeaders must be a map of header names to values");
        }
        ((Map<?, ?>) value).forEach((k, v) -> {
            if (k != null && v != null) headers.put(k.toString(), v.toString());
        });
        return headers;
    }
}
