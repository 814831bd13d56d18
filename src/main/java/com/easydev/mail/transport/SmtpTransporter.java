package com.easydev.mail.transport;

import com.easydev.mail.auth.CredentialProvider;
import com.easydev.mail.config.ConnectionProfile;
import com.easydev.mail.error.ConnectionException;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.SendReceipt;
import com.easydev.mail.retry.Deadline;
import com.easydev.mail.retry.DeadlineExceededException;
import com.easydev.mail.retry.Sleeper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link Transporter} speaking SMTP through Jakarta Mail.
 *
 * <p>Owns a {@link SmtpConnectionPool} and a Resilience4j {@link RateLimiter}
 * sized from the profile. When the profile carries OAuth2 settings, the
 * {@link CredentialProvider} is asked for a token on every authentication
 * handshake: each pooled connection opened and each {@link #verify}.
 */
public class SmtpTransporter implements Transporter {

    private static final Logger LOG = LoggerFactory.getLogger(SmtpTransporter.class);

    /** Reservation timeout for callers without a deadline. */
    private static final Duration UNBOUNDED_WAIT = Duration.ofNanos(Long.MAX_VALUE);

    private final ConnectionProfile     profile;
    private final CredentialProvider    credentials; // null for password auth
    private final Session               session;
    private final SmtpConnection.Opener opener;
    private final SmtpConnectionPool    pool;
    private final RateLimiter           rateLimiter;
    private final Sleeper               sleeper;

    public SmtpTransporter(final ConnectionProfile profile, final CredentialProvider credentials) {
        this(profile, credentials, SmtpSessionFactory.create(profile), null, Sleeper.THREAD);
    }

    SmtpTransporter(
            final ConnectionProfile profile,
            final CredentialProvider credentials,
            final Session session,
            final SmtpConnection.Opener opener,
            final Sleeper sleeper) {
        this.profile     = profile;
        this.credentials = credentials;
        this.session     = session;
        this.opener      = opener != null ? opener : this::openConnection;
        this.sleeper     = sleeper;
        this.pool = new SmtpConnectionPool(
                profile.getName(),
                profile.getMaxConnections(),
                profile.getMaxMessages(),
                (long) profile.getConnectTimeoutMs() + profile.getSocketTimeoutMs(),
                this.opener);
        this.rateLimiter = RateLimiter.of("smtp-" + profile.getName(), RateLimiterConfig.custom()
                .limitForPeriod(profile.getRateLimit())
                .limitRefreshPeriod(Duration.ofMillis(profile.getRateWindowMs()))
                .timeoutDuration(Duration.ZERO) // replaced per send from the caller's deadline
                .build());
    }

    @Override
    public String providerName() {
        return profile.label();
    }

    @Override
    public ConnectionProfile profile() {
        return profile;
    }

    @Override
    public void verify(final Deadline deadline) {
        deadline.check("verifying " + providerName());
        final SmtpConnection connection;
        try {
            connection = opener.open();
        } catch (MessagingException e) {
            throw failure("Connection verification failed", e);
        }
        connection.close();
        LOG.debug("SMTP handshake verified: provider={} host={}:{}",
                providerName(), profile.getHost(), profile.getPort());
    }

    @Override
    public SendReceipt sendMail(final MailMessage message, final Deadline deadline) {
        deadline.check("sending via " + providerName());
        final MimeMessage mime = MimeMessageFactory.create(session, message);
        awaitRatePermit(deadline);

        final SmtpConnectionPool.Lease lease;
        try {
            lease = pool.acquire(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted while waiting for an SMTP connection", e);
        } catch (SmtpConnectionPool.PoolTimeoutException e) {
            throw new ConnectionException(providerName(), e.getMessage(), e);
        } catch (MessagingException e) {
            throw failure("Failed to open SMTP connection", e);
        }

        boolean healthy = false;
        try {
            lease.connection().send(mime);
            lease.markSent();
            healthy = true;
            return new SendReceipt(mime.getMessageID(), providerName());
        } catch (MessagingException e) {
            throw failure("SMTP send failed", e);
        } finally {
            pool.release(lease, healthy);
        }
    }

    @Override
    public void close() {
        pool.close();
        if (credentials instanceof AutoCloseable) {
            try {
                ((AutoCloseable) credentials).close();
            } catch (Exception e) {
                LOG.warn("Failed to close credential provider for {}: {}", providerName(), e.getMessage());
            }
        }
        LOG.info("SMTP transporter closed: provider={}", providerName());
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private SmtpConnection openConnection() throws MessagingException {
        final Transport transport = session.getTransport(SmtpSessionFactory.protocol(profile));
        try {
            final String secret = credentials != null
                    ? credentials.getAccessToken().getValue()
                    : profile.getPassword().orElse(null);
            transport.connect(profile.getHost(), profile.getPort(), profile.getUser(), secret);
        } catch (MessagingException | RuntimeException e) {
            closeQuietly(transport);
            throw e;
        }
        return new SmtpConnection.JakartaSmtpConnection(transport);
    }

    private void closeQuietly(final Transport transport) {
        try {
            transport.close();
        } catch (MessagingException e) {
            LOG.debug("Ignoring error while closing failed SMTP connection to {}: {}", providerName(), e.getMessage());
        }
    }

    /**
     * Reserve a send permit, waiting for a later window when the current one
     * is used up. The reservation timeout is the caller's remaining time, so a
     * permit is only reserved when its wait ends before the deadline.
     */
    private void awaitRatePermit(final Deadline deadline) {
        final long waitNanos;
        synchronized (rateLimiter) {
            rateLimiter.changeTimeoutDuration(deadline.isBounded() ? deadline.remaining() : UNBOUNDED_WAIT);
            waitNanos = rateLimiter.reservePermission();
        }
        if (waitNanos < 0) {
            throw new DeadlineExceededException("Deadline exceeded waiting for send rate permit on "
                    + providerName() + " (" + profile.getRateLimit() + " per " + profile.getRateWindowMs() + "ms)");
        }
        if (waitNanos == 0) return;

        final long waitMs = (waitNanos + 999_999L) / 1_000_000L;
        LOG.debug("Rate limit reached for {}: waiting {}ms", providerName(), waitMs);
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted while waiting for send rate permit", e);
        }
    }

    private ConnectionException failure(final String what, final MessagingException e) {
        final String kind = e instanceof AuthenticationFailedException ? " (authentication rejected)" : "";
        return new ConnectionException(providerName(),
                what + " for " + providerName() + kind + ": " + e.getMessage(), e);
    }
}
