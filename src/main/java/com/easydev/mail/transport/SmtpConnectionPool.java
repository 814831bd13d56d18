package com.easydev.mail.transport;

import com.easydev.mail.retry.Deadline;
import jakarta.mail.MessagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool of authenticated SMTP connections.
 *
 * <ul>
 *   <li>At most {@code maxConnections} connections are leased at once;
 *       further callers wait for a release, bounded by their deadline and
 *       the pool's acquire timeout.</li>
 *   <li>A connection is closed and replaced after carrying
 *       {@code maxMessages} messages, or after any failed send.</li>
 *   <li>Each newly opened connection goes through a full authentication
 *       handshake, so OAuth2 tokens are fetched per connection.</li>
 * </ul>
 */
final class SmtpConnectionPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SmtpConnectionPool.class);

    private final String                name;
    private final int                   maxMessages;
    private final long                  acquireTimeoutMs;
    private final SmtpConnection.Opener opener;
    private final Semaphore             permits;
    private final Deque<Lease>          idle = new ArrayDeque<>();
    private volatile boolean            closed;

    SmtpConnectionPool(
            final String name,
            final int maxConnections,
            final int maxMessages,
            final long acquireTimeoutMs,
            final SmtpConnection.Opener opener) {
        this.name             = name;
        this.maxMessages      = maxMessages;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.opener           = opener;
        this.permits          = new Semaphore(maxConnections, true);
    }

    /** A leased connection and the number of messages it has carried. */
    static final class Lease {
        private final SmtpConnection connection;
        private int sent;

        private Lease(final SmtpConnection connection) {
            this.connection = connection;
        }

        SmtpConnection connection() { return connection; }
        int sent()                  { return sent; }
        void markSent()             { sent++; }
    }

    /**
     * Lease a connection, reusing an idle one when it is still connected.
     *
     * @throws PoolTimeoutException if no connection frees up in time
     * @throws MessagingException   if opening a new connection fails
     */
    Lease acquire(final Deadline deadline)
            throws InterruptedException, MessagingException, PoolTimeoutException {
        if (closed) {
            throw new IllegalStateException("SMTP pool '" + name + "' is closed");
        }
        final long waitMs = Math.min(acquireTimeoutMs, deadline.remaining().toMillis());
        if (!permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS)) {
            throw new PoolTimeoutException("No SMTP connection available in pool '" + name
                    + "' after " + waitMs + "ms");
        }
        try {
            Lease lease = pollIdle();
            while (lease != null && !lease.connection.isConnected()) {
                LOG.debug("Discarding stale SMTP connection from pool '{}'", name);
                lease.connection.close();
                lease = pollIdle();
            }
            if (lease == null) {
                lease = new Lease(opener.open());
                LOG.debug("Opened SMTP connection for pool '{}'", name);
            }
            return lease;
        } catch (MessagingException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Return a leased connection. Unhealthy connections, connections that
     * reached {@code maxMessages} and anything released after {@link #close()}
     * are closed instead of pooled.
     */
    void release(final Lease lease, final boolean healthy) {
        try {
            if (!healthy || closed) {
                lease.connection.close();
            } else if (lease.sent >= maxMessages) {
                LOG.debug("Rotating SMTP connection in pool '{}' after {} messages", name, lease.sent);
                lease.connection.close();
            } else {
                synchronized (idle) {
                    idle.push(lease);
                }
            }
        } finally {
            permits.release();
        }
    }

    int idleCount() {
        synchronized (idle) {
            return idle.size();
        }
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    private Lease pollIdle() {
        synchronized (idle) {
            return idle.poll();
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (idle) {
            idle.forEach(l -> l.connection.close());
            idle.clear();
        }
    }

    /** Raised when every connection stays leased past the wait budget. */
    static final class PoolTimeoutException extends Exception {
        PoolTimeoutException(final String message) {
            super(message);
        }
    }
}
