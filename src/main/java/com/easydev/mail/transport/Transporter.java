package com.easydev.mail.transport;

import com.easydev.mail.config.ConnectionProfile;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.SendReceipt;
import com.easydev.mail.retry.Deadline;

/**
 * Pooled handle to one mail provider, bound to a single {@link ConnectionProfile}.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance is shared by every
 *       caller using the same profile.</li>
 *   <li>Failures are reported by throwing
 *       {@link com.easydev.mail.error.ConnectionException} (network, timeout,
 *       authentication, rejection) or
 *       {@link com.easydev.mail.error.CredentialException} (OAuth2 exchange).
 *       Retry and failover are applied by the verifier and dispatcher above
 *       this layer, never here.</li>
 *   <li>No network I/O happens before the first {@link #verify} or
 *       {@link #sendMail} call.</li>
 * </ul>
 */
public interface Transporter extends AutoCloseable {

    /** Provider label for logs and results (service name or host). */
    String providerName();

    ConnectionProfile profile();

    /**
     * Open a fresh authenticated connection and close it again.
     *
     * @param deadline no connection is started once this has expired
     */
    void verify(Deadline deadline);

    /**
     * Deliver one message over a pooled connection.
     *
     * @return the receipt carrying the provider-visible message id
     */
    SendReceipt sendMail(MailMessage message, Deadline deadline);

    /** Close every pooled connection. Further use is an error. */
    @Override
    void close();
}
