package com.easydev.mail.error;

/**
 * Root of the mail dispatch error taxonomy.
 *
 * <p>All subclasses are unchecked. Whether an error is retried is decided by
 * the operation that catches it, not by the exception type alone:
 * <ul>
 *   <li>{@link ConfigurationException} and {@link ValidationException} are
 *       never retried and propagate to the caller.</li>
 *   <li>{@link ConnectionException} and {@link CredentialException} fail the
 *       attempt that raised them; the verifier and dispatcher then apply their
 *       own retry or failover policy.</li>
 * </ul>
 */
public class MailDispatchException extends RuntimeException {

    public MailDispatchException(final String message) {
        super(message);
    }

    public MailDispatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
