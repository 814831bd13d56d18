package com.easydev.mail.error;

/**
 * A transient failure talking to the mail provider: unreachable host, timeout,
 * rejected authentication or a refused message.
 */
public class ConnectionException extends MailDispatchException {

    private final String provider;

    public ConnectionException(final String provider, final String message) {
        super(message);
        this.provider = provider;
    }

    public ConnectionException(final String provider, final String message, final Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    /** Provider label of the transporter that failed. */
    public String getProvider() {
        return provider;
    }
}
