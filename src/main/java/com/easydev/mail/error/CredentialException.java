package com.easydev.mail.error;

/**
 * The OAuth2 refresh-token exchange failed. Raised during an authentication
 * handshake, so it fails whichever verify or send attempt opened the connection.
 */
public class CredentialException extends MailDispatchException {

    public CredentialException(final String message) {
        super(message);
    }

    public CredentialException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
