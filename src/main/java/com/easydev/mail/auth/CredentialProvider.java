package com.easydev.mail.auth;

/**
 * Supplies the secret presented during an SMTP authentication handshake
 * when the profile uses OAuth2 instead of a static password.
 *
 * <p>Implementations must be thread-safe; one instance serves every
 * connection a transporter opens.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Obtain a fresh access token.
     *
     * @throws com.easydev.mail.error.CredentialException if the exchange fails
     */
    AccessToken getAccessToken();
}
