package com.easydev.mail.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived OAuth2 bearer token. Used for exactly one SMTP authentication
 * handshake and then discarded.
 */
public final class AccessToken {

    private final String  value;
    private final String  tokenType;
    private final long    expiresInSeconds; // 0 when the endpoint did not say
    private final Instant issuedAt;

    public AccessToken(
            final String value,
            final String tokenType,
            final long expiresInSeconds,
            final Instant issuedAt) {
        this.value            = Objects.requireNonNull(value, "value");
        this.tokenType        = tokenType;
        this.expiresInSeconds = expiresInSeconds;
        this.issuedAt         = issuedAt;
    }

    public String  getValue()            { return value; }
    public String  getTokenType()        { return tokenType; }
    public long    getExpiresInSeconds() { return expiresInSeconds; }
    public Instant getIssuedAt()         { return issuedAt; }

    @Override
    public String toString() {
        return "AccessToken{type=" + tokenType + ", expiresIn=" + expiresInSeconds + "s, issuedAt=" + issuedAt + "}";
    }
}
