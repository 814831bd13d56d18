package com.easydev.mail.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable parameter set needed to build a
 * {@link com.easydev.mail.transport.Transporter}: endpoint, credentials,
 * pooling, rate limit, timeouts and TLS policy.
 *
 * <p>Built once per call to {@link ProfileResolver}. {@link #toString()} never
 * includes the password or OAuth2 secrets.
 */
public final class ConnectionProfile {

    private final String  name;          // "primary" / "fallback"
    private final String  providerName;  // preset service, null for custom SMTP
    private final String  host;
    private final int     port;
    private final boolean secure;
    private final String  user;
    private final String  password;      // null when absent
    private final OAuth2  oauth2;        // null unless fully configured
    private final int     maxConnections;
    private final int     maxMessages;
    private final int     rateLimit;
    private final long    rateWindowMs;
    private final int     connectTimeoutMs;
    private final int     greetingTimeoutMs;
    private final int     socketTimeoutMs;
    private final boolean rejectUnauthorized;
    private final String  tlsMinVersion;
    private final boolean debug;

    private ConnectionProfile(final Builder b) {
        this.name               = b.name;
        this.providerName       = b.providerName;
        this.host               = b.host;
        this.port               = b.port;
        this.secure             = b.secure;
        this.user               = b.user;
        this.password           = b.password;
        this.oauth2             = b.oauth2;
        this.maxConnections     = b.maxConnections;
        this.maxMessages        = b.maxMessages;
        this.rateLimit          = b.rateLimit;
        this.rateWindowMs       = b.rateWindowMs;
        this.connectTimeoutMs   = b.connectTimeoutMs;
        this.greetingTimeoutMs  = b.greetingTimeoutMs;
        this.socketTimeoutMs    = b.socketTimeoutMs;
        this.rejectUnauthorized = b.rejectUnauthorized;
        this.tlsMinVersion      = b.tlsMinVersion;
        this.debug              = b.debug;
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    public String  getName()               { return name; }
    public Optional<String> getProviderName() { return Optional.ofNullable(providerName); }
    public String  getHost()               { return host; }
    public int     getPort()               { return port; }
    public boolean isSecure()              { return secure; }
    public String  getUser()               { return user; }
    public Optional<String> getPassword()  { return Optional.ofNullable(password); }
    public Optional<OAuth2> getOAuth2()    { return Optional.ofNullable(oauth2); }
    public int     getMaxConnections()     { return maxConnections; }
    public int     getMaxMessages()        { return maxMessages; }
    public int     getRateLimit()          { return rateLimit; }
    public long    getRateWindowMs()       { return rateWindowMs; }
    public int     getConnectTimeoutMs()   { return connectTimeoutMs; }
    public int     getGreetingTimeoutMs()  { return greetingTimeoutMs; }
    public int     getSocketTimeoutMs()    { return socketTimeoutMs; }
    public boolean isRejectUnauthorized()  { return rejectUnauthorized; }
    public String  getTlsMinVersion()      { return tlsMinVersion; }
    public boolean isDebug()               { return debug; }

    /** Label used in logs, headers and delivery results. */
    public String label() {
        return providerName != null ? providerName : host;
    }

    /**
     * OAuth2 client registration used to mint access tokens from a long-lived
     * refresh token.
     */
    public static final class OAuth2 {
        private final String clientId;
        private final String clientSecret;
        private final String refreshToken;
        private final String redirectUri;
        private final String tokenEndpoint;

        public OAuth2(
                final String clientId,
                final String clientSecret,
                final String refreshToken,
                final String redirectUri,
                final String tokenEndpoint) {
            this.clientId      = Objects.requireNonNull(clientId, "clientId");
            this.clientSecret  = Objects.requireNonNull(clientSecret, "clientSecret");
            this.refreshToken  = Objects.requireNonNull(refreshToken, "refreshToken");
            this.redirectUri   = redirectUri;
            this.tokenEndpoint = Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
        }

        public String getClientId()      { return clientId; }
        public String getClientSecret()  { return clientSecret; }
        public String getRefreshToken()  { return refreshToken; }
        public String getRedirectUri()   { return redirectUri; }
        public String getTokenEndpoint() { return tokenEndpoint; }

        @Override
        public String toString() {
            return "OAuth2{clientId=" + clientId + ", tokenEndpoint=" + tokenEndpoint + "}";
        }
    }

    public static final class Builder {
        private final String name;
        private String  providerName;
        private String  host;
        private int     port;
        private boolean secure;
        private String  user;
        private String  password;
        private OAuth2  oauth2;
        private int     maxConnections     = 5;
        private int     maxMessages        = 100;
        private int     rateLimit          = 100;
        private long    rateWindowMs       = 60_000L;
        private int     connectTimeoutMs   = 10_000;
        private int     greetingTimeoutMs  = 10_000;
        private int     socketTimeoutMs    = 30_000;
        private boolean rejectUnauthorized = true;
        private String  tlsMinVersion      = "TLSv1.2";
        private boolean debug;

        private Builder(final String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder providerName(final String v)    { this.providerName = v; return this; }
        public Builder host(final String v)            { this.host = v; return this; }
        public Builder port(final int v)               { this.port = v; return this; }
        public Builder secure(final boolean v)         { this.secure = v; return this; }
        public Builder user(final String v)            { this.user = v; return this; }
        public Builder password(final String v)        { this.password = v; return this; }
        public Builder oauth2(final OAuth2 v)          { this.oauth2 = v; return this; }
        public Builder pool(final int maxConnections, final int maxMessages) {
            this.maxConnections = maxConnections;
            this.maxMessages    = maxMessages;
            return this;
        }
        public Builder rate(final int limit, final long windowMs) {
            this.rateLimit    = limit;
            this.rateWindowMs = windowMs;
            return this;
        }
        public Builder timeouts(final int connectMs, final int greetMs, final int socketMs) {
            this.connectTimeoutMs  = connectMs;
            this.greetingTimeoutMs = greetMs;
            this.socketTimeoutMs   = socketMs;
            return this;
        }
        public Builder tls(final boolean rejectUnauthorized, final String minVersion) {
            this.rejectUnauthorized = rejectUnauthorized;
            this.tlsMinVersion      = minVersion;
            return this;
        }
        public Builder debug(final boolean v)          { this.debug = v; return this; }

        public ConnectionProfile build() {
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(user, "user");
            if (port <= 0 || port > 65_535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            if (maxConnections < 1 || maxMessages < 1) {
                throw new IllegalArgumentException("pool sizes must be positive");
            }
            if (rateLimit < 1 || rateWindowMs < 1) {
                throw new IllegalArgumentException("rate limit must be positive");
            }
            return new ConnectionProfile(this);
        }
    }

    @Override
    public String toString() {
        return "ConnectionProfile{name=" + name
             + (providerName != null ? ", service=" + providerName : "")
             + ", host=" + host
             + ", port=" + port
             + ", secure=" + secure
             + ", user=" + user
             + ", auth=" + (oauth2 != null ? "oauth2" : password != null ? "password" : "none")
             + ", pool=" + maxConnections + "/" + maxMessages
             + ", rate=" + rateLimit + "/" + rateWindowMs + "ms"
             + "}";
    }
}
