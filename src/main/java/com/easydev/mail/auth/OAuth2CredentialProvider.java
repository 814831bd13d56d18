package com.easydev.mail.auth;

import com.easydev.mail.config.ConnectionProfile;
import com.easydev.mail.error.CredentialException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Exchanges a stored refresh token for a new access token at the provider's
 * OAuth2 token endpoint ({@code grant_type=refresh_token}).
 *
 * <p>Every call performs a fresh exchange. Tokens are not cached: each SMTP
 * handshake presents a token minted moments earlier, at the cost of one token
 * request per new connection.
 *
 * <p>Expected response body:
 * <pre>{@code
 * {
 *   "access_token": "ya29.a0Af...",
 *   "expires_in":   3599,
 *   "token_type":   "Bearer"
 * }
 * }</pre>
 */
public class OAuth2CredentialProvider implements CredentialProvider, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(OAuth2CredentialProvider.class);

    private final ConnectionProfile.OAuth2 settings;
    private final OkHttpClient             http;
    private final ObjectMapper             mapper = new ObjectMapper();
    private final Clock                    clock;

    public OAuth2CredentialProvider(final ConnectionProfile.OAuth2 settings, final int timeoutMs) {
        this(settings, timeoutMs, Clock.systemUTC());
    }

    OAuth2CredentialProvider(final ConnectionProfile.OAuth2 settings, final int timeoutMs, final Clock clock) {
        this.settings = settings;
        this.clock    = clock;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public AccessToken getAccessToken() {
        final FormBody form = new FormBody.Builder()
                .add("grant_type",    "refresh_token")
                .add("client_id",     settings.getClientId())
                .add("client_secret", settings.getClientSecret())
                .add("refresh_token", settings.getRefreshToken())
                .build();

        final Request request = new Request.Builder()
                .url(settings.getTokenEndpoint())
                .addHeader("Accept", "application/json")
                .post(form)
                .build();

        try (Response response = http.newCall(request).execute()) {
            final String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                LOG.error("OAuth2 token refresh rejected: clientId={} http={}",
                        settings.getClientId(), response.code());
                throw new CredentialException("Failed to obtain OAuth2 access token: HTTP "
                        + response.code() + " " + errorDescription(body));
            }

            final JsonNode json  = mapper.readTree(body);
            final String   token = json.path("access_token").asText("");
            if (token.isBlank()) {
                throw new CredentialException("Failed to obtain OAuth2 access token: response has no access_token");
            }

            LOG.debug("OAuth2 access token refreshed: clientId={} expiresIn={}s",
                    settings.getClientId(), json.path("expires_in").asLong(0));
            return new AccessToken(
                    token,
                    json.path("token_type").asText("Bearer"),
                    json.path("expires_in").asLong(0),
                    clock.instant());
        } catch (IOException e) {
            LOG.error("OAuth2 token endpoint unreachable: clientId={} error={}",
                    settings.getClientId(), e.getMessage());
            throw new CredentialException("Failed to obtain OAuth2 access token: " + e.getMessage(), e);
        }
    }

    private String errorDescription(final String body) {
        if (body == null || body.isBlank()) return "(empty)";
        try {
            final JsonNode json = mapper.readTree(body);
            final String error = json.path("error").asText("");
            final String description = json.path("error_description").asText("");
            if (!error.isEmpty()) {
                return description.isEmpty() ? error : error + ": " + description;
            }
        } catch (IOException e) {
            LOG.debug("Token error body is not JSON: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
