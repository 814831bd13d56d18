package com.easydev.mail.config;

import com.easydev.mail.error.ConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link ConnectionProfile}s from configuration.
 *
 * <h2>Precedence</h2>
 * <ol>
 *   <li>call-time overrides passed to {@link #resolve(Map)} (keys are profile
 *       paths such as {@code host}, {@code port}, {@code pool.max-connections})</li>
 *   <li>environment variables bound in {@code application.conf}</li>
 *   <li>built-in defaults from {@code reference.conf}</li>
 * </ol>
 *
 * <p>A named {@code service} fills in host, port and TLS mode from
 * {@link ProviderPresets}; explicit values still win. Resolution has no side
 * effects and never reads the process environment directly.
 */
public final class ProfileResolver {

    public static final String PRIMARY  = "primary";
    public static final String FALLBACK = "fallback";

    private static final List<String> INHERITED_KEYS = List.of(
            "user", "pass", "port",
            "oauth2.client-id", "oauth2.client-secret", "oauth2.refresh-token");

    private final MailConfig config;

    public ProfileResolver(final MailConfig config) {
        this.config = config;
    }

    public ConnectionProfile resolve() {
        return resolve(Map.of());
    }

    /**
     * Resolve the primary profile.
     *
     * @throws ConfigurationException if user, host or port cannot be determined
     */
    public ConnectionProfile resolve(final Map<String, ?> overrides) {
        return build(PRIMARY, layer(config.getPrimaryProfile(), overrides));
    }

    public Optional<ConnectionProfile> resolveFallback() {
        return resolveFallback(Map.of());
    }

    /**
     * Resolve the fallback profile. Empty unless the fallback namespace names
     * a host or a service.
     *
     * <p>Login settings the fallback leaves unset ({@code user}, {@code pass},
     * the OAuth2 client) come from the primary profile. So does {@code port},
     * unless the fallback's service preset supplies one.
     */
    public Optional<ConnectionProfile> resolveFallback(final Map<String, ?> overrides) {
        final Config cfg = layer(config.getFallbackProfile(), overrides);
        if (text(cfg, "host") == null && text(cfg, "service") == null) {
            return Optional.empty();
        }
        return Optional.of(build(FALLBACK, cfg.withFallback(inheritedFromPrimary(cfg))));
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private Config inheritedFromPrimary(final Config fallback) {
        final Config primary = config.getPrimaryProfile();
        final boolean presetPort = ProviderPresets.find(text(fallback, "service")).isPresent();

        Config inherited = ConfigFactory.empty("inherited from primary profile");
        for (final String key : INHERITED_KEYS) {
            if (key.equals("port") && presetPort) continue;
            if (text(primary, key) != null) {
                inherited = inherited.withValue(key, primary.getValue(key));
            }
        }
        return inherited;
    }

    private static Config layer(final Config base, final Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) return base;
        return ConfigFactory.parseMap(overrides, "call-time overrides").withFallback(base);
    }

    private static ConnectionProfile build(final String name, final Config cfg) {
        final String service = text(cfg, "service");
        final Optional<ProviderPresets.Preset> preset = ProviderPresets.find(service);
        if (service != null && preset.isEmpty()) {
            throw new ConfigurationException("Unknown email service '" + service + "' for " + name + " profile");
        }

        final String  user = text(cfg, "user");
        final String  host = Optional.ofNullable(text(cfg, "host"))
                .orElse(preset.map(ProviderPresets.Preset::getHost).orElse(null));
        final Integer port = Optional.ofNullable(positiveInt(cfg, "port", name))
                .orElse(preset.map(ProviderPresets.Preset::getPort).orElse(null));

        final List<String> missing = new ArrayList<>();
        if (user == null) missing.add("user");
        if (host == null) missing.add("host");
        if (port == null) missing.add("port");
        if (!missing.isEmpty()) {
            throw ConfigurationException.missing(name, missing);
        }
        if (port > 65_535) {
            throw new ConfigurationException("Invalid value for " + name + ".port: " + port);
        }

        // Port 465 speaks implicit TLS; everything else upgrades with STARTTLS.
        final boolean secure = bool(cfg, "secure", name)
                .orElse(preset.map(ProviderPresets.Preset::isSecure).orElse(port == 465));

        return ConnectionProfile.builder(name)
                .providerName(service != null ? service.trim().toLowerCase(Locale.ROOT) : null)
                .host(host)
                .port(port)
                .secure(secure)
                .user(user)
                .password(text(cfg, "pass"))
                .oauth2(oauth2(cfg))
                .pool(requiredInt(cfg, "pool.max-connections", name),
                      requiredInt(cfg, "pool.max-messages", name))
                .rate(requiredInt(cfg, "rate.limit", name),
                      requiredInt(cfg, "rate.window-ms", name))
                .timeouts(requiredInt(cfg, "timeouts.connect-ms", name),
                          requiredInt(cfg, "timeouts.greet-ms", name),
                          requiredInt(cfg, "timeouts.socket-ms", name))
                .tls(bool(cfg, "tls.reject-unauthorized", name).orElse(true),
                     Optional.ofNullable(text(cfg, "tls.min-version")).orElse("TLSv1.2"))
                .debug(bool(cfg, "debug", name).orElse(false))
                .build();
    }

    private static ConnectionProfile.OAuth2 oauth2(final Config cfg) {
        final String clientId     = text(cfg, "oauth2.client-id");
        final String clientSecret = text(cfg, "oauth2.client-secret");
        final String refreshToken = text(cfg, "oauth2.refresh-token");
        if (clientId == null || clientSecret == null || refreshToken == null) {
            return null;
        }
        return new ConnectionProfile.OAuth2(
                clientId,
                clientSecret,
                refreshToken,
                text(cfg, "oauth2.redirect-uri"),
                Optional.ofNullable(text(cfg, "oauth2.token-endpoint"))
                        .orElse("https://oauth2.googleapis.com/token"));
    }

    /** Non-blank string value, or null. */
    private static String text(final Config cfg, final String key) {
        if (!cfg.hasPath(key)) return null;
        final String value = cfg.getValue(key).unwrapped().toString().trim();
        return value.isEmpty() ? null : value;
    }

    private static Integer positiveInt(final Config cfg, final String key, final String name) {
        if (text(cfg, key) == null) return null;
        final int value;
        try {
            value = cfg.getInt(key);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid value for " + name + "." + key + ": " + e.getMessage(), e);
        }
        if (value <= 0) {
            throw new ConfigurationException("Invalid value for " + name + "." + key + ": must be positive");
        }
        return value;
    }

    private static int requiredInt(final Config cfg, final String key, final String name) {
        final Integer value = positiveInt(cfg, key, name);
        if (value == null) {
            throw ConfigurationException.missing(name, List.of(key));
        }
        return value;
    }

    private static Optional<Boolean> bool(final Config cfg, final String key, final String name) {
        if (text(cfg, key) == null) return Optional.empty();
        try {
            return Optional.of(cfg.getBoolean(key));
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid value for " + name + "." + key + ": " + e.getMessage(), e);
        }
    }
}
