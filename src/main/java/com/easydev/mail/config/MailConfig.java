package com.easydev.mail.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Optional;

/**
 * Typed view over the {@code mail} block of the application configuration,
 * loaded from {@code application.conf} / {@code reference.conf} via Typesafe Config.
 *
 * <p>Credentials arrive through environment substitution
 * (e.g. {@code ${?EMAIL_PASS}}). This class never logs or exposes them beyond
 * handing the raw profile blocks to {@link ProfileResolver}.
 */
public final class MailConfig {

    private final Config raw;

    private MailConfig(final Config config) {
        this.raw = config;
    }

    public static MailConfig load() {
        return new MailConfig(ConfigFactory.load().resolve());
    }

    /** Wraps an already-built config, layered over the bundled defaults. */
    public static MailConfig from(final Config config) {
        return new MailConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    // ── Connection profiles ───────────────────────────────────────────────────

    public Config getPrimaryProfile() {
        return raw.getConfig("mail.primary");
    }

    public Config getFallbackProfile() {
        return raw.getConfig("mail.fallback");
    }

    // ── Sender ────────────────────────────────────────────────────────────────

    public String getSenderName() {
        return raw.getString("mail.sender.name");
    }

    /** Explicit From address; when absent the primary user is used. */
    public Optional<String> getSenderAddress() {
        return raw.hasPath("mail.sender.address") && !raw.getString("mail.sender.address").isBlank()
                ? Optional.of(raw.getString("mail.sender.address"))
                : Optional.empty();
    }

    // ── Verification ──────────────────────────────────────────────────────────

    public int getVerifyMaxAttempts() {
        return raw.getInt("mail.verify.max-attempts");
    }

    public long getVerifyBaseDelayMs() {
        return raw.getLong("mail.verify.base-delay-ms");
    }
}
