package com.easydev.mail.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known SMTP endpoints addressable by service name, so a profile can say
 * {@code service = gmail} instead of spelling out host, port and TLS mode.
 */
public final class ProviderPresets {

    /** Endpoint supplied by a named service. */
    public static final class Preset {
        private final String  host;
        private final int     port;
        private final boolean secure;

        Preset(final String host, final int port, final boolean secure) {
            this.host   = host;
            this.port   = port;
            this.secure = secure;
        }

        public String  getHost() { return host; }
        public int     getPort() { return port; }
        public boolean isSecure() { return secure; }
    }

    private static final Map<String, Preset> PRESETS = Map.ofEntries(
            Map.entry("gmail",      new Preset("smtp.gmail.com", 465, true)),
            Map.entry("outlook",    new Preset("smtp-mail.outlook.com", 587, false)),
            Map.entry("hotmail",    new Preset("smtp-mail.outlook.com", 587, false)),
            Map.entry("office365",  new Preset("smtp.office365.com", 587, false)),
            Map.entry("yahoo",      new Preset("smtp.mail.yahoo.com", 465, true)),
            Map.entry("sendgrid",   new Preset("smtp.sendgrid.net", 587, false)),
            Map.entry("brevo",      new Preset("smtp-relay.brevo.com", 587, false)),
            Map.entry("sendinblue", new Preset("smtp-relay.brevo.com", 587, false)),
            Map.entry("mailgun",    new Preset("smtp.mailgun.org", 465, true)),
            Map.entry("ses",        new Preset("email-smtp.us-east-1.amazonaws.com", 465, true)),
            Map.entry("zoho",       new Preset("smtp.zoho.com", 465, true)),
            Map.entry("icloud",     new Preset("smtp.mail.me.com", 587, false)),
            Map.entry("postmark",   new Preset("smtp.postmarkapp.com", 2525, false)));

    private ProviderPresets() {}

    /** Case-insensitive lookup; empty for unknown or blank names. */
    public static Optional<Preset> find(final String service) {
        if (service == null || service.isBlank()) return Optional.empty();
        return Optional.ofNullable(PRESETS.get(service.trim().toLowerCase(Locale.ROOT)));
    }
}
