package com.easydev.mail.transport;

import com.easydev.mail.config.ConnectionProfile;
import jakarta.mail.Session;

import java.util.List;
import java.util.Properties;

/**
 * Translates a {@link ConnectionProfile} into Jakarta Mail session properties.
 *
 * <p>Jakarta Mail has no separate greeting timeout; the read timeout applies
 * to the greeting as well, so it is set to the larger of the greeting and
 * socket timeouts.
 */
final class SmtpSessionFactory {

    private static final List<String> TLS_VERSIONS = List.of("TLSv1", "TLSv1.1", "TLSv1.2", "TLSv1.3");

    private SmtpSessionFactory() {}

    static Session create(final ConnectionProfile profile) {
        final Session session = Session.getInstance(properties(profile));
        session.setDebug(profile.isDebug());
        return session;
    }

    static String protocol(final ConnectionProfile profile) {
        return profile.isSecure() ? "smtps" : "smtp";
    }

    static Properties properties(final ConnectionProfile profile) {
        final String p = "mail." + protocol(profile) + ".";
        final Properties props = new Properties();

        props.put("mail.transport.protocol", protocol(profile));
        props.put(p + "host", profile.getHost());
        props.put(p + "port", String.valueOf(profile.getPort()));
        props.put(p + "connectiontimeout", String.valueOf(profile.getConnectTimeoutMs()));
        props.put(p + "timeout",
                String.valueOf(Math.max(profile.getGreetingTimeoutMs(), profile.getSocketTimeoutMs())));
        props.put(p + "writetimeout", String.valueOf(profile.getSocketTimeoutMs()));

        final boolean oauth2 = profile.getOAuth2().isPresent();
        props.put(p + "auth", String.valueOf(oauth2 || profile.getPassword().isPresent()));
        if (oauth2) {
            props.put(p + "auth.mechanisms", "XOAUTH2");
            props.put(p + "auth.login.disable", "true");
            props.put(p + "auth.plain.disable", "true");
        }

        if (profile.isSecure()) {
            props.put(p + "ssl.enable", "true");
        } else {
            props.put(p + "starttls.enable", "true");
        }
        props.put(p + "ssl.protocols", tlsProtocols(profile.getTlsMinVersion()));
        if (profile.isRejectUnauthorized()) {
            props.put(p + "ssl.checkserveridentity", "true");
        } else {
            props.put(p + "ssl.trust", "*");
            props.put(p + "ssl.checkserveridentity", "false");
        }
        return props;
    }

    /** Space-separated protocol list from {@code minVersion} upwards. */
    static String tlsProtocols(final String minVersion) {
        final int from = TLS_VERSIONS.indexOf(minVersion);
        final List<String> allowed = from < 0 ? TLS_VERSIONS.subList(2, TLS_VERSIONS.size())
                                              : TLS_VERSIONS.subList(from, TLS_VERSIONS.size());
        return String.join(" ", allowed);
    }
}
