package com.easydev.mail.transport;

import com.easydev.mail.auth.CredentialProvider;
import com.easydev.mail.auth.OAuth2CredentialProvider;
import com.easydev.mail.config.ConnectionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Transporter}s from resolved profiles.
 *
 * <p>Profiles with OAuth2 settings get an {@link OAuth2CredentialProvider};
 * everything else authenticates with the profile's static password. No
 * network I/O happens here: the returned transporter is ready but unverified.
 */
public class TransportFactory {

    private static final Logger LOG = LoggerFactory.getLogger(TransportFactory.class);

    public Transporter createTransporter(final ConnectionProfile profile) {
        final CredentialProvider credentials = profile.getOAuth2()
                .map(o -> (CredentialProvider) new OAuth2CredentialProvider(o, profile.getConnectTimeoutMs()))
                .orElse(null);

        LOG.info("Transporter created: profile={} provider={} host={}:{} secure={} auth={} pool={}/{} rate={}/{}ms",
                profile.getName(), profile.label(), profile.getHost(), profile.getPort(), profile.isSecure(),
                credentials != null ? "oauth2" : "password",
                profile.getMaxConnections(), profile.getMaxMessages(),
                profile.getRateLimit(), profile.getRateWindowMs());

        return new SmtpTransporter(profile, credentials);
    }
}
