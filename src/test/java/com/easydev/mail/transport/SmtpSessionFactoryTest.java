package com.easydev.mail.transport;

import com.easydev.mail.config.ConnectionProfile;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class SmtpSessionFactoryTest {

    private static ConnectionProfile.Builder base() {
        return ConnectionProfile.builder("primary").host("smtp.example.com").user("u").password("p");
    }

    @Test
    void properties_useImplicitTls_forSecureProfile() {
        final ConnectionProfile profile = base().port(465).secure(true).build();

        final Properties props = SmtpSessionFactory.properties(profile);

        assertThat(SmtpSessionFactory.protocol(profile)).isEqualTo("smtps");
        assertThat(props.getProperty("mail.smtps.ssl.enable")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtps.port")).isEqualTo("465");
        assertThat(props.getProperty("mail.smtps.auth")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtps.starttls.enable")).isNull();
    }

    @Test
    void properties_useStartTls_forPlainProfile() {
        final Properties props = SmtpSessionFactory.properties(base().port(587).build());

        assertThat(props.getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtp.ssl.checkserveridentity")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtp.ssl.protocols")).isEqualTo("TLSv1.2 TLSv1.3");
    }

    @Test
    void properties_mapTimeouts_withGreetingFoldedIntoReadTimeout() {
        final Properties props = SmtpSessionFactory.properties(
                base().port(587).timeouts(5_000, 45_000, 20_000).build());

        assertThat(props.getProperty("mail.smtp.connectiontimeout")).isEqualTo("5000");
        assertThat(props.getProperty("mail.smtp.timeout")).isEqualTo("45000");
        assertThat(props.getProperty("mail.smtp.writetimeout")).isEqualTo("20000");
    }

    @Test
    void properties_trustAnyCertificate_whenRejectUnauthorizedDisabled() {
        final Properties props = SmtpSessionFactory.properties(base().port(587).tls(false, "TLSv1.3").build());

        assertThat(props.getProperty("mail.smtp.ssl.trust")).isEqualTo("*");
        assertThat(props.getProperty("mail.smtp.ssl.checkserveridentity")).isEqualTo("false");
        assertThat(props.getProperty("mail.smtp.ssl.protocols")).isEqualTo("TLSv1.3");
    }

    @Test
    void properties_restrictToXoauth2_whenOAuth2Configured() {
        final ConnectionProfile profile = ConnectionProfile.builder("primary")
                .host("smtp.gmail.com").port(465).secure(true).user("me@gmail.com")
                .oauth2(new ConnectionProfile.OAuth2("id", "secret", "refresh", null, "https://token"))
                .build();

        final Properties props = SmtpSessionFactory.properties(profile);

        assertThat(props.getProperty("mail.smtps.auth")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtps.auth.mechanisms")).isEqualTo("XOAUTH2");
        assertThat(props.getProperty("mail.smtps.auth.plain.disable")).isEqualTo("true");
    }

    @Test
    void tlsProtocols_fallsBackToModernSet_forUnknownVersion() {
        assertThat(SmtpSessionFactory.tlsProtocols("SSLv3")).isEqualTo("TLSv1.2 TLSv1.3");
        assertThat(SmtpSessionFactory.tlsProtocols("TLSv1.1")).isEqualTo("TLSv1.1 TLSv1.2 TLSv1.3");
    }
}
