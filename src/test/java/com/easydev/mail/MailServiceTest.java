package com.easydev.mail;

import com.easydev.mail.config.ConnectionProfile;
import com.easydev.mail.config.MailConfig;
import com.easydev.mail.error.ConfigurationException;
import com.easydev.mail.error.ConnectionException;
import com.easydev.mail.error.ValidationException;
import com.easydev.mail.metrics.MetricsSnapshot;
import com.easydev.mail.model.Attachment;
import com.easydev.mail.model.DeliveryResult;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.RenderedContent;
import com.easydev.mail.model.SendReceipt;
import com.easydev.mail.template.MessageTemplate;
import com.easydev.mail.transport.TransportFactory;
import com.easydev.mail.transport.Transporter;
import com.easydev.mail.verify.VerificationResult;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailServiceTest {

    @Mock private TransportFactory factory;
    @Mock private Transporter      primary;
    @Mock private Transporter      fallback;

    private final List<Long> sleeps = new ArrayList<>();

    private final MessageTemplate welcome = data -> new RenderedContent(
            "Welcome " + data.get("name"),
            "<h1>Hi " + data.get("name") + "</h1>",
            List.of(new Attachment("terms.pdf", "application/pdf", new byte[] {1, 2, 3})));

    private static final String PRIMARY_ONLY =
            "mail.primary { service = gmail, user = \"noreply@easydev.com\", pass = app-password }\n"
          + "mail.verify { max-attempts = 3, base-delay-ms = 100 }";

    private static final String WITH_FALLBACK = PRIMARY_ONLY + "\n"
          + "mail.fallback { service = sendgrid, user = apikey, pass = SG.key }";

    @BeforeEach
    void setup() {
        lenient().when(factory.createTransporter(argThat(p -> p != null && "primary".equals(p.getName()))))
                .thenReturn(primary);
        lenient().when(factory.createTransporter(argThat(p -> p != null && "fallback".equals(p.getName()))))
                .thenReturn(fallback);
        lenient().when(primary.providerName()).thenReturn("gmail");
        lenient().when(fallback.providerName()).thenReturn("sendgrid");
    }

    private MailService service(final String hocon) {
        return new MailService(MailConfig.from(ConfigFactory.parseString(hocon)), factory, sleeps::add);
    }

    private static Map<String, Object> data(final String email) {
        final Map<String, Object> data = new HashMap<>();
        data.put("email", email);
        data.put("name", "Ngozi");
        return data;
    }

    // ── Construction ──────────────────────────────────────────────────────────

    @Test
    void constructor_createsOnlyPrimary_whenNoFallbackConfigured() {
        final MailService service = service(PRIMARY_ONLY);

        verify(factory, times(1)).createTransporter(any());
        assertThat(service.getPrimaryProfile().getHost()).isEqualTo("smtp.gmail.com");
        assertThat(service.getDefaultSender()).isEqualTo("\"Easy Dev\" <noreply@easydev.com>");
    }

    @Test
    void constructor_failsFast_onMissingConfiguration() {
        assertThatThrownBy(() -> service("mail.primary { pass = x }"))
                .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(factory);
    }

    // ── sendEmail ─────────────────────────────────────────────────────────────

    @Test
    void sendEmail_rendersTemplate_andUsesDefaultSender() {
        when(primary.sendMail(any(), any())).thenReturn(new SendReceipt("<id-1>", "gmail"));
        final MailService service = service(PRIMARY_ONLY);

        final DeliveryResult result = service.sendEmail(welcome, data("ngozi@test.com"));

        final ArgumentCaptor<MailMessage> sent = ArgumentCaptor.forClass(MailMessage.class);
        verify(primary).sendMail(sent.capture(), any());
        assertThat(result.isSuccess()).isTrue();
        assertThat(sent.getValue().getFrom()).isEqualTo("\"Easy Dev\" <noreply@easydev.com>");
        assertThat(sent.getValue().getTo()).isEqualTo("ngozi@test.com");
        assertThat(sent.getValue().getSubject()).isEqualTo("Welcome Ngozi");
        assertThat(sent.getValue().getAttachments()).hasSize(1);
        assertThat(sent.getValue().getHeaders()).containsEntry("X-Email-Service", "gmail");
        assertThat(service.getMetrics().getEmailsSent()).isEqualTo(1);
    }

    @Test
    void sendEmail_honoursSenderOverride_andCustomHeaders() {
        when(primary.sendMail(any(), any())).thenReturn(new SendReceipt("<id-2>", "gmail"));
        final Map<String, Object> data = data("ngozi@test.com");
        data.put("sender", "billing@easydev.com");
        data.put("customHeaders", Map.of("X-Campaign", "spring"));

        service(PRIMARY_ONLY).sendEmail(welcome, data);

        final ArgumentCaptor<MailMessage> sent = ArgumentCaptor.forClass(MailMessage.class);
        verify(primary).sendMail(sent.capture(), any());
        assertThat(sent.getValue().getFrom()).isEqualTo("billing@easydev.com");
        assertThat(sent.getValue().getHeaders()).containsEntry("X-Campaign", "spring");
    }

    @Test
    void sendEmail_throwsValidation_withoutRenderingOrSending_whenEmailMissing() {
        final MessageTemplate template = mock(MessageTemplate.class);
        final MailService service = service(PRIMARY_ONLY);

        assertThatThrownBy(() -> service.sendEmail(template, new HashMap<>()))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(template);
        verify(primary, never()).sendMail(any(), any());
        assertThat(service.getMetrics()).isEqualTo(new MetricsSnapshot(0, 0, 0, 0, 0));
    }

    @Test
    void sendEmail_failsOverToFallback_whenPrimaryDown() {
        when(primary.sendMail(any(), any())).thenThrow(new ConnectionException("gmail", "421 try later"));
        when(fallback.sendMail(any(), any())).thenReturn(new SendReceipt("<fb>", "sendgrid"));
        final MailService service = service(WITH_FALLBACK);

        final DeliveryResult result = service.sendEmail(welcome, data("ngozi@test.com"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isUsedFallback()).isTrue();
        assertThat(service.getMetrics()).isEqualTo(new MetricsSnapshot(0, 0, 0, 1, 0));
    }

    // ── verifyEmailConnection ─────────────────────────────────────────────────

    @Test
    void verifyEmailConnection_usesConfiguredSchedule() {
        doThrow(new ConnectionException("gmail", "timeout")).when(primary).verify(any());
        final MailService service = service(PRIMARY_ONLY);

        final VerificationResult result = service.verifyEmailConnection();

        assertThat(result.isSuccess()).isFalse();
        verify(primary, times(3)).verify(any());
        assertThat(sleeps).containsExactly(100L, 200L);
        assertThat(service.getMetrics()).isEqualTo(new MetricsSnapshot(1, 0, 1, 0, 0));
    }

    @Test
    void verifyEmailConnection_acceptsExplicitRetries() {
        final MailService service = service(PRIMARY_ONLY);

        final VerificationResult result = service.verifyEmailConnection(1, 10);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMetrics()).isEqualTo(service.getMetrics());
    }

    @Test
    void close_closesBothTransporters() {
        final MailService service = service(WITH_FALLBACK);

        service.close();

        verify(primary).close();
        verify(fallback).close();
    }

    @Test
    void getPrimaryProfile_keepsSecretsOutOfToString() {
        final ConnectionProfile profile = service(PRIMARY_ONLY).getPrimaryProfile();

        assertThat(profile.toString()).doesNotContain("app-password");
    }
}
