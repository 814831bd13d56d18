package com.easydev.mail.dispatch;

import com.easydev.mail.error.ConnectionException;
import com.easydev.mail.error.ValidationException;
import com.easydev.mail.metrics.DeliveryMetrics;
import com.easydev.mail.metrics.MetricsSnapshot;
import com.easydev.mail.model.DeliveryResult;
import com.easydev.mail.model.MailMessage;
import com.easydev.mail.model.SendReceipt;
import com.easydev.mail.retry.Deadline;
import com.easydev.mail.transport.Transporter;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailDispatcherTest {

    @Mock private Transporter primary;
    @Mock private Transporter fallback;

    private DeliveryMetrics metrics;

    private final MailMessage message = MailMessage.builder()
            .from("\"Easy Dev\" <noreply@easydev.com>")
            .to("adaeze@test.com")
            .subject("Welcome")
            .html("<p>Hello</p>")
            .build();

    @BeforeEach
    void setup() {
        metrics = new DeliveryMetrics();
        lenient().when(primary.providerName()).thenReturn("gmail");
        lenient().when(fallback.providerName()).thenReturn("sendgrid");
    }

    private MailDispatcher dispatcher(final Optional<Transporter> fb) {
        return new MailDispatcher(new DispatchFailoverPolicy(primary, fb), metrics, new EnvelopeBuilder("gmail"));
    }

    // ── Scenario A: primary healthy ───────────────────────────────────────────

    @Test
    void send_deliversViaPrimary_whenPrimaryHealthy() {
        when(primary.sendMail(any(), any())).thenReturn(new SendReceipt("<abc@gmail>", "gmail"));

        final DeliveryResult result = dispatcher(Optional.of(fallback)).send(message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isUsedFallback()).isFalse();
        assertThat(result.getMessageId()).isEqualTo("<abc@gmail>");
        assertThat(result.getProvider()).isEqualTo("gmail");
        verify(fallback, never()).sendMail(any(), any());
        assertThat(metrics.snapshot()).isEqualTo(new MetricsSnapshot(0, 0, 0, 1, 0));
    }

    // ── Scenario B: primary down, fallback healthy ────────────────────────────

    @Test
    void send_failsOverOnce_whenPrimaryErrors() {
        when(primary.sendMail(any(), any())).thenThrow(new ConnectionException("gmail", "535 auth failed"));
        when(fallback.sendMail(any(), any())).thenReturn(new SendReceipt("<fb@sendgrid>", "sendgrid"));

        final DeliveryResult result = dispatcher(Optional.of(fallback)).send(message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isUsedFallback()).isTrue();
        assertThat(result.getProvider()).isEqualTo("sendgrid");
        verify(primary, times(1)).sendMail(any(), any());
        verify(fallback, times(1)).sendMail(any(), any());
        assertThat(metrics.snapshot()).isEqualTo(new MetricsSnapshot(0, 0, 0, 1, 0));
    }

    // ── Scenario C: both down ─────────────────────────────────────────────────

    @Test
    void send_returnsFailure_whenPrimaryAndFallbackBothError() {
        when(primary.sendMail(any(), any())).thenThrow(new ConnectionException("gmail", "timeout"));
        when(fallback.sendMail(any(), any())).thenThrow(new ConnectionException("sendgrid", "refused"));

        final DeliveryResult result = dispatcher(Optional.of(fallback)).send(message);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isNotNull().contains("timeout").contains("refused");
        assertThat(metrics.snapshot()).isEqualTo(new MetricsSnapshot(0, 0, 0, 0, 1));
    }

    @Test
    void send_returnsFailure_whenPrimaryErrorsAndNoFallback() {
        when(primary.sendMail(any(), any())).thenThrow(new ConnectionException("gmail", "timeout"));

        final DeliveryResult result = dispatcher(Optional.empty()).send(message);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isUsedFallback()).isFalse();
        assertThat(result.getError()).contains("timeout");
        assertThat(metrics.snapshot().getEmailsFailed()).isEqualTo(1);
    }

    // ── Validation ────────────────────────────────────────────────────────────

    @Test
    void send_throwsValidation_andTouchesNothing_whenRecipientEmpty() {
        final MailMessage noRecipient = MailMessage.builder().from("a@b.com").to(" ").build();

        assertThatThrownBy(() -> dispatcher(Optional.of(fallback)).send(noRecipient))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(primary, fallback);
        assertThat(metrics.snapshot()).isEqualTo(new MetricsSnapshot(0, 0, 0, 0, 0));
    }

    @Test
    void send_throwsValidation_whenRecipientMalformed() {
        final MailMessage bad = MailMessage.builder().from("a@b.com").to("not an address").build();

        assertThatThrownBy(() -> dispatcher(Optional.empty()).send(bad))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not an address");
        verifyNoInteractions(primary);
    }

    @Test
    void send_acceptsCommaSeparatedRecipients() {
        when(primary.sendMail(any(), any())).thenReturn(new SendReceipt("<id>", "gmail"));
        final MailMessage twoRecipients = MailMessage.builder()
                .from("a@b.com").to("x@y.com, z@y.com").build();

        final DeliveryResult result = dispatcher(Optional.empty()).send(twoRecipients);

        assertThat(result.isSuccess()).isTrue();
        verify(primary).sendMail(argThat(m -> m.getTo().equals("x@y.com, z@y.com")), any());
    }

    @Test
    void send_throwsValidation_whenOneListedRecipientHasNoDomain() {
        final MailMessage partlyBad = MailMessage.builder().from("a@b.com").to("x@y.com, nobody").build();

        assertThatThrownBy(() -> dispatcher(Optional.empty()).send(partlyBad))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(primary);
    }

    @Test
    void send_throwsValidation_whenRecipientListHasOnlySeparators() {
        final MailMessage separators = MailMessage.builder().from("a@b.com").to(" , ").build();

        assertThatThrownBy(() -> dispatcher(Optional.empty()).send(separators))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(primary);
    }

    // ── Envelope ──────────────────────────────────────────────────────────────

    @Test
    void send_addsCorrelationHeaders_butCallerHeadersWin() {
        when(primary.sendMail(any(), any())).thenReturn(new SendReceipt("<id>", "gmail"));
        final MailMessage withHeader = MailMessage.builder()
                .from("a@b.com").to("adaeze@test.com")
                .header(EnvelopeBuilder.SERVICE_HEADER, "custom")
                .build();

        dispatcher(Optional.empty()).send(withHeader);

        final ArgumentCaptor<MailMessage> sent = ArgumentCaptor.forClass(MailMessage.class);
        verify(primary).sendMail(sent.capture(), any());
        assertThat(sent.getValue().getHeaders())
                .containsEntry(EnvelopeBuilder.SERVICE_HEADER, "custom")
                .hasEntrySatisfying(EnvelopeBuilder.MESSAGE_ID_HEADER,
                        v -> assertThat(v).matches("msg-\\d+-[0-9a-z]+"));
    }

    // ── Deadline ──────────────────────────────────────────────────────────────

    @Test
    void send_skipsFallback_whenDeadlineExpiredAfterPrimaryFailure() {
        final Clock frozen = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        final Deadline expired = Deadline.after(Duration.ZERO, frozen);
        when(primary.sendMail(any(), any())).thenThrow(new ConnectionException("gmail", "timeout"));

        final DeliveryResult result = dispatcher(Optional.of(fallback)).send(message, expired);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("deadline");
        verify(fallback, never()).sendMail(any(), any());
        assertThat(metrics.snapshot().getEmailsFailed()).isEqualTo(1);
    }

    @Test
    void maskEmail_hidesLocalPart() {
        assertThat(MailDispatcher.maskEmail("admin@example.com")).isEqualTo("adm***@example.com");
        assertThat(MailDispatcher.maskEmail("a@example.com")).isEqualTo("***");
    }
}
