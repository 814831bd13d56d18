package com.easydev.mail.dispatch;

import com.easydev.mail.model.MailMessage;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Adds the correlation headers every outgoing message carries.
 *
 * <ul>
 *   <li>{@code X-Message-ID: msg-<epochMillis>-<random base36>}</li>
 *   <li>{@code X-Email-Service: <service>} or {@code CustomSMTP} for a bare host</li>
 * </ul>
 * Headers already on the message win over these.
 */
public class EnvelopeBuilder {

    public static final String MESSAGE_ID_HEADER = "X-Message-ID";
    public static final String SERVICE_HEADER    = "X-Email-Service";
    public static final String CUSTOM_SMTP       = "CustomSMTP";

    private final String service;
    private final Clock  clock;

    public EnvelopeBuilder(final String service) {
        this(service, Clock.systemUTC());
    }

    EnvelopeBuilder(final String service, final Clock clock) {
        this.service = service != null && !service.isBlank() ? service : CUSTOM_SMTP;
        this.clock   = clock;
    }

    public MailMessage build(final MailMessage message) {
        return message.withDefaultHeaders(Map.of(
                MESSAGE_ID_HEADER, nextMessageId(),
                SERVICE_HEADER,    service));
    }

    String nextMessageId() {
        final long random = ThreadLocalRandom.current().nextLong(Long.MAX_VALUE);
        return "msg-" + clock.millis() + "-" + Long.toString(random, 36);
    }
}
