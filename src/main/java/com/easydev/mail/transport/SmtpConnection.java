package com.easydev.mail.transport;

import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One authenticated SMTP session, as held by {@link SmtpConnectionPool}.
 */
interface SmtpConnection {

    void send(MimeMessage message) throws MessagingException;

    boolean isConnected();

    void close();

    /** Opens and authenticates a new connection. */
    @FunctionalInterface
    interface Opener {
        SmtpConnection open() throws MessagingException;
    }

    /** {@link SmtpConnection} backed by a connected Jakarta Mail {@link Transport}. */
    final class JakartaSmtpConnection implements SmtpConnection {

        private static final Logger LOG = LoggerFactory.getLogger(JakartaSmtpConnection.class);

        private final Transport transport;

        JakartaSmtpConnection(final Transport transport) {
            this.transport = transport;
        }

        @Override
        public void send(final MimeMessage message) throws MessagingException {
            transport.sendMessage(message, message.getAllRecipients());
        }

        @Override
        public boolean isConnected() {
            return transport.isConnected();
        }

        @Override
        public void close() {
            try {
                transport.close();
            } catch (MessagingException e) {
                LOG.debug("Ignoring error while closing SMTP connection: {}", e.getMessage());
            }
        }
    }
}
