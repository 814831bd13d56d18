package com.easydev.mail.transport;

import com.easydev.mail.error.ValidationException;
import com.easydev.mail.model.Attachment;
import com.easydev.mail.model.MailMessage;
import jakarta.activation.DataHandler;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;

/**
 * Builds the MIME representation of a {@link MailMessage}: an HTML body,
 * wrapped in {@code multipart/mixed} when there are attachments.
 */
final class MimeMessageFactory {

    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private MimeMessageFactory() {}

    static MimeMessage create(final Session session, final MailMessage message) {
        try {
            final MimeMessage mime = new MimeMessage(session);
            mime.setFrom(new InternetAddress(message.getFrom(), true));
            mime.setRecipients(MimeMessage.RecipientType.TO, InternetAddress.parse(message.getTo(), true));
            mime.setSubject(message.getSubject(), CHARSET);
            mime.setSentDate(new Date());

            if (message.getAttachments().isEmpty()) {
                mime.setText(message.getHtml(), CHARSET, "html");
            } else {
                final MimeMultipart mixed = new MimeMultipart("mixed");
                final MimeBodyPart body = new MimeBodyPart();
                body.setText(message.getHtml(), CHARSET, "html");
                mixed.addBodyPart(body);
                for (final Attachment attachment : message.getAttachments()) {
                    mixed.addBodyPart(attachmentPart(attachment));
                }
                mime.setContent(mixed);
            }

            for (final Map.Entry<String, String> header : message.getHeaders().entrySet()) {
                mime.setHeader(header.getKey(), header.getValue());
            }
            mime.saveChanges();
            return mime;
        } catch (MessagingException e) {
            throw new ValidationException("Cannot build MIME message: " + e.getMessage(), e);
        }
    }

    private static MimeBodyPart attachmentPart(final Attachment attachment) throws MessagingException {
        final MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(
                new ByteArrayDataSource(attachment.getContent(), attachment.getContentType())));
        part.setFileName(attachment.getFilename());
        part.setDisposition(MimeBodyPart.ATTACHMENT);
        return part;
    }
}
