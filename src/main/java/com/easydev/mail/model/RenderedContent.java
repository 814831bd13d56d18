package com.easydev.mail.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of a {@link com.easydev.mail.template.MessageTemplate}: subject,
 * HTML body and optional attachments. The HTML is passed through untouched.
 */
public final class RenderedContent {

    private final String           subject;
    private final String           html;
    private final List<Attachment> attachments;

    public RenderedContent(final String subject, final String html) {
        this(subject, html, List.of());
    }

    public RenderedContent(final String subject, final String html, final List<Attachment> attachments) {
        this.subject     = Objects.requireNonNull(subject, "subject");
        this.html        = Objects.requireNonNull(html, "html");
        this.attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public String           getSubject()     { return subject; }
    public String           getHtml()        { return html; }
    public List<Attachment> getAttachments() { return attachments; }
}
