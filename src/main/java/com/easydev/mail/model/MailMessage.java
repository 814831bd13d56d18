package com.easydev.mail.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outgoing email: addressing, rendered content and extra headers.
 *
 * <p>No validation happens here; the dispatcher checks the recipient before
 * any I/O so that a malformed message never reaches a transporter.
 */
public final class MailMessage {

    private final String              from;
    private final String              to;
    private final String              subject;
    private final String              html;
    private final List<Attachment>    attachments;
    private final Map<String, String> headers;

    private MailMessage(final Builder b) {
        this.from        = b.from;
        this.to          = b.to;
        this.subject     = b.subject;
        this.html        = b.html;
        this.attachments = List.copyOf(b.attachments);
        this.headers     = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String from;
        private String to;
        private String subject = "";
        private String html    = "";
        private final List<Attachment>    attachments = new ArrayList<>();
        private final Map<String, String> headers     = new LinkedHashMap<>();

        private Builder() {}

        public Builder from(final String v)    { this.from = v; return this; }
        public Builder to(final String v)      { this.to = v; return this; }
        public Builder subject(final String v) { this.subject = v; return this; }
        public Builder html(final String v)    { this.html = v; return this; }

        public Builder attachment(final Attachment a) {
            this.attachments.add(a);
            return this;
        }

        public Builder attachments(final List<Attachment> list) {
            if (list != null) this.attachments.addAll(list);
            return this;
        }

        public Builder header(final String name, final String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(final Map<String, String> map) {
            if (map != null) this.headers.putAll(map);
            return this;
        }

        /** Copies subject, HTML and attachments from a rendered template. */
        public Builder content(final RenderedContent content) {
            this.subject = content.getSubject();
            this.html    = content.getHtml();
            this.attachments.addAll(content.getAttachments());
            return this;
        }

        public MailMessage build() { return new MailMessage(this); }
    }

    public String              getFrom()        { return from; }
    public String              getTo()          { return to; }
    public String              getSubject()     { return subject; }
    public String              getHtml()        { return html; }
    public List<Attachment>    getAttachments() { return attachments; }
    public Map<String, String> getHeaders()     { return headers; }

    public boolean hasRecipient() {
        return to != null && !to.isBlank();
    }

    /** Same message with {@code extra} headers added; existing names win. */
    public MailMessage withDefaultHeaders(final Map<String, String> extra) {
        final Map<String, String> merged = new LinkedHashMap<>(extra);
        merged.putAll(headers);
        return builder()
                .from(from).to(to).subject(subject).html(html)
                .attachments(attachments)
                .headers(merged)
                .build();
    }

    @Override
    public String toString() {
        return "MailMessage{to=" + to
             + ", subject=" + subject
             + ", attachments=" + attachments.size()
             + ", headers=" + headers.keySet() + "}";
    }
}
