package com.easydev.mail.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A file attached to an outgoing message. Content is held in memory; the
 * array is copied on the way in and on the way out.
 */
public final class Attachment {

    private final String filename;
    private final String contentType;
    private final byte[] content;

    public Attachment(final String filename, final String contentType, final byte[] content) {
        this.filename    = Objects.requireNonNull(filename, "filename");
        this.contentType = contentType != null ? contentType : "application/octet-stream";
        this.content     = Arrays.copyOf(Objects.requireNonNull(content, "content"), content.length);
    }

    public String getFilename()    { return filename; }
    public String getContentType() { return contentType; }
    public byte[] getContent()     { return Arrays.copyOf(content, content.length); }
    public int    size()           { return content.length; }

    @Override
    public String toString() {
        return "Attachment{" + filename + ", " + contentType + ", " + content.length + " bytes}";
    }
}
