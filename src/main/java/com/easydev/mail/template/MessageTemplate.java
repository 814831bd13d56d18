package com.easydev.mail.template;

import com.easydev.mail.model.RenderedContent;

import java.util.Map;

/**
 * Renders a message body from a data payload. Templates live outside this
 * service; anything that can turn a map into subject, HTML and attachments
 * can be passed to {@link com.easydev.mail.MailService#sendEmail}.
 */
@FunctionalInterface
public interface MessageTemplate {

    RenderedContent render(Map<String, Object> data);
}
