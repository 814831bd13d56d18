package com.easydev.mail.model;

/**
 * What the mail transport hands back after accepting a message.
 */
public final class SendReceipt {

    private final String messageId;
    private final String provider;

    public SendReceipt(final String messageId, final String provider) {
        this.messageId = messageId;
        this.provider  = provider;
    }

    public String getMessageId() { return messageId; }
    public String getProvider()  { return provider; }

    @Override
    public String toString() {
        return "SendReceipt{messageId=" + messageId + ", provider=" + provider + "}";
    }
}
