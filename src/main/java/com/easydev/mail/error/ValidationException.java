package com.easydev.mail.error;

/**
 * The message cannot be sent as given, typically an empty or malformed
 * recipient. Raised before any network I/O.
 */
public class ValidationException extends MailDispatchException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
