package com.easydev.mail.retry;

import com.easydev.mail.error.MailDispatchException;

/**
 * The caller's {@link Deadline} expired, or the waiting thread was interrupted,
 * before the operation could continue.
 */
public class DeadlineExceededException extends MailDispatchException {

    public DeadlineExceededException(final String message) {
        super(message);
    }

    public DeadlineExceededException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
