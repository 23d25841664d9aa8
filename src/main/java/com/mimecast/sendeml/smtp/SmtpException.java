package com.mimecast.sendeml.smtp;

import java.io.IOException;

/**
 * SMTP exception.
 *
 * <p>Base of the protocol errors that abort a whole session.
 *
 * @see ConnectionClosedException
 * @see NegativeReplyException
 */
public class SmtpException extends IOException {

    /**
     * Constructs a new SmtpException instance with given message.
     *
     * @param message Message string.
     */
    public SmtpException(String message) {
        super(message);
    }

    /**
     * Constructs a new SmtpException instance with given message and cause.
     *
     * @param message Message string.
     * @param cause   Throwable instance.
     */
    public SmtpException(String message, Throwable cause) {
        super(message, cause);
    }
}
