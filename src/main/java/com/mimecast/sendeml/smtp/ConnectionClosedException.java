package com.mimecast.sendeml.smtp;

/**
 * Connection closed exception.
 *
 * <p>Thrown when the peer closes the connection or a read times out before a complete reply arrived.
 */
public class ConnectionClosedException extends SmtpException {

    /**
     * Constructs a new ConnectionClosedException instance with given message.
     *
     * @param message Message string.
     */
    public ConnectionClosedException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConnectionClosedException instance with given message and cause.
     *
     * @param message Message string.
     * @param cause   Throwable instance.
     */
    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
