package com.mimecast.sendeml.mime;

import java.io.IOException;

/**
 * Malformed message exception.
 *
 * <p>Thrown when the header and body of a raw message cannot be told apart.
 */
public class MalformedMessageException extends IOException {

    /**
     * Constructs a new MalformedMessageException instance with given message.
     *
     * @param message Message string.
     */
    public MalformedMessageException(String message) {
        super(message);
    }
}
