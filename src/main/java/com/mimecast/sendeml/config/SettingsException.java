package com.mimecast.sendeml.config;

/**
 * Settings exception.
 *
 * <p>Thrown when a settings file is missing, unparsable or has a missing or mistyped value.
 */
public class SettingsException extends Exception {

    /**
     * Constructs a new SettingsException instance with given message.
     *
     * @param message Message string.
     */
    public SettingsException(String message) {
        super(message);
    }

    /**
     * Constructs a new SettingsException instance with given message and cause.
     *
     * @param message Message string.
     * @param cause   Throwable instance.
     */
    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
