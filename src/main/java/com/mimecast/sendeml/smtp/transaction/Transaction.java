package com.mimecast.sendeml.smtp.transaction;

/**
 * SMTP transaction.
 *
 * <p>One command and the last line of the reply it got.
 */
public class Transaction {

    /**
     * Command verb (EHLO, MAIL, RCPT, ...).
     */
    private final String command;

    /**
     * Line sent as written to the log.
     */
    private final String payload;

    /**
     * Last reply line.
     */
    private final String response;

    /**
     * Is error.
     */
    private final boolean error;

    /**
     * Constructs a new Transaction instance.
     *
     * @param command  Command verb.
     * @param payload  Payload string.
     * @param response Response string.
     * @param error    Is error.
     */
    public Transaction(String command, String payload, String response, boolean error) {
        this.command = command;
        this.payload = payload;
        this.response = response;
        this.error = error;
    }

    /**
     * Gets command.
     *
     * @return Command string.
     */
    public String getCommand() {
        return command;
    }

    /**
     * Gets payload.
     *
     * @return Payload string.
     */
    public String getPayload() {
        return payload;
    }

    /**
     * Gets response.
     *
     * @return Response string.
     */
    public String getResponse() {
        return response;
    }

    /**
     * Is error.
     *
     * @return Boolean.
     */
    public boolean isError() {
        return error;
    }

    @Override
    public String toString() {
        return command + " [" + payload + "] -> " + response + (error ? " (error)" : "");
    }
}
