package com.mimecast.sendeml.smtp;

/**
 * Negative reply exception.
 *
 * <p>Thrown for a final reply line whose code is neither 2xx nor 3xx.
 * <br>The exception message is the full reply line.
 */
public class NegativeReplyException extends SmtpException {

    /**
     * Reply that caused this exception.
     */
    private final SmtpReply reply;

    /**
     * Constructs a new NegativeReplyException instance with given reply.
     *
     * @param reply SmtpReply instance.
     */
    public NegativeReplyException(SmtpReply reply) {
        super(reply.line());
        this.reply = reply;
    }

    /**
     * Gets reply.
     *
     * @return SmtpReply instance.
     */
    public SmtpReply getReply() {
        return reply;
    }
}
