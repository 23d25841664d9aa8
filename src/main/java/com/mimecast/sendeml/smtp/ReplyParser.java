package com.mimecast.sendeml.smtp;

import com.mimecast.sendeml.smtp.io.LineInputStream;
import com.mimecast.sendeml.smtp.session.SessionContext;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * SMTP reply reader.
 *
 * <p>Reads lines until the last line of a reply and classifies it.
 * <br>Continuation lines are logged and otherwise ignored.
 * <br>Only the last line is returned.
 */
public class ReplyParser {
    private static final Logger log = LogManager.getLogger(ReplyParser.class);

    /**
     * Input stream.
     */
    private final LineInputStream input;

    /**
     * Session context for log prefixing.
     */
    private final SessionContext context;

    /**
     * Constructs a new ReplyParser instance.
     *
     * @param input   LineInputStream instance.
     * @param context SessionContext instance.
     */
    public ReplyParser(LineInputStream input, SessionContext context) {
        this.input = input;
        this.context = context;
    }

    /**
     * Reads one reply.
     *
     * @return Last line of a positive reply.
     * @throws ConnectionClosedException Stream ended or failed before the last line.
     * @throws NegativeReplyException    Last line is not 2xx or 3xx.
     * @throws IOException               Unable to read.
     */
    public SmtpReply read() throws IOException {
        while (true) {
            SmtpReply reply = SmtpReply.parse(readLine());
            log.info("{}recv: {}", context.prefix(), reply.line());

            if (reply.isLast()) {
                if (reply.isPositive()) {
                    return reply;
                }

                throw new NegativeReplyException(reply);
            }
        }
    }

    /**
     * Reads one line with trailing whitespace removed.
     *
     * @return Line string.
     * @throws IOException Unable to read.
     */
    private String readLine() throws IOException {
        byte[] bytes;
        try {
            bytes = input.readLine();
        } catch (SocketTimeoutException e) {
            throw new ConnectionClosedException("Connection timed out", e);
        } catch (IOException e) {
            throw new ConnectionClosedException("Connection closed by foreign host", e);
        }

        if (bytes == null) {
            throw new ConnectionClosedException("Connection closed by foreign host");
        }

        return StringUtils.stripEnd(new String(bytes, StandardCharsets.UTF_8), null);
    }
}
