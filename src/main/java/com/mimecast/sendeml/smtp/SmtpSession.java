package com.mimecast.sendeml.smtp;

import com.mimecast.sendeml.config.Settings;
import com.mimecast.sendeml.mime.MalformedMessageException;
import com.mimecast.sendeml.mime.MessageTransformer;
import com.mimecast.sendeml.smtp.connection.Connection;
import com.mimecast.sendeml.smtp.session.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SMTP client session.
 *
 * <p>Drives every EML file of the settings through one connection:
 * <pre>
 * greeting, EHLO,
 * [RSET,] MAIL FROM, RCPT TO (per recipient), DATA, message bytes, CRLF . CRLF
 * (repeated per file)
 * QUIT
 * </pre>
 * <p>RSET is only sent between two messages actually sent on the connection.
 * <br>Missing files are skipped. Files that cannot be read or split into header and body are
 * reported as failed and skipped before any command is issued for them.
 * <p>A negative reply or a closed connection aborts the whole session.
 * <br>The caller owns and closes the connection.
 */
public class SmtpSession {
    private static final Logger log = LogManager.getLogger(SmtpSession.class);

    /**
     * EHLO domain.
     */
    static final String EHLO_DOMAIN = "localhost";

    private final Connection connection;
    private final Settings settings;
    private final MessageTransformer transformer;

    /**
     * Current state.
     */
    private SessionState state = SessionState.CONNECTED;

    /**
     * Constructs a new SmtpSession instance.
     *
     * @param connection  Connection instance.
     * @param settings    Settings instance.
     * @param transformer MessageTransformer instance.
     */
    public SmtpSession(Connection connection, Settings settings, MessageTransformer transformer) {
        this.connection = connection;
        this.settings = settings;
        this.transformer = transformer;
    }

    /**
     * Gets current state.
     *
     * @return SessionState.
     */
    public SessionState getState() {
        return state;
    }

    /**
     * Runs the session over all EML files of the settings.
     *
     * @return SessionResult instance.
     * @throws IOException Protocol error or connection failure.
     */
    public SessionResult run() throws IOException {
        SessionResult result = new SessionResult();
        String prefix = connection.getContext().prefix();

        connection.readGreeting();
        state = SessionState.GREETED;
        connection.send("EHLO " + EHLO_DOMAIN);

        boolean reset = false;
        for (String file : settings.getEmlFiles()) {
            Path path = Paths.get(file).toAbsolutePath();
            if (!Files.exists(path)) {
                log.info("{}{}: EML file does not exist", prefix, file);
                result.addSkipped(file);
                continue;
            }

            byte[] message;
            try {
                message = transformer.transform(Files.readAllBytes(path),
                        settings.isUpdateDate(), settings.isUpdateMessageId());
            } catch (MalformedMessageException e) {
                log.info("{}{}: {}", prefix, file, e.getMessage());
                result.addFailed(file, e.getMessage());
                continue;
            } catch (IOException e) {
                log.info("{}{}: Unable to read EML file: {}", prefix, file, e.getMessage());
                result.addFailed(file, e.getMessage());
                continue;
            }

            if (reset) {
                log.info("{}---", prefix);
                state = SessionState.RESET;
                connection.send("RSET");
            }

            sendMessage(file, message);
            result.addSent(file);
            reset = true;
        }

        state = SessionState.QUIT;
        connection.send("QUIT");
        state = SessionState.CLOSED;

        log.debug("{}Session done: {}", prefix, result);
        return result;
    }

    /**
     * Sends one message envelope and content.
     *
     * @param file    EML file path as configured.
     * @param message Message bytes to transmit.
     * @throws IOException Protocol error or connection failure.
     */
    private void sendMessage(String file, byte[] message) throws IOException {
        state = SessionState.MAIL_FROM;
        connection.send("MAIL FROM: <" + settings.getFromAddress() + ">");

        state = SessionState.RCPT_TO;
        for (String address : settings.getToAddresses()) {
            connection.send("RCPT TO: <" + address + ">");
        }

        state = SessionState.DATA;
        connection.send("DATA");

        state = SessionState.BODY;
        log.info("{}send: {}", connection.getContext().prefix(), file);
        connection.writeBytes(message);

        state = SessionState.TERMINATOR;
        connection.send(Connection.CRLF_DOT);
    }
}
