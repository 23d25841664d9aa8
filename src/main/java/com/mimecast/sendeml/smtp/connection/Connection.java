package com.mimecast.sendeml.smtp.connection;

import com.mimecast.sendeml.smtp.NegativeReplyException;
import com.mimecast.sendeml.smtp.ReplyParser;
import com.mimecast.sendeml.smtp.SmtpReply;
import com.mimecast.sendeml.smtp.io.LineInputStream;
import com.mimecast.sendeml.smtp.session.SessionContext;
import com.mimecast.sendeml.smtp.transaction.TransactionList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * SMTP client connection.
 *
 * <p>Owns one socket with a line reader and a buffered writer.
 * <br>Commands are strictly sequential, a command is never written before the previous reply was read.
 * <p>Every exchange is recorded in the connection transaction list.
 */
public class Connection implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(Connection.class);

    /**
     * Line terminator.
     */
    public static final String CRLF = "\r\n";

    /**
     * DATA terminator command, written as CRLF . CRLF once the line EOL is appended.
     */
    public static final String CRLF_DOT = CRLF + ".";

    /**
     * Socket if any.
     */
    private final Socket socket;

    /**
     * Input stream.
     */
    private final LineInputStream inc;

    /**
     * Output stream.
     */
    private final OutputStream out;

    /**
     * Reply reader.
     */
    private final ReplyParser parser;

    /**
     * Session context.
     */
    private final SessionContext context;

    /**
     * Transaction list.
     */
    private final TransactionList transactionList = new TransactionList();

    /**
     * Constructs a new Connection instance with given socket.
     *
     * @param socket  Connected socket.
     * @param context SessionContext instance.
     * @throws IOException Unable to get socket streams.
     */
    public Connection(Socket socket, SessionContext context) throws IOException {
        this(socket, socket.getInputStream(), socket.getOutputStream(), context);
    }

    /**
     * Constructs a new Connection instance with given streams.
     * <p>For testing purposes only.
     *
     * @param input   Input stream.
     * @param output  Output stream.
     * @param context SessionContext instance.
     */
    public Connection(InputStream input, OutputStream output, SessionContext context) {
        this(null, input, output, context);
    }

    private Connection(Socket socket, InputStream input, OutputStream output, SessionContext context) {
        this.socket = socket;
        this.inc = new LineInputStream(new BufferedInputStream(input));
        this.out = new BufferedOutputStream(output);
        this.context = context;
        this.parser = new ReplyParser(inc, context);
    }

    /**
     * Opens a connection.
     *
     * @param host    SMTP host.
     * @param port    SMTP port.
     * @param timeout Read timeout in milliseconds, 0 for none.
     * @param context SessionContext instance.
     * @return Connection instance.
     * @throws IOException Unable to connect.
     */
    public static Connection open(String host, int port, int timeout, SessionContext context) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeout);
            socket.setSoTimeout(timeout);
            log.debug("{}Connected to {}:{}", context.prefix(), host, port);
            return new Connection(socket, context);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /**
     * Gets session context.
     *
     * @return SessionContext instance.
     */
    public SessionContext getContext() {
        return context;
    }

    /**
     * Gets transaction list.
     *
     * @return TransactionList instance.
     */
    public TransactionList getTransactionList() {
        return transactionList;
    }

    /**
     * Reads the server greeting.
     *
     * @return Last greeting line.
     * @throws IOException Unable to read or negative greeting.
     */
    public SmtpReply readGreeting() throws IOException {
        return exchange("SMTP", "", false);
    }

    /**
     * Writes command and waits for its reply.
     *
     * @param command Command line without EOL.
     * @return Last reply line.
     * @throws IOException Unable to communicate or negative reply.
     */
    public SmtpReply send(String command) throws IOException {
        return exchange(verb(command), command, true);
    }

    /**
     * Writes command line followed by CRLF.
     *
     * @param command Command line without EOL.
     * @throws IOException Unable to write.
     */
    public void write(String command) throws IOException {
        log.info("{}send: {}", context.prefix(), printable(command));

        out.write((command + CRLF).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /**
     * Writes raw bytes.
     * <p>Nothing is logged and no EOL is added.
     *
     * @param bytes Byte array.
     * @throws IOException Unable to write.
     */
    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /**
     * Reads one reply.
     *
     * @return Last reply line.
     * @throws IOException Unable to read or negative reply.
     */
    public SmtpReply read() throws IOException {
        return parser.read();
    }

    /**
     * Closes the socket.
     */
    @Override
    public void close() {
        try {
            if (socket != null) {
                socket.close();
            } else {
                out.close();
                inc.close();
            }
            log.debug("{}Connection closed", context.prefix());
        } catch (IOException e) {
            log.debug("{}Error closing connection: {}", context.prefix(), e.getMessage());
        }
    }

    /**
     * Replaces the DATA terminator with a readable placeholder.
     *
     * @param command Command line.
     * @return Printable string.
     */
    public static String printable(String command) {
        return CRLF_DOT.equals(command) ? "<CRLF>." : command;
    }

    /**
     * Write, read and record.
     *
     * @param verb    Transaction verb.
     * @param command Command line.
     * @param write   Write command before reading.
     * @return Last reply line.
     * @throws IOException Unable to communicate or negative reply.
     */
    private SmtpReply exchange(String verb, String command, boolean write) throws IOException {
        if (write) {
            write(command);
        }

        try {
            SmtpReply reply = read();
            transactionList.addTransaction(verb, printable(command), reply.line(), false);
            return reply;
        } catch (NegativeReplyException e) {
            transactionList.addTransaction(verb, printable(command), e.getReply().line(), true);
            throw e;
        }
    }

    /**
     * Gets command verb.
     *
     * @param command Command line.
     * @return Verb string.
     */
    private static String verb(String command) {
        if (CRLF_DOT.equals(command)) {
            return ".";
        }

        int space = command.indexOf(' ');
        return space == -1 ? command : command.substring(0, space);
    }
}
