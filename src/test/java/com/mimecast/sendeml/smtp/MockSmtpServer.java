package com.mimecast.sendeml.smtp;

import com.mimecast.sendeml.smtp.io.LineInputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A mock SMTP server for session tests.
 * <p>
 * Listens on an ephemeral loopback port and records every command and message per connection.
 * <br>Commands get "250 OK" unless a rule matches their prefix:
 * - a reply string answers with that reply instead;
 * - {@link #CLOSE} drops the connection without answering.
 */
public class MockSmtpServer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(MockSmtpServer.class);

    /**
     * Rule value that drops the connection.
     */
    public static final String CLOSE = "<close>";

    private final Map<String, String> rules = new ConcurrentHashMap<>();
    private final List<Session> sessions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private String greeting = "220 mock.example.jp ESMTP";
    private ServerSocket serverSocket;
    private ExecutorService executor;

    /**
     * Sets greeting reply.
     *
     * @param greeting Reply line or {@link #CLOSE}.
     * @return Self.
     */
    public MockSmtpServer setGreeting(String greeting) {
        this.greeting = greeting;
        return this;
    }

    /**
     * Adds reply rule.
     *
     * @param prefix Command prefix.
     * @param reply  Reply line or {@link #CLOSE}.
     * @return Self.
     */
    public MockSmtpServer addRule(String prefix, String reply) {
        rules.put(prefix, reply);
        return this;
    }

    /**
     * Start the mock server.
     *
     * @return Self.
     * @throws IOException Unable to bind.
     */
    public MockSmtpServer start() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        running.set(true);
        executor = Executors.newCachedThreadPool();

        executor.submit(() -> {
            while (running.get() && !serverSocket.isClosed()) {
                try {
                    Socket clientSocket = serverSocket.accept();
                    Session session = new Session();
                    sessions.add(session);
                    executor.submit(() -> handleClient(clientSocket, session));
                } catch (IOException e) {
                    if (running.get()) {
                        log.error("Error accepting client connection: {}", e.getMessage());
                    }
                }
            }
        });

        log.info("SMTP mock server started on port {}", getPort());
        return this;
    }

    /**
     * Gets listening port.
     *
     * @return Port number.
     */
    public int getPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * Gets sessions in accept order.
     *
     * @return List of Session.
     */
    public List<Session> getSessions() {
        return sessions;
    }

    /**
     * Stop the mock server.
     */
    @Override
    public void close() {
        running.set(false);
        try {
            if (serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Error closing server socket: {}", e.getMessage());
        }

        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Executor did not terminate in the specified time.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Handle a client connection.
     *
     * @param socket  The client socket.
     * @param session Session record.
     */
    private void handleClient(Socket socket, Session session) {
        try (socket) {
            LineInputStream is = new LineInputStream(socket.getInputStream());
            OutputStream os = socket.getOutputStream();

            if (!reply(os, greeting)) {
                return;
            }

            byte[] bytes;
            while ((bytes = is.readLine()) != null) {
                String command = new String(bytes, StandardCharsets.UTF_8).trim();
                session.commands.add(command);

                String reply = match(command);
                if (reply == null) {
                    if (command.startsWith("EHLO")) {
                        reply = "250-mock.example.jp\r\n250-PIPELINING\r\n250 8BITMIME";
                    } else if (command.equals("DATA")) {
                        reply = "354 Start mail input; end with <CRLF>.<CRLF>";
                    } else if (command.equals("QUIT")) {
                        reply(os, "221 Bye");
                        return;
                    } else {
                        reply = "250 OK";
                    }
                }

                if (!reply(os, reply)) {
                    return;
                }

                if (command.equals("DATA") && reply.startsWith("354")) {
                    session.messages.add(readMessage(is));
                    session.commands.add(".");
                    String end = match(".");
                    if (!reply(os, end != null ? end : "250 Queued")) {
                        return;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Client connection ended: {}", e.getMessage());
        }
    }

    private String match(String command) {
        for (Map.Entry<String, String> rule : rules.entrySet()) {
            if (command.startsWith(rule.getKey())) {
                return rule.getValue();
            }
        }
        return null;
    }

    private boolean reply(OutputStream os, String reply) throws IOException {
        if (CLOSE.equals(reply)) {
            return false;
        }

        os.write((reply + "\r\n").getBytes(StandardCharsets.UTF_8));
        os.flush();
        return true;
    }

    /**
     * Reads DATA content up to the dot line.
     * <p>The CRLF before the dot belongs to the terminator and is dropped.
     */
    private byte[] readMessage(LineInputStream is) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        byte[] line;
        while ((line = is.readLine()) != null) {
            if (Arrays.equals(line, ".\r\n".getBytes(StandardCharsets.US_ASCII))) {
                break;
            }
            baos.write(line);
        }

        byte[] data = baos.toByteArray();
        return data.length >= 2 ? Arrays.copyOf(data, data.length - 2) : data;
    }

    /**
     * Commands and messages received on one connection.
     */
    public static class Session {
        private final List<String> commands = Collections.synchronizedList(new ArrayList<>());
        private final List<byte[]> messages = Collections.synchronizedList(new ArrayList<>());

        public List<String> getCommands() {
            return new ArrayList<>(commands);
        }

        public List<byte[]> getMessages() {
            return new ArrayList<>(messages);
        }

        /**
         * Counts commands starting with given prefix.
         *
         * @param prefix Command prefix.
         * @return Count.
         */
        public long count(String prefix) {
            return getCommands().stream().filter(c -> c.startsWith(prefix)).count();
        }
    }
}
