package com.mimecast.sendeml.main;

import com.mimecast.sendeml.config.Settings;
import com.mimecast.sendeml.mime.MessageTransformer;
import com.mimecast.sendeml.smtp.SessionResult;
import com.mimecast.sendeml.smtp.SmtpSession;
import com.mimecast.sendeml.smtp.connection.Connection;
import com.mimecast.sendeml.smtp.session.SessionContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Session runner.
 *
 * <p>Runs the sessions needed for one settings file.
 * <ul>
 *     <li>Sequential: one connection for all EML files, messages separated by RSET.</li>
 *     <li>Parallel: one connection per EML file, all running at once.</li>
 * </ul>
 * <p>Parallel mode is only used when requested and more than one EML file is listed.
 * <p>Workers share nothing but the immutable settings.
 * <br>Every worker is joined and its outcome collected, a failed worker never stops its siblings.
 */
public class SessionRunner {
    private static final Logger log = LogManager.getLogger(SessionRunner.class);

    /**
     * Message transformer.
     */
    private final MessageTransformer transformer;

    /**
     * Constructs a new SessionRunner instance.
     */
    public SessionRunner() {
        this(new MessageTransformer());
    }

    /**
     * Constructs a new SessionRunner instance with given MessageTransformer.
     *
     * @param transformer MessageTransformer instance.
     */
    public SessionRunner(MessageTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * Runs sessions for given settings.
     *
     * @param settings Settings instance.
     * @return List of DeliveryResult, one per session in EML file order.
     */
    public List<DeliveryResult> run(Settings settings) {
        if (settings.isUseParallel() && settings.getEmlFiles().size() > 1) {
            return runParallel(settings);
        }

        return List.of(runSession(settings, SessionContext.SEQUENTIAL));
    }

    /**
     * Runs one worker per EML file and joins them all.
     *
     * @param settings Settings instance.
     * @return List of DeliveryResult.
     */
    List<DeliveryResult> runParallel(Settings settings) {
        List<String> files = settings.getEmlFiles();
        List<Callable<DeliveryResult>> tasks = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Settings single = settings.withEmlFiles(List.of(files.get(i)));
            SessionContext context = SessionContext.worker(i + 1);
            tasks.add(() -> runSession(single, context));
        }

        ExecutorService executor = Executors.newFixedThreadPool(files.size());
        List<DeliveryResult> results = new ArrayList<>();
        try {
            List<Future<DeliveryResult>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                results.add(join(futures.get(i), SessionContext.worker(i + 1), List.of(files.get(i))));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers");
            for (int i = results.size(); i < files.size(); i++) {
                results.add(DeliveryResult.failure(SessionContext.worker(i + 1), List.of(files.get(i)), null, e));
            }
        } finally {
            executor.shutdownNow();
        }

        return results;
    }

    /**
     * Runs one session over its own connection.
     *
     * @param settings Settings instance.
     * @param context  SessionContext instance.
     * @return DeliveryResult instance.
     */
    DeliveryResult runSession(Settings settings, SessionContext context) {
        Connection connection = null;
        try {
            connection = Connection.open(settings.getSmtpHost(), settings.getSmtpPort(), settings.getTimeout(), context);
            SessionResult result = new SmtpSession(connection, settings, transformer).run();
            return DeliveryResult.success(context, settings.getEmlFiles(), result, connection.getTransactionList());

        } catch (IOException | RuntimeException e) {
            log.debug("{}Session failed: {}", context.prefix(), e.getMessage());
            return DeliveryResult.failure(context, settings.getEmlFiles(),
                    connection != null ? connection.getTransactionList() : null, e);

        } finally {
            if (connection != null) {
                connection.close();
            }
        }
    }

    /**
     * Gets the result of a completed worker.
     *
     * @param future  Completed future.
     * @param context Worker context.
     * @param files   Worker files.
     * @return DeliveryResult instance.
     * @throws InterruptedException Interrupted.
     */
    private DeliveryResult join(Future<DeliveryResult> future, SessionContext context, List<String> files)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return DeliveryResult.failure(context, files, null, cause instanceof Exception ? (Exception) cause : e);
        }
    }
}
