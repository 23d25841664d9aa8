package com.mimecast.sendeml.main;

import com.mimecast.sendeml.config.Settings;
import com.mimecast.sendeml.config.SettingsException;
import com.mimecast.sendeml.config.SettingsLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings file processor.
 *
 * <p>Loads each settings file and runs its sessions.
 * <br>Every settings file is independent: an error in one is reported and the next one is still attempted.
 */
public class SettingsProcessor {
    private static final Logger log = LogManager.getLogger(SettingsProcessor.class);

    /**
     * Session runner.
     */
    private final SessionRunner runner;

    /**
     * Constructs a new SettingsProcessor instance.
     */
    public SettingsProcessor() {
        this(new SessionRunner());
    }

    /**
     * Constructs a new SettingsProcessor instance with given SessionRunner.
     *
     * @param runner SessionRunner instance.
     */
    public SettingsProcessor(SessionRunner runner) {
        this.runner = runner;
    }

    /**
     * Processes settings files in order.
     *
     * @param jsonFiles Settings file paths.
     * @return Number of settings files with at least one error.
     */
    public int processAll(List<String> jsonFiles) {
        int errors = 0;
        for (String jsonFile : jsonFiles) {
            try {
                if (!process(jsonFile)) {
                    errors++;
                }
            } catch (RuntimeException e) {
                log.error("error: {}: {}", jsonFile, e.getMessage());
                errors++;
            }
        }

        return errors;
    }

    /**
     * Processes one settings file.
     * <p>Errors are reported and never thrown.
     *
     * @param jsonFile Settings file path.
     * @return True if every session succeeded.
     */
    public boolean process(String jsonFile) {
        Settings settings;
        try {
            settings = SettingsLoader.load(jsonFile);
        } catch (SettingsException e) {
            log.error("error: {}: {}", jsonFile, e.getMessage());
            return false;
        }

        List<DeliveryResult> failures = new ArrayList<>();
        for (DeliveryResult result : runner.run(settings)) {
            if (!result.isSuccess()) {
                failures.add(result);
            }
        }

        for (DeliveryResult failure : failures) {
            if (failure.lastTransaction() != null) {
                log.debug("{}Last exchange: {}", failure.context().prefix(), failure.lastTransaction());
            }
            if (failure.context().isParallel()) {
                log.error("error: {}: {}: {}", jsonFile, failure.label(), failure.error().getMessage());
            } else {
                log.error("error: {}: {}", jsonFile, failure.error().getMessage());
            }
        }

        return failures.isEmpty();
    }
}
