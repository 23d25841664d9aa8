package com.mimecast.sendeml.smtp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one SMTP session.
 *
 * <p>Sorts every EML file of the session into sent, skipped (missing) or failed (unreadable or malformed).
 */
public class SessionResult {
    private final List<String> sent = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final Map<String, String> failed = new LinkedHashMap<>();

    void addSent(String file) {
        sent.add(file);
    }

    void addSkipped(String file) {
        skipped.add(file);
    }

    void addFailed(String file, String reason) {
        failed.put(file, reason);
    }

    /**
     * Gets files sent and accepted.
     *
     * @return List of String.
     */
    public List<String> getSent() {
        return Collections.unmodifiableList(sent);
    }

    /**
     * Gets files skipped because they do not exist.
     *
     * @return List of String.
     */
    public List<String> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    /**
     * Gets files not sent because they could not be read or transformed.
     *
     * @return Map of file to reason.
     */
    public Map<String, String> getFailed() {
        return Collections.unmodifiableMap(failed);
    }

    @Override
    public String toString() {
        return "sent: " + sent.size() + ", skipped: " + skipped.size() + ", failed: " + failed.size();
    }
}
