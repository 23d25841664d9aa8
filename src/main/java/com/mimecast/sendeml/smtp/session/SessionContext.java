package com.mimecast.sendeml.smtp.session;

/**
 * Per worker session context.
 *
 * <p>Identifies the worker a session runs in so its trace lines can be told apart
 * when several sessions log at the same time.
 * <br>Sequential sessions use {@link #SEQUENTIAL} and log without a prefix.
 */
public final class SessionContext {

    /**
     * Context of a sequential session.
     */
    public static final SessionContext SEQUENTIAL = new SessionContext(0);

    /**
     * Worker id, 0 when not running as a parallel worker.
     */
    private final int workerId;

    /**
     * Constructs a new SessionContext instance.
     *
     * @param workerId Worker id.
     */
    private SessionContext(int workerId) {
        this.workerId = workerId;
    }

    /**
     * Creates a parallel worker context.
     *
     * @param workerId Worker id, greater than 0.
     * @return SessionContext instance.
     */
    public static SessionContext worker(int workerId) {
        if (workerId < 1) {
            throw new IllegalArgumentException("Worker id must be positive: " + workerId);
        }
        return new SessionContext(workerId);
    }

    /**
     * Gets worker id.
     *
     * @return Worker id.
     */
    public int getWorkerId() {
        return workerId;
    }

    /**
     * Is parallel worker.
     *
     * @return Boolean.
     */
    public boolean isParallel() {
        return workerId > 0;
    }

    /**
     * Gets log line prefix.
     *
     * @return Prefix string, empty for sequential sessions.
     */
    public String prefix() {
        return isParallel() ? "id: " + workerId + ", " : "";
    }

    @Override
    public String toString() {
        return isParallel() ? "worker-" + workerId : "sequential";
    }
}
