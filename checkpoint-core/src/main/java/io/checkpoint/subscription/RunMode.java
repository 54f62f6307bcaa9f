package io.checkpoint.subscription;

/**
 * Scheduler hint describing how a subscription should be driven. Persisted by
 * name; the store never acts on it.
 */
public enum RunMode {
    /**
     * Processed continuously.
     */
    RUNNING,
    /**
     * Not processed until switched back.
     */
    STOPPED,
    /**
     * Processed up to the current end of the log, then finished.
     */
    ONCE
}
