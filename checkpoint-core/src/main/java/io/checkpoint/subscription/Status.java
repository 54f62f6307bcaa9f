package io.checkpoint.subscription;

/**
 * Lifecycle label of a subscription. Persisted by name; the store does not
 * validate transitions between labels.
 */
public enum Status {
    NEW,
    BOOTING,
    ACTIVE,
    PAUSED,
    FINISHED,
    DETACHED,
    ERROR
}
