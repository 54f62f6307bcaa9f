package io.checkpoint;

/**
 * The checkpoint row is locked by another transaction. An expected outcome under
 * contention; the caller decides whether and when to try again.
 */
public final class CheckpointLockedException extends CheckpointException {

    public CheckpointLockedException(String subscriberId, Throwable cause) {
        super(subscriberId, "Failed to acquire checkpoint lock for subscriber \"" + subscriberId
                + "\" because it is acquired already", cause);
    }
}
