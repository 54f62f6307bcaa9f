package io.checkpoint;

/**
 * Raised when a checkpoint cannot be locked, read or written.
 *
 * @see CheckpointLockedException
 * @see CheckpointNotInitializedException
 */
public class CheckpointException extends RuntimeException {
    private final String subscriberId;

    public CheckpointException(String subscriberId, String message) {
        super(message);
        this.subscriberId = subscriberId;
    }

    public CheckpointException(String subscriberId, String message, Throwable cause) {
        super(message, cause);
        this.subscriberId = subscriberId;
    }

    public String subscriberId() {
        return subscriberId;
    }
}
