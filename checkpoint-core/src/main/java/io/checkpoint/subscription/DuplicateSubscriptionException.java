package io.checkpoint.subscription;

/**
 * A subscription with the same id already exists.
 */
public final class DuplicateSubscriptionException extends RuntimeException {
    private final SubscriptionId subscriptionId;

    public DuplicateSubscriptionException(SubscriptionId subscriptionId, Throwable cause) {
        super("Subscription with id \"" + subscriptionId + "\" already exists", cause);
        this.subscriptionId = subscriptionId;
    }

    public SubscriptionId subscriptionId() {
        return subscriptionId;
    }
}
