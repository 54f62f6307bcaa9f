package io.checkpoint.subscription;

/**
 * No subscription exists with the requested id.
 */
public final class SubscriptionNotFoundException extends RuntimeException {
    private final SubscriptionId subscriptionId;

    public SubscriptionNotFoundException(SubscriptionId subscriptionId) {
        super("Subscription with id \"" + subscriptionId + "\" does not exist");
        this.subscriptionId = subscriptionId;
    }

    public SubscriptionId subscriptionId() {
        return subscriptionId;
    }
}
