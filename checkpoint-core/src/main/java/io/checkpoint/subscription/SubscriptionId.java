package io.checkpoint.subscription;

import java.util.Objects;

/**
 * Stable identifier of a subscription, chosen by the consumer.
 *
 * @param value non-blank, at most {@value #MAX_LENGTH} characters
 */
public record SubscriptionId(String value) {

    public static final int MAX_LENGTH = 150;

    public SubscriptionId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Subscription id must not be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Subscription id must not exceed " + MAX_LENGTH
                    + " characters: " + value);
        }
    }

    public static SubscriptionId of(String value) {
        return new SubscriptionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
