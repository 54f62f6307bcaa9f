package io.checkpoint.subscription;

import java.util.Objects;

/**
 * Logical grouping label used to address several subscriptions at once.
 *
 * @param value non-blank, at most {@value #MAX_LENGTH} characters
 */
public record SubscriptionGroup(String value) {

    public static final int MAX_LENGTH = 100;

    public static final SubscriptionGroup DEFAULT = new SubscriptionGroup("default");

    public SubscriptionGroup {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Subscription group must not be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Subscription group must not exceed " + MAX_LENGTH
                    + " characters: " + value);
        }
    }

    public static SubscriptionGroup of(String value) {
        return new SubscriptionGroup(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
