package io.checkpoint.subscription;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SubscriptionIdTest {

    @Test
    void acceptsUpToMaxLength() {
        assertDoesNotThrow(() -> SubscriptionId.of("x".repeat(SubscriptionId.MAX_LENGTH)));
        assertThrows(IllegalArgumentException.class,
                () -> SubscriptionId.of("x".repeat(SubscriptionId.MAX_LENGTH + 1)));
    }

    @Test
    void rejectsBlankAndNull() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionId.of(" "));
        assertThrows(NullPointerException.class, () -> SubscriptionId.of(null));
    }

    @Test
    void groupLimits() {
        assertDoesNotThrow(() -> SubscriptionGroup.of("g".repeat(SubscriptionGroup.MAX_LENGTH)));
        assertThrows(IllegalArgumentException.class,
                () -> SubscriptionGroup.of("g".repeat(SubscriptionGroup.MAX_LENGTH + 1)));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionGroup.of(""));
        assertEquals("default", SubscriptionGroup.DEFAULT.value());
    }

    @Test
    void toStringIsTheValue() {
        assertEquals("orders", SubscriptionId.of("orders").toString());
        assertEquals("projections", SubscriptionGroup.of("projections").toString());
    }
}
