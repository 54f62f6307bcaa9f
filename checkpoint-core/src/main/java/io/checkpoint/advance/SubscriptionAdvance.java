package io.checkpoint.advance;

import io.checkpoint.SequenceNumber;
import io.checkpoint.subscription.Subscription;
import io.checkpoint.subscription.SubscriptionId;
import io.checkpoint.subscription.SubscriptionNotFoundException;
import io.checkpoint.subscription.SubscriptionStore;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ExclusiveAdvance} backed by the lock flag of a {@link SubscriptionStore}.
 * The flag is cleared on every exit path of the lease, including a failed update.
 */
public final class SubscriptionAdvance implements ExclusiveAdvance {
    private static final Logger logger = Logger.getLogger(SubscriptionAdvance.class.getName());

    private final SubscriptionStore subscriptionStore;
    private final SubscriptionId subscriptionId;

    SubscriptionAdvance(SubscriptionStore subscriptionStore, SubscriptionId subscriptionId) {
        this.subscriptionStore = Objects.requireNonNull(subscriptionStore, "subscriptionStore");
        this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId");
    }

    @Override
    public Optional<AdvanceLease> tryAcquire() {
        if (!subscriptionStore.acquireLock(subscriptionId)) {
            logger.log(Level.FINE, "Subscription {0} is locked or does not exist", subscriptionId);
            return Optional.empty();
        }
        Subscription subscription;
        try {
            subscription = subscriptionStore.findOneById(subscriptionId)
                    .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
        } catch (RuntimeException e) {
            subscriptionStore.releaseLock(subscriptionId);
            throw e;
        }
        SequenceNumber position = subscription.position();
        return Optional.of(new Lease(position.isZero() ? Optional.empty() : Optional.of(position)));
    }

    private final class Lease implements AdvanceLease {
        private final Optional<SequenceNumber> position;
        private boolean completed;

        private Lease(Optional<SequenceNumber> position) {
            this.position = position;
        }

        @Override
        public Optional<SequenceNumber> position() {
            return position;
        }

        @Override
        public void advanceTo(SequenceNumber newPosition) {
            Objects.requireNonNull(newPosition, "newPosition");
            if (completed) {
                throw new IllegalStateException("Lease has already ended");
            }
            completed = true;
            try {
                subscriptionStore.update(subscriptionId, s -> s.withPosition(newPosition));
            } finally {
                subscriptionStore.releaseLock(subscriptionId);
            }
        }

        @Override
        public void close() {
            if (completed) {
                return;
            }
            completed = true;
            subscriptionStore.releaseLock(subscriptionId);
        }
    }
}
