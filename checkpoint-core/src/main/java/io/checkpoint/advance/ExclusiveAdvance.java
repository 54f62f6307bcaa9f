package io.checkpoint.advance;

import io.checkpoint.CheckpointStore;
import io.checkpoint.SequenceNumber;
import io.checkpoint.subscription.SubscriptionId;
import io.checkpoint.subscription.SubscriptionStore;

import java.util.Optional;

/**
 * Exclusive right to advance one subscriber's position, independent of how the
 * exclusivity is enforced.
 *
 * <ul>
 *   <li>{@link #pessimistic(CheckpointStore)}: a database row lock inside an open
 *       transaction. Suited to short, synchronous critical sections.</li>
 *   <li>{@link #optimistic(SubscriptionStore, SubscriptionId)}: a lock flag set by a
 *       conditional update. No transaction stays open, so the holder may suspend for
 *       as long as it needs; a crashed holder leaves the flag set.</li>
 * </ul>
 *
 * <pre>{@code
 * Optional<AdvanceLease> acquired = advance.tryAcquire();
 * if (acquired.isEmpty()) {
 *     return; // someone else is advancing
 * }
 * try (AdvanceLease lease = acquired.get()) {
 *     SequenceNumber reached = process(lease.position());
 *     lease.advanceTo(reached);
 * }
 * }</pre>
 */
public sealed interface ExclusiveAdvance permits CheckpointAdvance, SubscriptionAdvance {

    /**
     * Attempts to take exclusivity without waiting.
     *
     * @return the lease, or empty if another holder is currently advancing
     */
    Optional<AdvanceLease> tryAcquire();

    static ExclusiveAdvance pessimistic(CheckpointStore checkpointStore) {
        return new CheckpointAdvance(checkpointStore);
    }

    static ExclusiveAdvance optimistic(SubscriptionStore subscriptionStore, SubscriptionId subscriptionId) {
        return new SubscriptionAdvance(subscriptionStore, subscriptionId);
    }

    /**
     * Exclusivity held by the caller. Exactly one of {@link #advanceTo(SequenceNumber)}
     * or {@link #close()} ends it; closing after a successful advance does nothing.
     */
    interface AdvanceLease extends AutoCloseable {

        /**
         * Position at the time the lease was taken; empty if nothing has been processed yet.
         */
        Optional<SequenceNumber> position();

        /**
         * Persists the new position and gives up exclusivity.
         *
         * @throws IllegalStateException if the lease has already ended
         */
        void advanceTo(SequenceNumber position);

        /**
         * Gives up exclusivity without changing the position.
         */
        @Override
        void close();
    }
}
