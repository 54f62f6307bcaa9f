package io.checkpoint.subscription;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Registry of subscriptions with a flag-based, non-blocking lock.
 *
 * <p>The lock is a boolean column flipped by a single conditional update, so no
 * transaction stays open while the holder works. A holder that crashes leaves the
 * flag set until something calls {@link #releaseLock(SubscriptionId)} on its behalf;
 * the store never expires locks by itself.
 *
 * <p>{@link #update(SubscriptionId, UnaryOperator)} does not check the flag. Callers
 * that need exclusivity wrap their critical section in
 * {@link #acquireLock(SubscriptionId)} / {@link #releaseLock(SubscriptionId)}.
 *
 * @see io.checkpoint.advance.ExclusiveAdvance#optimistic(SubscriptionStore, SubscriptionId)
 */
public interface SubscriptionStore {

    /**
     * Looks up a subscription by id.
     *
     * @return the subscription, or empty if there is none with that id
     */
    Optional<Subscription> findOneById(SubscriptionId id);

    /**
     * Returns all subscriptions matching the criteria, ordered by id ascending.
     *
     * @return matching subscriptions; empty if none match
     */
    List<Subscription> findByCriteria(SubscriptionCriteria criteria);

    /**
     * Sets the lock flag if it is currently clear.
     *
     * @return {@code true} if this call set the flag; {@code false} if it was already set
     *         or the subscription does not exist
     */
    boolean acquireLock(SubscriptionId id);

    /**
     * Clears the lock flag. Idempotent.
     */
    void releaseLock(SubscriptionId id);

    /**
     * Inserts a new, unlocked subscription. The store assigns {@code lastSavedAt}.
     *
     * @throws DuplicateSubscriptionException if a subscription with the same id exists
     */
    void add(Subscription subscription);

    /**
     * Loads the subscription, applies {@code transform} and persists the result with a
     * fresh {@code lastSavedAt}. The lock flag is not part of the write.
     *
     * <p>The transform must be free of side effects; it may be evaluated against a
     * snapshot that another writer replaces concurrently.
     *
     * @param id        subscription to update
     * @param transform maps the current value to the new one; must keep the id
     * @return the persisted value
     * @throws SubscriptionNotFoundException if no subscription has that id
     * @throws IllegalArgumentException      if the transform changes the id
     */
    Subscription update(SubscriptionId id, UnaryOperator<Subscription> transform);
}
