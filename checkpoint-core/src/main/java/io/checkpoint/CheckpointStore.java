package io.checkpoint;

import java.util.Optional;

/**
 * Durable "highest processed sequence number" of a single subscriber, guarded by a
 * pessimistic lock held across a read-modify-write cycle.
 *
 * <p>A cycle is {@link #acquireLock()} followed by exactly one of
 * {@link #updateAndReleaseLock(SequenceNumber)} or {@link #releaseLock()}:
 * <pre>{@code
 * Optional<SequenceNumber> from = store.acquireLock();
 * SequenceNumber reached = process(from);
 * store.updateAndReleaseLock(reached);
 * }</pre>
 *
 * <p>Instances keep per-cycle session state and must not be shared between
 * threads while a cycle is open. Contention is never waited out: a lock held by
 * another transaction surfaces immediately as {@link CheckpointLockedException},
 * and retrying later is up to the caller.
 *
 * @see io.checkpoint.advance.ExclusiveAdvance#pessimistic(CheckpointStore)
 */
public interface CheckpointStore {

    /**
     * Opens a transaction and locks the subscriber's checkpoint row without waiting.
     *
     * @return the locked position, or empty if nothing has been processed yet
     * @throws CheckpointLockedException         if another transaction holds the row lock
     * @throws CheckpointNotInitializedException if the checkpoint row was never provisioned
     * @throws IllegalStateException             if this store already holds an open lock cycle
     */
    Optional<SequenceNumber> acquireLock();

    /**
     * Persists the new position (when it changed), commits and ends the lock cycle.
     *
     * <p>The cycle ends on every path, including failures; a caller that wants to try
     * again must start over with {@link #acquireLock()}.
     *
     * @param sequenceNumber the highest processed sequence number
     * @throws IllegalStateException    if no lock is held
     * @throws IllegalArgumentException if {@code sequenceNumber} is lower than the locked position
     * @throws CheckpointException      if the update or commit fails (the transaction is rolled back)
     */
    void updateAndReleaseLock(SequenceNumber sequenceNumber);

    /**
     * Rolls back the open lock cycle without writing. Does nothing when no lock is held.
     */
    void releaseLock();

    /**
     * Sets the checkpoint back to zero, outside the lock protocol. Callers must make sure
     * no consumer of this subscriber is active.
     *
     * @throws CheckpointNotInitializedException if the checkpoint row was never provisioned
     * @throws IllegalStateException             if this store currently holds the lock
     */
    void reset();
}
