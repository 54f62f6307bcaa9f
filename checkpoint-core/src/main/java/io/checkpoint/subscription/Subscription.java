package io.checkpoint.subscription;

import io.checkpoint.SequenceNumber;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a subscription row.
 *
 * <p>Values are never mutated in place; a {@link SubscriptionStore} persists a new
 * value produced by the caller's transform in
 * {@link SubscriptionStore#update(SubscriptionId, java.util.function.UnaryOperator)}.
 *
 * @param id           identifier
 * @param group        grouping label
 * @param runMode      scheduler hint
 * @param status       lifecycle label
 * @param position     highest processed sequence number
 * @param locked       whether a worker currently holds the lock flag
 * @param error        failure detail, {@code null} unless the subscription failed
 * @param retryAttempt consecutive failed attempts since the last success
 * @param lastSavedAt  time of the last persisted write, {@code null} if never saved
 */
public record Subscription(
        SubscriptionId id,
        SubscriptionGroup group,
        RunMode runMode,
        Status status,
        SequenceNumber position,
        boolean locked,
        SubscriptionError error,
        int retryAttempt,
        Instant lastSavedAt
) {

    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(runMode, "runMode");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(position, "position");
        if (retryAttempt < 0) {
            throw new IllegalArgumentException("retryAttempt must not be negative: " + retryAttempt);
        }
    }

    /**
     * Creates a subscription that has not processed anything yet: status {@link Status#NEW},
     * position zero, unlocked, no error.
     */
    public static Subscription create(SubscriptionId id, SubscriptionGroup group, RunMode runMode) {
        return new Subscription(id, group, runMode, Status.NEW, SequenceNumber.ZERO,
                false, null, 0, null);
    }

    public boolean hasError() {
        return error != null;
    }

    public Subscription withGroup(SubscriptionGroup group) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withRunMode(RunMode runMode) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withStatus(Status status) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withPosition(SequenceNumber position) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withError(SubscriptionError error) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withoutError() {
        return withError(null);
    }

    public Subscription withRetryAttempt(int retryAttempt) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    public Subscription withLastSavedAt(Instant lastSavedAt) {
        return new Subscription(id, group, runMode, status, position, locked, error, retryAttempt, lastSavedAt);
    }

    /**
     * Moves to {@link Status#ERROR}, recording the failure together with the current
     * status and counting one more failed attempt.
     */
    public Subscription fail(Throwable throwable) {
        return new Subscription(id, group, runMode, Status.ERROR, position, locked,
                SubscriptionError.fromThrowable(throwable, status), retryAttempt + 1, lastSavedAt);
    }

    /**
     * Clears the error and the retry counter and moves to the given status.
     */
    public Subscription recover(Status status) {
        return new Subscription(id, group, runMode, status, position, locked, null, 0, lastSavedAt);
    }
}
