package io.checkpoint.advance;

import io.checkpoint.CheckpointLockedException;
import io.checkpoint.CheckpointStore;
import io.checkpoint.SequenceNumber;

import java.util.Optional;

/**
 * In-memory {@link CheckpointStore} that records the calls it receives.
 */
class StubCheckpointStore implements CheckpointStore {
    long value;
    boolean lockedElsewhere;
    boolean held;
    int releases;
    int updates;

    StubCheckpointStore(long value) {
        this.value = value;
    }

    @Override
    public Optional<SequenceNumber> acquireLock() {
        if (lockedElsewhere) {
            throw new CheckpointLockedException("stub", null);
        }
        if (held) {
            throw new IllegalStateException("already held");
        }
        held = true;
        return value == 0 ? Optional.empty() : Optional.of(SequenceNumber.of(value));
    }

    @Override
    public void updateAndReleaseLock(SequenceNumber sequenceNumber) {
        if (!held) {
            throw new IllegalStateException("not held");
        }
        held = false;
        updates++;
        value = sequenceNumber.value();
    }

    @Override
    public void releaseLock() {
        if (held) {
            held = false;
            releases++;
        }
    }

    @Override
    public void reset() {
        value = 0;
    }
}
