package io.checkpoint.advance;

import io.checkpoint.CheckpointLockedException;
import io.checkpoint.CheckpointStore;
import io.checkpoint.SequenceNumber;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ExclusiveAdvance} backed by the row lock of a {@link CheckpointStore}.
 * Contention ({@link CheckpointLockedException}) becomes an empty result; every
 * other failure propagates.
 */
public final class CheckpointAdvance implements ExclusiveAdvance {
    private static final Logger logger = Logger.getLogger(CheckpointAdvance.class.getName());

    private final CheckpointStore checkpointStore;

    CheckpointAdvance(CheckpointStore checkpointStore) {
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
    }

    @Override
    public Optional<AdvanceLease> tryAcquire() {
        Optional<SequenceNumber> position;
        try {
            position = checkpointStore.acquireLock();
        } catch (CheckpointLockedException e) {
            logger.log(Level.FINE, "Checkpoint of subscriber {0} is locked by another holder",
                    e.subscriberId());
            return Optional.empty();
        }
        return Optional.of(new Lease(position));
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
            checkpointStore.updateAndReleaseLock(newPosition);
        }

        @Override
        public void close() {
            if (completed) {
                return;
            }
            completed = true;
            checkpointStore.releaseLock();
        }
    }
}
