package io.checkpoint.advance;

import io.checkpoint.SequenceNumber;
import io.checkpoint.advance.ExclusiveAdvance.AdvanceLease;
import io.checkpoint.subscription.RunMode;
import io.checkpoint.subscription.Subscription;
import io.checkpoint.subscription.SubscriptionGroup;
import io.checkpoint.subscription.SubscriptionId;
import io.checkpoint.subscription.SubscriptionNotFoundException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExclusiveAdvanceTest {

    @Nested
    class Pessimistic {
        private final StubCheckpointStore store = new StubCheckpointStore(0);
        private final ExclusiveAdvance advance = ExclusiveAdvance.pessimistic(store);

        @Test
        void factoryReturnsCheckpointVariant() {
            assertInstanceOf(CheckpointAdvance.class, advance);
        }

        @Test
        void advanceToPersistsAndReleases() {
            AdvanceLease lease = advance.tryAcquire().orElseThrow();
            assertEquals(Optional.empty(), lease.position());

            lease.advanceTo(SequenceNumber.of(42));

            assertEquals(42, store.value);
            assertFalse(store.held);
            assertEquals(Optional.of(SequenceNumber.of(42)),
                    advance.tryAcquire().orElseThrow().position());
        }

        @Test
        void contentionYieldsEmpty() {
            store.lockedElsewhere = true;

            assertTrue(advance.tryAcquire().isEmpty());
        }

        @Test
        void closeWithoutAdvanceReleases() {
            try (AdvanceLease lease = advance.tryAcquire().orElseThrow()) {
                assertTrue(store.held);
            }
            assertFalse(store.held);
            assertEquals(1, store.releases);
            assertEquals(0, store.value);
        }

        @Test
        void closeAfterAdvanceDoesNothing() {
            try (AdvanceLease lease = advance.tryAcquire().orElseThrow()) {
                lease.advanceTo(SequenceNumber.of(5));
            }
            assertEquals(0, store.releases);
            assertEquals(1, store.updates);
        }

        @Test
        void advanceTwiceIsRejected() {
            AdvanceLease lease = advance.tryAcquire().orElseThrow();
            lease.advanceTo(SequenceNumber.of(5));

            assertThrows(IllegalStateException.class, () -> lease.advanceTo(SequenceNumber.of(6)));
            assertEquals(5, store.value);
        }
    }

    @Nested
    class Optimistic {
        private final SubscriptionId id = SubscriptionId.of("orders");
        private final StubSubscriptionStore store = new StubSubscriptionStore();
        private final ExclusiveAdvance advance = ExclusiveAdvance.optimistic(store, id);

        Optimistic() {
            store.add(Subscription.create(id, SubscriptionGroup.DEFAULT, RunMode.RUNNING));
        }

        @Test
        void factoryReturnsSubscriptionVariant() {
            assertInstanceOf(SubscriptionAdvance.class, advance);
        }

        @Test
        void advanceToPersistsAndClearsFlag() {
            AdvanceLease lease = advance.tryAcquire().orElseThrow();
            assertEquals(Optional.empty(), lease.position());
            assertTrue(store.isLocked(id));

            lease.advanceTo(SequenceNumber.of(7));

            assertFalse(store.isLocked(id));
            assertEquals(SequenceNumber.of(7), store.findOneById(id).orElseThrow().position());
            assertEquals(Optional.of(SequenceNumber.of(7)),
                    advance.tryAcquire().orElseThrow().position());
        }

        @Test
        void secondAcquireWhileHeldYieldsEmpty() {
            AdvanceLease first = advance.tryAcquire().orElseThrow();

            assertTrue(advance.tryAcquire().isEmpty());

            first.close();
            assertTrue(advance.tryAcquire().isPresent());
        }

        @Test
        void unknownSubscriptionYieldsEmpty() {
            ExclusiveAdvance unknown = ExclusiveAdvance.optimistic(store, SubscriptionId.of("missing"));

            assertTrue(unknown.tryAcquire().isEmpty());
        }

        @Test
        void failedUpdateStillClearsFlag() {
            RuntimeException failure = new RuntimeException("db down");
            store.updateFailure = failure;
            AdvanceLease lease = advance.tryAcquire().orElseThrow();

            RuntimeException thrown = assertThrows(RuntimeException.class,
                    () -> lease.advanceTo(SequenceNumber.of(3)));

            assertSame(failure, thrown);
            assertFalse(store.isLocked(id));
            assertEquals(SequenceNumber.ZERO, store.findOneById(id).orElseThrow().position());
        }

        @Test
        void closeReleasesOnce() {
            AdvanceLease lease = advance.tryAcquire().orElseThrow();
            lease.close();
            lease.close();

            assertFalse(store.isLocked(id));
            assertEquals(1, store.releases);
        }

        @Test
        void lookupFailureAfterFlagReleasesFlag() {
            StubSubscriptionStore vanishing = new StubSubscriptionStore() {
                @Override
                public boolean acquireLock(SubscriptionId subscriptionId) {
                    return true;
                }
            };
            ExclusiveAdvance ghost = ExclusiveAdvance.optimistic(vanishing, id);

            assertThrows(SubscriptionNotFoundException.class, ghost::tryAcquire);
            assertEquals(1, vanishing.releases);
        }
    }
}
