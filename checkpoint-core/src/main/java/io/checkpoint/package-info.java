/**
 * Subscriber progress tracking for an append-only, globally ordered event log.
 *
 * <h2>Core Design</h2>
 * <p>Each subscriber records how far it has durably processed the log. Two stores
 * solve the same problem with different concurrency strategies:
 * <ul>
 *   <li>{@link io.checkpoint.CheckpointStore} keeps a single sequence number per
 *       subscriber and guards it with a database row lock held inside a transaction
 *       for the whole read-modify-write cycle (pessimistic).</li>
 *   <li>{@link io.checkpoint.subscription.SubscriptionStore} keeps a richer record per
 *       subscription (run mode, status, error, retry counter) and guards it with a
 *       {@code locked} flag toggled by a conditional update (optimistic). No
 *       transaction stays open while the holder works.</li>
 * </ul>
 * <p>{@link io.checkpoint.advance.ExclusiveAdvance} puts both behind one
 * acquire/advance/release capability so a scheduler can pick either per deployment.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>checkpoint-core</b>: value types, store interfaces, exceptions (zero external deps)</li>
 *   <li><b>checkpoint-jdbc</b>: JDBC stores and dialects (H2, MySQL, PostgreSQL)</li>
 *   <li><b>checkpoint-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var store = JdbcCheckpointStore.builder()
 *     .connectionProvider(connProvider)
 *     .dialect(Dialects.detect(dataSource))
 *     .subscriberId("orders-projector")
 *     .build();
 * store.setup();
 *
 * Optional<SequenceNumber> from = store.acquireLock();
 * store.updateAndReleaseLock(SequenceNumber.of(42));
 * }</pre>
 *
 * @see io.checkpoint.CheckpointStore
 * @see io.checkpoint.subscription.SubscriptionStore
 * @see io.checkpoint.advance.ExclusiveAdvance
 */
package io.checkpoint;
