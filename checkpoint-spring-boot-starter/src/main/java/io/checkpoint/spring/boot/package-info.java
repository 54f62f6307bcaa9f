/**
 * Spring Boot auto-configuration for the checkpoint stores.
 *
 * <p>{@link io.checkpoint.spring.boot.CheckpointAutoConfiguration} wires the stores from
 * {@code checkpoint.*} application properties:
 * <pre>
 * checkpoint.checkpoint-table=checkpoints
 * checkpoint.subscription-table=subscriptions
 * checkpoint.setup-on-startup=true
 * checkpoint.subscribers=orders-projector,billing-projector
 * </pre>
 *
 * @see io.checkpoint.spring.boot.CheckpointAutoConfiguration
 * @see io.checkpoint.spring.boot.CheckpointProperties
 */
package io.checkpoint.spring.boot;
