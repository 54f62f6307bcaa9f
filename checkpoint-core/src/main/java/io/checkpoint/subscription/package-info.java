/**
 * Subscription registry: per-subscriber position plus run mode, status, error and
 * retry state, guarded by an optimistic lock flag.
 *
 * @see io.checkpoint.subscription.SubscriptionStore
 * @see io.checkpoint.subscription.Subscription
 */
package io.checkpoint.subscription;
