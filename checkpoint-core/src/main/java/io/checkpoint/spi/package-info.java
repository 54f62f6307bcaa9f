/**
 * Service provider interfaces implemented by storage backends.
 *
 * <ul>
 *   <li>{@link io.checkpoint.spi.ConnectionProvider}: connection source for the stores</li>
 *   <li>{@link io.checkpoint.spi.ProvidesSetup}: idempotent provisioning of tables and rows</li>
 * </ul>
 */
package io.checkpoint.spi;
