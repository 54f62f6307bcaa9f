/**
 * One acquire/advance/release capability over both locking strategies.
 *
 * @see io.checkpoint.advance.ExclusiveAdvance
 */
package io.checkpoint.advance;
