package io.checkpoint.spi;

/**
 * A store that can provision its own storage (tables, indexes, initial rows).
 *
 * <p>Implementations must be idempotent: running setup against storage that is
 * already provisioned changes nothing.
 */
public interface ProvidesSetup {

    void setup();
}
