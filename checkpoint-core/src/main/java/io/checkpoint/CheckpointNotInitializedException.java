package io.checkpoint;

/**
 * The subscriber's checkpoint row does not exist. Running the store's
 * {@link io.checkpoint.spi.ProvidesSetup#setup() setup} provisions it.
 */
public final class CheckpointNotInitializedException extends CheckpointException {

    public CheckpointNotInitializedException(String subscriberId) {
        super(subscriberId, "No checkpoint found for subscriber \"" + subscriberId
                + "\". Please run setup() first");
    }
}
