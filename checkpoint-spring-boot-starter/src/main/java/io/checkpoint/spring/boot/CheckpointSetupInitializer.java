package io.checkpoint.spring.boot;

import io.checkpoint.jdbc.store.JdbcCheckpointStore;
import io.checkpoint.jdbc.store.JdbcSubscriptionStore;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the idempotent table setup once all singletons exist, when
 * {@code checkpoint.setup-on-startup} is enabled.
 */
public class CheckpointSetupInitializer implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(CheckpointSetupInitializer.class.getName());

    private final JdbcSubscriptionStore subscriptionStore;
    private final CheckpointStoreFactory checkpointStoreFactory;
    private final List<String> subscribers;

    public CheckpointSetupInitializer(JdbcSubscriptionStore subscriptionStore,
                                      CheckpointStoreFactory checkpointStoreFactory,
                                      List<String> subscribers) {
        this.subscriptionStore = subscriptionStore;
        this.checkpointStoreFactory = checkpointStoreFactory;
        this.subscribers = List.copyOf(subscribers);
    }

    @Override
    public void afterSingletonsInstantiated() {
        logger.log(Level.INFO, "Setting up subscription table {0}", subscriptionStore.tableName());
        subscriptionStore.setup();
        for (String subscriber : subscribers) {
            logger.log(Level.INFO, "Setting up checkpoint of subscriber {0} in table {1}",
                    new Object[]{subscriber, checkpointStoreFactory.tableName()});
            JdbcCheckpointStore store = checkpointStoreFactory.create(subscriber);
            store.setup();
        }
    }
}
