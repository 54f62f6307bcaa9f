package io.checkpoint.spring.boot;

import io.checkpoint.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the checkpoint stores.
 *
 * @see CheckpointAutoConfiguration
 */
@ConfigurationProperties(prefix = "checkpoint")
public class CheckpointProperties {

    /**
     * Table holding one checkpoint row per subscriber.
     */
    private String checkpointTable = TableNames.DEFAULT_CHECKPOINT_TABLE;

    /**
     * Table holding the subscription registry.
     */
    private String subscriptionTable = TableNames.DEFAULT_SUBSCRIPTION_TABLE;

    /**
     * Dialect name (h2, mysql, postgresql). Detected from the DataSource when unset.
     */
    private String dialect;

    /**
     * Create missing tables, columns and indexes on startup, and provision the
     * checkpoint rows of {@link #subscribers}.
     */
    private boolean setupOnStartup = false;

    /**
     * Subscribers whose checkpoint rows are provisioned on startup.
     */
    private List<String> subscribers = new ArrayList<>();

    public String getCheckpointTable() {
        return checkpointTable;
    }

    public void setCheckpointTable(String checkpointTable) {
        this.checkpointTable = checkpointTable;
    }

    public String getSubscriptionTable() {
        return subscriptionTable;
    }

    public void setSubscriptionTable(String subscriptionTable) {
        this.subscriptionTable = subscriptionTable;
    }

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public boolean isSetupOnStartup() {
        return setupOnStartup;
    }

    public void setSetupOnStartup(boolean setupOnStartup) {
        this.setupOnStartup = setupOnStartup;
    }

    public List<String> getSubscribers() {
        return subscribers;
    }

    public void setSubscribers(List<String> subscribers) {
        this.subscribers = subscribers;
    }
}
