package io.checkpoint.spring.boot;

import io.checkpoint.jdbc.DataSourceConnectionProvider;
import io.checkpoint.jdbc.dialect.Dialect;
import io.checkpoint.jdbc.dialect.Dialects;
import io.checkpoint.jdbc.store.JdbcSubscriptionStore;
import io.checkpoint.spi.ConnectionProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the checkpoint stores.
 *
 * <p>Wires a {@link JdbcSubscriptionStore} and a {@link CheckpointStoreFactory} from a
 * {@link DataSource} and {@link CheckpointProperties}. The dialect is detected from the
 * DataSource unless {@code checkpoint.dialect} names one.
 *
 * @see CheckpointProperties
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcSubscriptionStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CheckpointProperties.class)
public class CheckpointAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect checkpointDialect(DataSource dataSource, CheckpointProperties props) {
        String name = props.getDialect();
        if (name != null && !name.isBlank()) {
            return Dialects.get(name);
        }
        return Dialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcSubscriptionStore subscriptionStore(ConnectionProvider connectionProvider,
                                                   Dialect dialect,
                                                   CheckpointProperties props,
                                                   ObjectProvider<Clock> clockProvider) {
        return JdbcSubscriptionStore.builder()
                .connectionProvider(connectionProvider)
                .dialect(dialect)
                .tableName(props.getSubscriptionTable())
                .clock(clockProvider.getIfAvailable(Clock::systemUTC))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStoreFactory checkpointStoreFactory(ConnectionProvider connectionProvider,
                                                         Dialect dialect,
                                                         CheckpointProperties props) {
        return new CheckpointStoreFactory(connectionProvider, dialect, props.getCheckpointTable());
    }

    @Bean
    @ConditionalOnProperty(prefix = "checkpoint", name = "setup-on-startup", havingValue = "true")
    public CheckpointSetupInitializer checkpointSetupInitializer(JdbcSubscriptionStore subscriptionStore,
                                                                 CheckpointStoreFactory checkpointStoreFactory,
                                                                 CheckpointProperties props) {
        return new CheckpointSetupInitializer(subscriptionStore, checkpointStoreFactory, props.getSubscribers());
    }
}
