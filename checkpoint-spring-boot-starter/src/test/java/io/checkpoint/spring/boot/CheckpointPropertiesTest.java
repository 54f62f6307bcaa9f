package io.checkpoint.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(CheckpointProperties.class);
            assertEquals("checkpoints", props.getCheckpointTable());
            assertEquals("subscriptions", props.getSubscriptionTable());
            assertNull(props.getDialect());
            assertFalse(props.isSetupOnStartup());
            assertTrue(props.getSubscribers().isEmpty());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "checkpoint.checkpoint-table=cp",
                "checkpoint.subscription-table=subs",
                "checkpoint.dialect=mysql",
                "checkpoint.setup-on-startup=true",
                "checkpoint.subscribers[0]=orders",
                "checkpoint.subscribers[1]=billing"
        ).run(ctx -> {
            var props = ctx.getBean(CheckpointProperties.class);
            assertEquals("cp", props.getCheckpointTable());
            assertEquals("subs", props.getSubscriptionTable());
            assertEquals("mysql", props.getDialect());
            assertTrue(props.isSetupOnStartup());
            assertEquals(List.of("orders", "billing"), props.getSubscribers());
        });
    }

    @Configuration
    @EnableConfigurationProperties(CheckpointProperties.class)
    static class PropsConfig {
    }
}
