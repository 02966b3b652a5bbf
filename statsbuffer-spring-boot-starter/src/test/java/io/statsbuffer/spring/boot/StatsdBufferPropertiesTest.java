package io.statsbuffer.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatsdBufferPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(StatsdBufferProperties.class);
            assertTrue(props.isEnabled());
            assertEquals(Duration.ofSeconds(1), props.getFlushInterval());
            assertEquals(100, props.getQueueCapacity());
            assertNull(props.getCloseTimeout());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("statsd.buffer", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "statsd.buffer.enabled=false",
                "statsd.buffer.flush-interval=250ms",
                "statsd.buffer.queue-capacity=5000",
                "statsd.buffer.close-timeout=PT10S",
                "statsd.buffer.metrics.enabled=false",
                "statsd.buffer.metrics.name-prefix=checkout.statsd"
        ).run(ctx -> {
            var props = ctx.getBean(StatsdBufferProperties.class);
            assertFalse(props.isEnabled());
            assertEquals(Duration.ofMillis(250), props.getFlushInterval());
            assertEquals(5000, props.getQueueCapacity());
            assertEquals(Duration.ofSeconds(10), props.getCloseTimeout());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("checkout.statsd", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(StatsdBufferProperties.class)
    static class PropsConfig {
    }
}
