package io.streamqueue.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamQueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            StreamQueueProperties props = ctx.getBean(StreamQueueProperties.class);
            assertEquals(StreamQueueProperties.Backend.MEMORY, props.getBackend());
            assertTrue(props.isCompressMessages());
            assertEquals(Duration.ofMinutes(5), props.getTtl());
            assertEquals(Duration.ofMillis(500), props.getRemovalDelay());
            assertEquals(Duration.ofMillis(300), props.getGraceDelay());
            assertEquals("queue:", props.getRedis().getQueuePrefix());
            assertEquals("channel:", props.getRedis().getChannelPrefix());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("streamqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void bindsCustomValues() {
        runner.withPropertyValues(
                "streamqueue.backend=redis",
                "streamqueue.compress-messages=false",
                "streamqueue.ttl=10m",
                "streamqueue.removal-delay=0",
                "streamqueue.grace-delay=PT1S",
                "streamqueue.redis.queue-prefix=agents:queue:",
                "streamqueue.redis.channel-prefix=agents:channel:",
                "streamqueue.metrics.enabled=false",
                "streamqueue.metrics.name-prefix=agents.queues"
        ).run(ctx -> {
            StreamQueueProperties props = ctx.getBean(StreamQueueProperties.class);
            assertEquals(StreamQueueProperties.Backend.REDIS, props.getBackend());
            assertFalse(props.isCompressMessages());
            assertEquals(Duration.ofMinutes(10), props.getTtl());
            assertEquals(Duration.ZERO, props.getRemovalDelay());
            assertEquals(Duration.ofSeconds(1), props.getGraceDelay());
            assertEquals("agents:queue:", props.getRedis().getQueuePrefix());
            assertEquals("agents:channel:", props.getRedis().getChannelPrefix());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("agents.queues", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(StreamQueueProperties.class)
    static class PropsConfig {
    }
}
