package io.streamqueue.spring.boot;

import io.streamqueue.EventMessage;
import io.streamqueue.QueueNotFoundException;
import io.streamqueue.StreamQueue;
import io.streamqueue.StreamQueueFactory;
import io.streamqueue.StreamQueueManager;
import io.streamqueue.memory.MemoryStreamQueueFactory;
import io.streamqueue.redis.RedisSharedStore;
import io.streamqueue.shared.SharedStreamQueueFactory;
import io.streamqueue.spi.MetricsExporter;
import io.streamqueue.util.MessageCodec;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamQueueAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StreamQueueAutoConfiguration.class));

    // ── Memory backend ─────────────────────────────────────────────

    @Test
    void createsMemoryBackendByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("streamQueueMessageCodec"));
            assertTrue(ctx.containsBean("memoryStreamQueueFactory"));
            assertTrue(ctx.containsBean("streamQueueManager"));
            assertFalse(ctx.containsBean("redisSharedStore"));
            assertInstanceOf(MemoryStreamQueueFactory.class, ctx.getBean(StreamQueueFactory.class));
            assertSame(MessageCodec.getDefault(), ctx.getBean(MessageCodec.class));
        });
    }

    @Test
    void managerAppliesConfiguredDefaults() {
        runner.withPropertyValues(
                "streamqueue.compress-messages=false",
                "streamqueue.ttl=PT2M",
                "streamqueue.removal-delay=0"
        ).run(ctx -> {
            StreamQueueManager<?> manager = ctx.getBean(StreamQueueManager.class);
            StreamQueue queue = manager.createQueue("run-1");
            assertFalse(queue.compressMessages());
            assertEquals(Duration.ofMinutes(2), queue.ttl());

            manager.pushToQueue("run-1", EventMessage.of("token", "hi"));
            assertEquals(List.of(EventMessage.of("token", "hi")), manager.getQueueData("run-1"));

            manager.removeQueue("run-1");
            assertTrue(manager.getAllQueueIds().isEmpty());
            assertThrows(QueueNotFoundException.class, () -> manager.getQueue("run-1"));
        });
    }

    @Test
    void closesManagerWithContext() {
        AtomicReference<StreamQueueManager<?>> ref = new AtomicReference<>();
        runner.run(ctx -> ref.set(ctx.getBean(StreamQueueManager.class)));
        assertThrows(IllegalStateException.class, () -> ref.get().createQueue("run-1"));
    }

    @Test
    void wiresMetricsExporterBean() {
        runner.withUserConfiguration(MetricsConfig.class).run(ctx -> {
            CountingMetrics metrics = ctx.getBean(CountingMetrics.class);
            StreamQueueManager<?> manager = ctx.getBean(StreamQueueManager.class);
            manager.createQueue("run-1");
            manager.pushToQueue("run-1", EventMessage.of("token", "a"));
            assertEquals(1, metrics.created.get());
            assertEquals(1, metrics.pushed.get());
        });
    }

    @Test
    void backsOffWhenCustomFactoryPresent() {
        runner.withUserConfiguration(CustomFactoryConfig.class).run(ctx -> {
            assertFalse(ctx.containsBean("memoryStreamQueueFactory"));
            assertSame(ctx.getBean("customFactory"), ctx.getBean(StreamQueueFactory.class));
            assertNotNull(ctx.getBean(StreamQueueManager.class));
        });
    }

    // ── Redis backend ──────────────────────────────────────────────

    @Test
    void createsRedisBackendWhenSelected() {
        runner.withPropertyValues(
                "streamqueue.backend=REDIS",
                "streamqueue.redis.queue-prefix=agents:queue:"
        ).withUserConfiguration(RedisConnectionConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("redisSharedStore"));
            assertTrue(ctx.containsBean("sharedStreamQueueFactory"));
            assertFalse(ctx.containsBean("memoryStreamQueueFactory"));
            assertInstanceOf(SharedStreamQueueFactory.class, ctx.getBean(StreamQueueFactory.class));
            assertNotNull(ctx.getBean(RedisSharedStore.class));
            assertNotNull(ctx.getBean(StreamQueueManager.class));
        });
    }

    @Test
    void redisBackendWithoutConnectionFactoryFails() {
        runner.withPropertyValues("streamqueue.backend=redis").run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            assertTrue(hasCause(failure, IllegalStateException.class,
                    "requires a RedisConnectionFactory bean"), failure.toString());
        });
    }

    @Test
    void redisBackendWithoutRedisModuleFails() {
        runner.withPropertyValues("streamqueue.backend=redis")
                .withClassLoader(new FilteredClassLoader(RedisSharedStore.class))
                .withUserConfiguration(RedisConnectionConfig.class)
                .run(ctx -> {
                    Throwable failure = ctx.getStartupFailure();
                    assertNotNull(failure);
                    assertTrue(hasCause(failure, IllegalStateException.class,
                            "No StreamQueueFactory"), failure.toString());
                });
    }

    @Test
    void rejectsInvalidKeyPrefix() {
        runner.withPropertyValues(
                "streamqueue.backend=redis",
                "streamqueue.redis.queue-prefix=bad prefix"
        ).withUserConfiguration(RedisConnectionConfig.class).run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            assertTrue(hasCause(failure, IllegalArgumentException.class, "prefix"), failure.toString());
        });
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type, String fragment) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (type.isInstance(t) && t.getMessage() != null && t.getMessage().contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    // ── Test configurations ────────────────────────────────────────

    @Configuration
    static class RedisConnectionConfig {
        @Bean
        RedisConnectionFactory redisConnectionFactory() {
            // Never connected: beans are created without touching the server.
            return new LettuceConnectionFactory("127.0.0.1", 1);
        }
    }

    @Configuration
    static class MetricsConfig {
        @Bean
        CountingMetrics countingMetrics() {
            return new CountingMetrics();
        }
    }

    @Configuration
    static class CustomFactoryConfig {
        @Bean
        StreamQueueFactory<?> customFactory() {
            return new MemoryStreamQueueFactory();
        }
    }

    static class CountingMetrics implements MetricsExporter {
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger pushed = new AtomicInteger();

        @Override
        public void incrementQueueCreated() {
            created.incrementAndGet();
        }

        @Override
        public void incrementQueueRemoved() {
        }

        @Override
        public void incrementQueueCancelled() {
        }

        @Override
        public void incrementMessagePushed() {
            pushed.incrementAndGet();
        }

        @Override
        public void incrementLiveTailOpened() {
        }

        @Override
        public void recordRegisteredQueues(int count) {
        }
    }
}
