package io.streamqueue.spring.boot;

import io.streamqueue.StreamQueue;
import io.streamqueue.StreamQueueFactory;
import io.streamqueue.StreamQueueManager;
import io.streamqueue.memory.MemoryStreamQueueFactory;
import io.streamqueue.redis.RedisSharedStore;
import io.streamqueue.shared.KeyNames;
import io.streamqueue.shared.SharedStreamQueueFactory;
import io.streamqueue.spi.MetricsExporter;
import io.streamqueue.util.MessageCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for stream queues.
 *
 * <p>Creates a {@link StreamQueueManager} backed by process-local memory by default, or by
 * Redis when {@code streamqueue.backend=REDIS}. The Redis backend needs
 * {@code streamqueue-redis} and Spring Data Redis on the classpath and a
 * {@link RedisConnectionFactory} bean, which Spring Boot's Redis auto-configuration provides.
 *
 * <p>Every bean backs off when the application defines its own.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(StreamQueueProperties.class)
public class StreamQueueAutoConfiguration {
    private static final Logger logger = Logger.getLogger(StreamQueueAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec streamQueueMessageCodec() {
        return MessageCodec.getDefault();
    }

    @Bean
    @ConditionalOnMissingBean(StreamQueueFactory.class)
    @ConditionalOnProperty(prefix = "streamqueue", name = "backend", havingValue = "memory", matchIfMissing = true)
    public MemoryStreamQueueFactory memoryStreamQueueFactory(StreamQueueProperties props, MessageCodec codec) {
        return new MemoryStreamQueueFactory(codec, props.getGraceDelay());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public StreamQueueManager<?> streamQueueManager(
            ObjectProvider<StreamQueueFactory<?>> factoryProvider,
            StreamQueueProperties props,
            ObjectProvider<MetricsExporter> metricsProvider) {
        StreamQueueFactory<?> factory = factoryProvider.getIfAvailable();
        if (factory == null) {
            throw new IllegalStateException("No StreamQueueFactory for streamqueue.backend=" + props.getBackend()
                    + "; the REDIS backend needs streamqueue-redis and spring-data-redis on the classpath");
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        logger.log(Level.INFO, "Configuring stream queues with {0} backend", props.getBackend());
        return buildManager(factory, props, metrics);
    }

    private static <Q extends StreamQueue> StreamQueueManager<Q> buildManager(
            StreamQueueFactory<Q> factory, StreamQueueProperties props, MetricsExporter metrics) {
        return StreamQueueManager.<Q>builder()
                .factory(factory)
                .defaultCompressMessages(props.isCompressMessages())
                .defaultTtl(props.getTtl())
                .removalDelay(props.getRemovalDelay())
                .metrics(metrics)
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({RedisSharedStore.class, RedisConnectionFactory.class})
    @ConditionalOnProperty(prefix = "streamqueue", name = "backend", havingValue = "redis")
    static class RedisBackendConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        RedisSharedStore redisSharedStore(ObjectProvider<RedisConnectionFactory> connectionFactoryProvider) {
            RedisConnectionFactory connectionFactory = connectionFactoryProvider.getIfAvailable();
            if (connectionFactory == null) {
                throw new IllegalStateException(
                        "streamqueue.backend=REDIS requires a RedisConnectionFactory bean");
            }
            return new RedisSharedStore(connectionFactory);
        }

        @Bean
        @ConditionalOnMissingBean(StreamQueueFactory.class)
        SharedStreamQueueFactory sharedStreamQueueFactory(
                RedisSharedStore store, StreamQueueProperties props, MessageCodec codec) {
            return SharedStreamQueueFactory.builder()
                    .store(store)
                    .keyNames(KeyNames.of(props.getRedis().getQueuePrefix(), props.getRedis().getChannelPrefix()))
                    .codec(codec)
                    .graceDelay(props.getGraceDelay())
                    .build();
        }
    }
}
