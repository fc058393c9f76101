package io.streamqueue.redis;

import io.streamqueue.BackendUnavailableException;
import io.streamqueue.spi.SharedStore;
import io.streamqueue.spi.Subscription;
import io.streamqueue.util.DaemonThreadFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SharedStore} on Redis: lists via RPUSH/LRANGE, expiry via EXPIRE, server-side
 * duplication via COPY (Redis 6.2+), and notifications via PUBLISH/SUBSCRIBE.
 *
 * <p>Commands go through a {@link RedisTemplate} with string keys and raw byte values.
 * Subscriptions share one {@link RedisMessageListenerContainer}, started on the first
 * {@link #subscribe} call. Its listeners run on a single daemon thread
 * ({@code streamqueue-redis-listener-N}) so that messages reach each listener in publish order.
 *
 * <p>Spring's {@link DataAccessException}s are rethrown as {@link BackendUnavailableException};
 * nothing is retried.
 *
 * <pre>{@code
 * LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory("localhost", 6379);
 * connectionFactory.afterPropertiesSet();
 * RedisSharedStore store = new RedisSharedStore(connectionFactory);
 * SharedStreamQueueFactory factory = SharedStreamQueueFactory.builder().store(store).build();
 * }</pre>
 */
public final class RedisSharedStore implements SharedStore, AutoCloseable {
    private static final Logger logger = Logger.getLogger(RedisSharedStore.class.getName());

    private final RedisConnectionFactory connectionFactory;
    private final RedisTemplate<String, byte[]> template;

    private RedisMessageListenerContainer container;
    private ExecutorService listenerExecutor;
    private boolean closed;

    public RedisSharedStore(RedisConnectionFactory connectionFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        RedisTemplate<String, byte[]> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(connectionFactory);
        redisTemplate.setKeySerializer(RedisSerializer.string());
        redisTemplate.setValueSerializer(RedisSerializer.byteArray());
        redisTemplate.afterPropertiesSet();
        this.template = redisTemplate;
    }

    @Override
    public long append(String key, byte[] entry) {
        Long length = execute("RPUSH " + key, () -> template.opsForList().rightPush(key, entry));
        if (length == null) {
            throw new BackendUnavailableException("RPUSH " + key + " returned no reply", null);
        }
        return length;
    }

    @Override
    public void expire(String key, Duration ttl) {
        run("EXPIRE " + key, () -> template.expire(key, ttl));
    }

    @Override
    public List<byte[]> range(String key) {
        List<byte[]> entries = execute("LRANGE " + key, () -> template.opsForList().range(key, 0, -1));
        return entries != null ? entries : List.of();
    }

    @Override
    public void delete(String key) {
        run("DEL " + key, () -> template.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS " + key, () -> template.hasKey(key)));
    }

    @Override
    public void copy(String sourceKey, String targetKey) {
        run("COPY " + sourceKey, () -> template.copy(sourceKey, targetKey, true));
    }

    @Override
    public void publish(String channel, byte[] message) {
        run("PUBLISH " + channel, () -> template.convertAndSend(channel, message));
    }

    @Override
    public Subscription subscribe(String channel, Consumer<byte[]> listener) {
        Objects.requireNonNull(listener, "listener");
        ChannelTopic topic = new ChannelTopic(channel);
        MessageListener messageListener = (message, pattern) -> {
            try {
                listener.accept(message.getBody());
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener on channel " + channel + " failed", e);
            }
        };
        RedisMessageListenerContainer listenerContainer = container();
        try {
            listenerContainer.addMessageListener(messageListener, topic);
        } catch (RuntimeException e) {
            removeQuietly(listenerContainer, messageListener, topic);
            throw new BackendUnavailableException("SUBSCRIBE " + channel + " failed", e);
        }
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                removeQuietly(listenerContainer, messageListener, topic);
            }
        };
    }

    /**
     * Stops the listener container and its dispatch thread. The connection factory is not
     * closed; it belongs to the caller.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (container != null) {
            try {
                container.destroy();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to stop Redis listener container", e);
            }
            container = null;
        }
        if (listenerExecutor != null) {
            listenerExecutor.shutdownNow();
            try {
                listenerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            listenerExecutor = null;
        }
    }

    synchronized boolean isListenerContainerStarted() {
        return container != null && container.isRunning();
    }

    private synchronized RedisMessageListenerContainer container() {
        if (closed) {
            throw new IllegalStateException("RedisSharedStore has been closed");
        }
        if (container == null) {
            ExecutorService executor = Executors.newSingleThreadExecutor(
                    new DaemonThreadFactory("streamqueue-redis-listener-"));
            RedisMessageListenerContainer listenerContainer = new RedisMessageListenerContainer();
            listenerContainer.setConnectionFactory(connectionFactory);
            listenerContainer.setTaskExecutor(executor);
            try {
                listenerContainer.afterPropertiesSet();
                listenerContainer.start();
            } catch (Exception e) {
                executor.shutdownNow();
                throw new BackendUnavailableException("Failed to start Redis listener container", e);
            }
            listenerExecutor = executor;
            container = listenerContainer;
            logger.log(Level.FINE, "Started Redis listener container");
        }
        return container;
    }

    private static void removeQuietly(RedisMessageListenerContainer listenerContainer,
                                      MessageListener messageListener, ChannelTopic topic) {
        try {
            listenerContainer.removeMessageListener(messageListener, topic);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to unsubscribe from " + topic.getTopic(), e);
        }
    }

    private static void run(String command, Runnable action) {
        execute(command, () -> {
            action.run();
            return null;
        });
    }

    private static <T> T execute(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new BackendUnavailableException(command + " failed", e);
        }
    }
}
