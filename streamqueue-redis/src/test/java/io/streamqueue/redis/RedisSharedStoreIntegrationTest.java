package io.streamqueue.redis;

import io.streamqueue.spi.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DockerAvailable
@Testcontainers
class RedisSharedStoreIntegrationTest {

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine")
            .withExposedPorts(6379);

    private LettuceConnectionFactory connectionFactory;
    private RedisSharedStore store;

    @BeforeEach
    void setUp() {
        connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getMappedPort(6379));
        connectionFactory.afterPropertiesSet();
        store = new RedisSharedStore(connectionFactory);
        store.delete("queue:a");
        store.delete("queue:b");
    }

    @AfterEach
    void tearDown() {
        store.close();
        connectionFactory.destroy();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void appendReturnsLengthAndRangeKeepsOrder() {
        assertEquals(1, store.append("queue:a", bytes("one")));
        assertEquals(2, store.append("queue:a", bytes("two")));

        List<byte[]> entries = store.range("queue:a");
        assertEquals(2, entries.size());
        assertArrayEquals(bytes("one"), entries.get(0));
        assertArrayEquals(bytes("two"), entries.get(1));
    }

    @Test
    void missingKeyReadsEmpty() {
        assertTrue(store.range("queue:missing").isEmpty());
        assertFalse(store.exists("queue:missing"));
    }

    @Test
    void expiredKeyDisappears() throws Exception {
        store.append("queue:a", bytes("one"));
        store.expire("queue:a", Duration.ofSeconds(1));
        assertTrue(store.exists("queue:a"));

        Thread.sleep(1_500);

        assertFalse(store.exists("queue:a"));
    }

    @Test
    void copyDuplicatesAndReplacesTarget() {
        store.append("queue:a", bytes("one"));
        store.append("queue:b", bytes("stale"));

        store.copy("queue:a", "queue:b");
        store.append("queue:a", bytes("two"));

        List<byte[]> copied = store.range("queue:b");
        assertEquals(1, copied.size());
        assertArrayEquals(bytes("one"), copied.get(0));
    }

    @Test
    void deleteRemovesKey() {
        store.append("queue:a", bytes("one"));

        store.delete("queue:a");

        assertFalse(store.exists("queue:a"));
    }

    @Test
    void subscriberReceivesMessagesInOrderUntilClosed() throws Exception {
        LinkedBlockingQueue<String> received = new LinkedBlockingQueue<>();
        Subscription subscription = store.subscribe("channel:a",
                body -> received.add(new String(body, StandardCharsets.UTF_8)));
        assertTrue(store.isListenerContainerStarted());

        for (int i = 0; i < 20; i++) {
            store.publish("channel:a", bytes("m" + i));
        }
        for (int i = 0; i < 20; i++) {
            assertEquals("m" + i, received.poll(5, TimeUnit.SECONDS));
        }

        subscription.close();
        subscription.close();
        store.publish("channel:a", bytes("after"));
        assertNull(received.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void listenerContainerStartsLazily() {
        assertFalse(store.isListenerContainerStarted());

        store.append("queue:a", bytes("one"));

        assertFalse(store.isListenerContainerStarted());
    }
}
