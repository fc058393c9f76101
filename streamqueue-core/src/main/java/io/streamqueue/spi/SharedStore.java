package io.streamqueue.spi;

import io.streamqueue.BackendUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Cross-process storage contract behind {@link io.streamqueue.shared.SharedStreamQueue}:
 * an ordered append-only list per key, key expiry, and a publish/subscribe channel.
 *
 * <p>Any store offering these three capabilities can back shared queues. Every method
 * reports connectivity failures as {@link BackendUnavailableException}; implementations
 * perform no retries. The Redis implementation, {@code io.streamqueue.redis.RedisSharedStore},
 * lives in the {@code streamqueue-redis} module.
 */
public interface SharedStore {

    /**
     * Appends one entry to the tail of the list stored at {@code key}, creating the list if needed.
     * The entry is either fully appended or not at all.
     *
     * @param key   the list key
     * @param entry the encoded entry
     * @return the length of the list after the append
     */
    long append(String key, byte[] entry);

    /**
     * Sets (or resets) the time-to-live of {@code key}. Expiring a missing key is a no-op.
     *
     * @param key the key
     * @param ttl the new expiry window, must be positive
     */
    void expire(String key, Duration ttl);

    /**
     * Returns every entry of the list at {@code key}, oldest first.
     *
     * @param key the list key
     * @return the entries, empty if the key does not exist
     */
    List<byte[]> range(String key);

    /**
     * Deletes {@code key}. Deleting a missing key is a no-op.
     *
     * @param key the key
     */
    void delete(String key);

    /**
     * Returns whether {@code key} currently exists (has not been deleted or expired).
     *
     * @param key the key
     * @return {@code true} if the key exists
     */
    boolean exists(String key);

    /**
     * Duplicates the value at {@code sourceKey} under {@code targetKey} on the server,
     * replacing any existing target. Copying a missing source leaves the target untouched.
     *
     * @param sourceKey the key to copy from
     * @param targetKey the key to copy to
     */
    void copy(String sourceKey, String targetKey);

    /**
     * Publishes a message to every current subscriber of {@code channel}, in every process.
     *
     * @param channel the channel name
     * @param message the message body
     */
    void publish(String channel, byte[] message);

    /**
     * Subscribes to {@code channel}. Returns only once the subscription is active, so a
     * message published after this call returns is guaranteed to be delivered.
     *
     * <p>Messages are delivered to {@code listener} one at a time, in publish order,
     * on a thread owned by the store.
     *
     * @param channel  the channel name
     * @param listener receives each message body
     * @return a handle that unsubscribes when closed
     */
    Subscription subscribe(String channel, Consumer<byte[]> listener);
}
