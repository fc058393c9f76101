package io.streamqueue;

import java.time.Duration;

/**
 * Creates {@link StreamQueue} handles for a {@link StreamQueueManager}.
 *
 * @param <Q> the queue type produced
 */
public interface StreamQueueFactory<Q extends StreamQueue> {

    /**
     * Creates a handle for {@code id}. For shared backends the handle attaches to any
     * data already stored under the id.
     *
     * @param id               the run id
     * @param compressMessages whether to encode messages before storing them
     * @param ttl              the expiry window
     * @return a new queue handle
     */
    Q create(String id, boolean compressMessages, Duration ttl);

    /**
     * Returns whether the backend holds data for {@code id} that this process has no handle
     * for yet. Process-local backends return {@code false}.
     *
     * @param id the run id
     * @return {@code true} if a handle can be attached lazily
     */
    default boolean exists(String id) {
        return false;
    }
}
