package io.streamqueue;

import java.time.Duration;
import java.util.List;

/**
 * Ordered, multi-consumer event log for one run, addressed by its run id.
 *
 * <p>Two implementations ship with the core:
 * {@link io.streamqueue.memory.MemoryStreamQueue} (visible within one process) and
 * {@link io.streamqueue.shared.SharedStreamQueue} (visible to every process sharing a
 * {@link io.streamqueue.spi.SharedStore}).
 *
 * <p>Append order is read order for both {@link #getAll()} and {@link #onDataReceive()}.
 * Reads never remove entries: every consumer sees every item.
 */
public interface StreamQueue {

    String id();

    /**
     * Returns whether payloads pass through the {@link io.streamqueue.util.MessageCodec}
     * before they are stored.
     *
     * @return the compression flag
     */
    boolean compressMessages();

    /**
     * Returns how long the queue may stay idle before the backend may discard it.
     *
     * @return the expiry window
     */
    Duration ttl();

    /**
     * Appends a message to the end of the log and wakes every live tail.
     *
     * @param message the message to append
     * @throws BackendUnavailableException if the store cannot be reached
     * @throws IllegalArgumentException    if the payload is not JSON-compatible
     */
    void push(EventMessage message);

    /**
     * Returns a point-in-time snapshot of the log, oldest first. Never blocks.
     *
     * @return the stored messages
     * @throws BackendUnavailableException if the store cannot be reached
     * @throws CorruptMessageException     if a stored entry cannot be decoded
     */
    List<EventMessage> getAll();

    /**
     * Discards every stored entry. Items already buffered by live tails are unaffected.
     */
    void clear();

    /**
     * Raises the cancellation signal and appends a {@code __stream_cancel__} marker so that
     * consumers everywhere, including late joiners, observe termination.
     */
    void cancel();

    /**
     * Returns whether this handle's cancellation signal is set.
     *
     * @return {@code true} once cancelled
     */
    boolean isCancelled();

    /**
     * Copies the current contents into a new queue that keeps the source's TTL.
     *
     * @param newId id of the copy
     * @return the new, independent queue
     */
    default StreamQueue copyToQueue(String newId) {
        return copyToQueue(newId, ttl());
    }

    /**
     * Copies the current contents into a new queue with its own TTL. Later writes to either
     * queue are not visible in the other.
     *
     * @param newId id of the copy
     * @param ttl   expiry window of the copy
     * @return the new, independent queue
     */
    StreamQueue copyToQueue(String newId, Duration ttl);

    /**
     * Opens a live tail: stored entries first, then new ones as they are pushed, until a
     * control event (plus the grace delay) or cancellation ends it.
     *
     * @return a new live tail; the caller must close it when stopping early
     */
    LiveTail onDataReceive();
}
