package io.streamqueue;

import io.streamqueue.spi.MetricsExporter;
import io.streamqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-process registry of {@link StreamQueue} handles keyed by run id.
 *
 * <p>Handles are created explicitly with {@link #createQueue} or attached lazily by
 * {@link #getQueue} when the factory reports that the backend already holds the run.
 * Removal is debounced: {@link #removeQueue} deregisters the handle only after the
 * configured delay, and only if no newer handle has been registered under the same id.
 *
 * <p>Bulk operations ({@link #getAllQueueIds()}, {@link #getAllQueuesData()},
 * {@link #clearAllQueues()}) see the locally registered handles only.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @param <Q> the queue type produced by the factory
 * @see StreamQueueManager.Builder
 */
public final class StreamQueueManager<Q extends StreamQueue> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StreamQueueManager.class.getName());

    private final StreamQueueFactory<Q> factory;
    private final boolean defaultCompressMessages;
    private final Duration defaultTtl;
    private final Duration removalDelay;
    private final MetricsExporter metrics;
    private final ConcurrentMap<String, Q> queues = new ConcurrentHashMap<>();

    private ScheduledExecutorService removalScheduler;
    private volatile boolean closed;

    private StreamQueueManager(Builder<Q> builder) {
        this.factory = Objects.requireNonNull(builder.factory, "factory");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.defaultCompressMessages = builder.defaultCompressMessages;
        this.defaultTtl = Objects.requireNonNull(builder.defaultTtl, "defaultTtl");
        this.removalDelay = Objects.requireNonNull(builder.removalDelay, "removalDelay");
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
        if (removalDelay.isNegative()) {
            throw new IllegalArgumentException("removalDelay must be >= 0");
        }
    }

    public static <Q extends StreamQueue> Builder<Q> builder() {
        return new Builder<>();
    }

    /**
     * Creates a queue with the default TTL, replacing any handle registered under {@code id}.
     *
     * @param id the run id
     * @return the new queue
     */
    public Q createQueue(String id) {
        return createQueue(id, defaultTtl);
    }

    /**
     * Creates a queue with its own TTL, replacing any handle registered under {@code id}.
     *
     * @param id  the run id
     * @param ttl the expiry window
     * @return the new queue
     */
    public Q createQueue(String id, Duration ttl) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ttl, "ttl");
        ensureOpen();
        Q queue = factory.create(id, defaultCompressMessages, ttl);
        register(id, queue);
        logger.log(Level.FINE, "Created queue {0} (ttl {1})", new Object[]{id, ttl});
        return queue;
    }

    /**
     * Returns the registered handle for {@code id}, attaching one lazily if the backend
     * already holds the run.
     *
     * @param id the run id
     * @return the queue
     * @throws QueueNotFoundException if the id is unknown here and to the backend
     */
    public Q getQueue(String id) {
        Q queue = findQueue(id);
        if (queue == null) {
            throw new QueueNotFoundException(id);
        }
        return queue;
    }

    /**
     * Cancels the run and schedules removal of its handle. Unknown ids are ignored.
     *
     * @param id the run id
     * @return {@code true} if a queue was cancelled
     */
    public boolean cancelQueue(String id) {
        Q queue = findQueue(id);
        if (queue == null) {
            return false;
        }
        queue.cancel();
        metrics.incrementQueueCancelled();
        logger.log(Level.FINE, "Cancelled queue {0}", id);
        removeQueue(id);
        return true;
    }

    /**
     * Appends a message to the run's queue.
     *
     * @param id      the run id
     * @param message the message
     * @throws QueueNotFoundException if the queue cannot be located
     */
    public void pushToQueue(String id, EventMessage message) {
        getQueue(id).push(message);
        metrics.incrementMessagePushed();
    }

    /**
     * Returns a snapshot of the run's queue.
     *
     * @param id the run id
     * @return stored messages, oldest first
     * @throws QueueNotFoundException if the queue cannot be located
     */
    public List<EventMessage> getQueueData(String id) {
        return getQueue(id).getAll();
    }

    /**
     * Opens a live tail on the run's queue.
     *
     * @param id the run id
     * @return a new live tail
     * @throws QueueNotFoundException if the queue cannot be located
     */
    public LiveTail onDataReceive(String id) {
        LiveTail tail = getQueue(id).onDataReceive();
        metrics.incrementLiveTailOpened();
        return tail;
    }

    /**
     * Discards the stored entries of the run's queue. Unknown ids are ignored.
     *
     * @param id the run id
     */
    public void clearQueue(String id) {
        Q queue = findQueue(id);
        if (queue != null) {
            queue.clear();
        }
    }

    /**
     * Deregisters the handle for {@code id} after the removal delay. A handle registered
     * under the same id in the meantime is kept.
     *
     * @param id the run id
     */
    public void removeQueue(String id) {
        Q queue = queues.get(id);
        if (queue == null) {
            return;
        }
        if (removalDelay.isZero() || closed) {
            deregister(id, queue);
            return;
        }
        try {
            scheduler().schedule(() -> deregister(id, queue), removalDelay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            deregister(id, queue);
        }
    }

    /**
     * Copies the source queue's contents into a new queue that keeps the source's TTL.
     *
     * @param fromId source run id
     * @param toId   id of the copy
     * @return the registered copy
     * @throws QueueNotFoundException if the source cannot be located
     */
    public Q copyQueue(String fromId, String toId) {
        return copyQueue(fromId, toId, null);
    }

    /**
     * Copies the source queue's contents into a new queue and registers it under {@code toId}.
     *
     * @param fromId source run id
     * @param toId   id of the copy
     * @param ttl    expiry window of the copy, or {@code null} for the source's
     * @return the registered copy
     * @throws QueueNotFoundException if the source cannot be located
     */
    @SuppressWarnings("unchecked")
    public Q copyQueue(String fromId, String toId, Duration ttl) {
        Objects.requireNonNull(toId, "toId");
        ensureOpen();
        Q source = getQueue(fromId);
        Q copy = (Q) (ttl == null ? source.copyToQueue(toId) : source.copyToQueue(toId, ttl));
        register(toId, copy);
        metrics.incrementQueueCopied();
        logger.log(Level.FINE, "Copied queue {0} to {1}", new Object[]{fromId, toId});
        return copy;
    }

    /**
     * Returns the ids of the locally registered queues.
     *
     * @return a snapshot of registered ids
     */
    public List<String> getAllQueueIds() {
        return new ArrayList<>(queues.keySet());
    }

    /**
     * Returns a snapshot of every locally registered queue.
     *
     * @return run id to stored messages
     */
    public Map<String, List<EventMessage>> getAllQueuesData() {
        Map<String, List<EventMessage>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Q> entry : queues.entrySet()) {
            result.put(entry.getKey(), entry.getValue().getAll());
        }
        return result;
    }

    /** Clears the stored entries of every locally registered queue. */
    public void clearAllQueues() {
        for (Q queue : queues.values()) {
            queue.clear();
        }
    }

    /**
     * Stops the removal timer. Pending removals are dropped; registered handles stay
     * reachable until the manager is discarded.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (removalScheduler != null) {
            removalScheduler.shutdownNow();
            try {
                removalScheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            removalScheduler = null;
        }
    }

    private Q findQueue(String id) {
        Objects.requireNonNull(id, "id");
        Q queue = queues.get(id);
        if (queue != null) {
            return queue;
        }
        if (!factory.exists(id)) {
            return null;
        }
        Q attached = factory.create(id, defaultCompressMessages, defaultTtl);
        Q existing = queues.putIfAbsent(id, attached);
        if (existing != null) {
            return existing;
        }
        metrics.incrementQueueCreated();
        metrics.recordRegisteredQueues(queues.size());
        logger.log(Level.FINE, "Attached to existing queue {0}", id);
        return attached;
    }

    private void register(String id, Q queue) {
        queues.put(id, queue);
        metrics.incrementQueueCreated();
        metrics.recordRegisteredQueues(queues.size());
    }

    private void deregister(String id, Q queue) {
        try {
            if (queues.remove(id, queue)) {
                metrics.incrementQueueRemoved();
                metrics.recordRegisteredQueues(queues.size());
                logger.log(Level.FINE, "Removed queue {0}", id);
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to remove queue " + id, e);
        }
    }

    private synchronized ScheduledExecutorService scheduler() {
        if (removalScheduler == null) {
            removalScheduler = Executors.newSingleThreadScheduledExecutor(
                    new DaemonThreadFactory("streamqueue-removal-"));
        }
        return removalScheduler;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("StreamQueueManager has been closed");
        }
    }

    /**
     * Builder for {@link StreamQueueManager}.
     *
     * @param <Q> the queue type produced by the factory
     */
    public static final class Builder<Q extends StreamQueue> {
        private StreamQueueFactory<Q> factory;
        private boolean defaultCompressMessages = true;
        private Duration defaultTtl = Duration.ofSeconds(300);
        private Duration removalDelay = Duration.ofMillis(500);
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the factory that creates queue handles.
         *
         * <p><b>Required.</b>
         *
         * @param factory the queue factory
         * @return this builder
         */
        public Builder<Q> factory(StreamQueueFactory<Q> factory) {
            this.factory = factory;
            return this;
        }

        /**
         * Sets whether new queues encode their messages.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param defaultCompressMessages the compression flag for new queues
         * @return this builder
         */
        public Builder<Q> defaultCompressMessages(boolean defaultCompressMessages) {
            this.defaultCompressMessages = defaultCompressMessages;
            return this;
        }

        /**
         * Sets the TTL used by {@link StreamQueueManager#createQueue(String)} and lazy attach.
         *
         * <p>Optional. Defaults to 300 seconds. Must be &gt; 0.
         *
         * @param defaultTtl the default expiry window
         * @return this builder
         */
        public Builder<Q> defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * Sets the debounce delay of {@link StreamQueueManager#removeQueue(String)}.
         *
         * <p>Optional. Defaults to 500 ms. Zero removes immediately.
         *
         * @param removalDelay the removal delay
         * @return this builder
         */
        public Builder<Q> removalDelay(Duration removalDelay) {
            this.removalDelay = removalDelay;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder<Q> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the manager.
         *
         * @return a new {@link StreamQueueManager}
         * @throws NullPointerException     if {@code factory} is null
         * @throws IllegalArgumentException if {@code defaultTtl <= 0} or {@code removalDelay < 0}
         */
        public StreamQueueManager<Q> build() {
            return new StreamQueueManager<>(this);
        }
    }
}
