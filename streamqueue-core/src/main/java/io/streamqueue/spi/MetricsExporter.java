package io.streamqueue.spi;

/**
 * Observability hook for exporting stream queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of queues created or lazily attached by a manager.
     */
    void incrementQueueCreated();

    /**
     * Increments the count of queue handles deregistered from a manager.
     */
    void incrementQueueRemoved();

    /**
     * Increments the count of runs cancelled through a manager.
     */
    void incrementQueueCancelled();

    /**
     * Increments the count of queue copies.
     */
    default void incrementQueueCopied() {
    }

    /**
     * Increments the count of messages pushed through a manager.
     */
    void incrementMessagePushed();

    /**
     * Increments the count of live tails opened on managed queues.
     */
    default void incrementLiveTailOpened() {
    }

    /**
     * Records the number of queue handles currently registered with a manager.
     *
     * @param count registered queues (always non-negative)
     */
    void recordRegisteredQueues(int count);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementQueueCreated() {
        }

        @Override
        public void incrementQueueRemoved() {
        }

        @Override
        public void incrementQueueCancelled() {
        }

        @Override
        public void incrementMessagePushed() {
        }

        @Override
        public void recordRegisteredQueues(int count) {
        }
    }
}
