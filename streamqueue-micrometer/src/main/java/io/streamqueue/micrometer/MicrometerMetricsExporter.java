package io.streamqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.streamqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code streamqueue.queues.created}: queues created or attached by a manager</li>
 *   <li>{@code streamqueue.queues.removed}: queue handles deregistered</li>
 *   <li>{@code streamqueue.queues.cancelled}: runs cancelled</li>
 *   <li>{@code streamqueue.queues.copied}: queue copies</li>
 *   <li>{@code streamqueue.messages.pushed}: messages pushed through a manager</li>
 *   <li>{@code streamqueue.tails.opened}: live tails opened</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code streamqueue.queues.registered}: handles currently registered</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter created;
    private final Counter removed;
    private final Counter cancelled;
    private final Counter copied;
    private final Counter pushed;
    private final Counter tailsOpened;
    private final Gauge registeredGauge;

    private final AtomicInteger registered = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "streamqueue"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "streamqueue");
    }

    /**
     * Creates an exporter with a custom metric name prefix, e.g. one per manager.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "agents.streamqueue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.created = Counter.builder(namePrefix + ".queues.created")
                .description("Queues created or attached by a manager")
                .register(registry);
        this.removed = Counter.builder(namePrefix + ".queues.removed")
                .description("Queue handles deregistered")
                .register(registry);
        this.cancelled = Counter.builder(namePrefix + ".queues.cancelled")
                .description("Runs cancelled")
                .register(registry);
        this.copied = Counter.builder(namePrefix + ".queues.copied")
                .description("Queue copies")
                .register(registry);
        this.pushed = Counter.builder(namePrefix + ".messages.pushed")
                .description("Messages pushed through a manager")
                .register(registry);
        this.tailsOpened = Counter.builder(namePrefix + ".tails.opened")
                .description("Live tails opened")
                .register(registry);
        this.registeredGauge = Gauge.builder(namePrefix + ".queues.registered", registered, AtomicInteger::get)
                .description("Queue handles currently registered")
                .register(registry);
    }

    @Override
    public void incrementQueueCreated() {
        if (closed) return;
        created.increment();
    }

    @Override
    public void incrementQueueRemoved() {
        if (closed) return;
        removed.increment();
    }

    @Override
    public void incrementQueueCancelled() {
        if (closed) return;
        cancelled.increment();
    }

    @Override
    public void incrementQueueCopied() {
        if (closed) return;
        copied.increment();
    }

    @Override
    public void incrementMessagePushed() {
        if (closed) return;
        pushed.increment();
    }

    @Override
    public void incrementLiveTailOpened() {
        if (closed) return;
        tailsOpened.increment();
    }

    @Override
    public void recordRegisteredQueues(int count) {
        if (closed) return;
        registered.set(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(created, removed, cancelled, copied, pushed, tailsOpened, registeredGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
