package io.streamqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.streamqueue.EventMessage;
import io.streamqueue.StreamQueueManager;
import io.streamqueue.memory.MemoryStreamQueue;
import io.streamqueue.memory.MemoryStreamQueueFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void countersIncrement() {
        exporter.incrementQueueCreated();
        exporter.incrementQueueCreated();
        exporter.incrementQueueRemoved();
        exporter.incrementQueueCancelled();
        exporter.incrementQueueCopied();
        exporter.incrementMessagePushed();
        exporter.incrementLiveTailOpened();

        assertEquals(2.0, counter("streamqueue.queues.created").count());
        assertEquals(1.0, counter("streamqueue.queues.removed").count());
        assertEquals(1.0, counter("streamqueue.queues.cancelled").count());
        assertEquals(1.0, counter("streamqueue.queues.copied").count());
        assertEquals(1.0, counter("streamqueue.messages.pushed").count());
        assertEquals(1.0, counter("streamqueue.tails.opened").count());
    }

    @Test
    void registeredGaugeTracksLatestValue() {
        exporter.recordRegisteredQueues(42);
        assertEquals(42.0, gauge("streamqueue.queues.registered").value());

        exporter.recordRegisteredQueues(0);
        assertEquals(0.0, gauge("streamqueue.queues.registered").value());
    }

    @Test
    void customNamePrefix() {
        MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "agents.streamqueue");
        custom.incrementMessagePushed();
        custom.recordRegisteredQueues(3);

        assertEquals(1.0, counter("agents.streamqueue.messages.pushed").count());
        assertEquals(3.0, gauge("agents.streamqueue.queues.registered").value());
    }

    @Test
    void invalidPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.close();
        exporter.incrementQueueCreated();
        exporter.recordRegisteredQueues(5);

        assertNull(registry.find("streamqueue.queues.created").counter());
        assertNull(registry.find("streamqueue.queues.registered").gauge());
    }

    @Test
    void managerReportsThroughExporter() {
        try (StreamQueueManager<MemoryStreamQueue> manager = StreamQueueManager.<MemoryStreamQueue>builder()
                .factory(new MemoryStreamQueueFactory())
                .removalDelay(Duration.ZERO)
                .metrics(exporter)
                .build()) {
            manager.createQueue("run-1");
            manager.pushToQueue("run-1", EventMessage.of("token", "Hi"));
            manager.pushToQueue("run-1", EventMessage.end());

            assertEquals(1.0, counter("streamqueue.queues.created").count());
            assertEquals(2.0, counter("streamqueue.messages.pushed").count());
            assertEquals(1.0, gauge("streamqueue.queues.registered").value());

            manager.cancelQueue("run-1");

            assertEquals(1.0, counter("streamqueue.queues.cancelled").count());
            assertEquals(0.0, gauge("streamqueue.queues.registered").value());
        }
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
