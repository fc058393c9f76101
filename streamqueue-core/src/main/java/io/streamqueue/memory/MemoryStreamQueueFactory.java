package io.streamqueue.memory;

import io.streamqueue.StreamQueueFactory;
import io.streamqueue.util.MessageCodec;

import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link MemoryStreamQueue}s. Nothing outlives the process, so {@link #exists}
 * always reports {@code false}.
 */
public final class MemoryStreamQueueFactory implements StreamQueueFactory<MemoryStreamQueue> {
    private final MessageCodec codec;
    private final Duration graceDelay;

    public MemoryStreamQueueFactory() {
        this(MessageCodec.getDefault(), MemoryStreamQueue.DEFAULT_GRACE_DELAY);
    }

    public MemoryStreamQueueFactory(MessageCodec codec, Duration graceDelay) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.graceDelay = Objects.requireNonNull(graceDelay, "graceDelay");
        if (graceDelay.isNegative()) {
            throw new IllegalArgumentException("graceDelay must be >= 0");
        }
    }

    @Override
    public MemoryStreamQueue create(String id, boolean compressMessages, Duration ttl) {
        return new MemoryStreamQueue(id, compressMessages, ttl, codec, graceDelay);
    }
}
