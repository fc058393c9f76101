package io.streamqueue.memory;

import io.streamqueue.CancellationSignal;
import io.streamqueue.EventMessage;
import io.streamqueue.LiveTail;
import io.streamqueue.StreamQueue;
import io.streamqueue.spi.Subscription;
import io.streamqueue.util.MessageCodec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StreamQueue} held in process memory. Visible only to the owning process.
 *
 * <p>When {@code compressMessages} is set, entries are stored encoded by the
 * {@link MessageCodec} and decoded on every read; otherwise the messages are stored as
 * given. The TTL is carried for interface parity but not enforced: the log lives until
 * its manager drops the handle.
 *
 * <p>Listeners run on the pushing thread, in push order, while the queue's monitor is held.
 */
public final class MemoryStreamQueue implements StreamQueue {
    private static final Logger logger = Logger.getLogger(MemoryStreamQueue.class.getName());

    static final Duration DEFAULT_GRACE_DELAY = Duration.ofMillis(300);

    private final String id;
    private final boolean compressMessages;
    private final Duration ttl;
    private final MessageCodec codec;
    private final Duration graceDelay;
    private final CancellationSignal cancelSignal = new CancellationSignal();
    private final List<Object> entries = new ArrayList<>();
    private final CopyOnWriteArrayList<Consumer<EventMessage>> listeners = new CopyOnWriteArrayList<>();

    public MemoryStreamQueue(String id, boolean compressMessages, Duration ttl) {
        this(id, compressMessages, ttl, MessageCodec.getDefault(), DEFAULT_GRACE_DELAY);
    }

    public MemoryStreamQueue(String id, boolean compressMessages, Duration ttl,
                             MessageCodec codec, Duration graceDelay) {
        this.id = Objects.requireNonNull(id, "id");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.graceDelay = Objects.requireNonNull(graceDelay, "graceDelay");
        this.compressMessages = compressMessages;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean compressMessages() {
        return compressMessages;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public synchronized void push(EventMessage message) {
        Objects.requireNonNull(message, "message");
        EventMessage delivered = message;
        if (compressMessages) {
            byte[] encoded = codec.encode(message);
            entries.add(encoded);
            if (!listeners.isEmpty()) {
                delivered = codec.decode(encoded);
            }
        } else {
            entries.add(message);
        }
        if (message.isCancel()) {
            cancelSignal.fire();
        }
        for (Consumer<EventMessage> listener : listeners) {
            try {
                listener.accept(delivered);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Data listener of queue " + id + " failed", e);
            }
        }
    }

    @Override
    public synchronized List<EventMessage> getAll() {
        List<EventMessage> result = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            result.add(compressMessages ? codec.decode((byte[]) entry) : (EventMessage) entry);
        }
        return result;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public void cancel() {
        cancelSignal.fire();
        push(EventMessage.cancel());
    }

    @Override
    public boolean isCancelled() {
        return cancelSignal.isCancelled();
    }

    @Override
    public MemoryStreamQueue copyToQueue(String newId) {
        return copyToQueue(newId, ttl);
    }

    @Override
    public synchronized MemoryStreamQueue copyToQueue(String newId, Duration ttl) {
        MemoryStreamQueue copy = new MemoryStreamQueue(newId, compressMessages, ttl, codec, graceDelay);
        copy.entries.addAll(entries);
        return copy;
    }

    /**
     * Registers a callback for every message pushed from now on.
     *
     * @param listener receives each pushed message
     * @return a handle that removes the listener when closed
     */
    public Subscription onDataChange(Consumer<EventMessage> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public LiveTail onDataReceive() {
        LiveTail tail = new LiveTail(id, cancelSignal, graceDelay, this::cancel);
        if (cancelSignal.isCancelled()) {
            tail.close();
            return tail;
        }
        synchronized (this) {
            try {
                Subscription subscription = onDataChange(tail::accept);
                tail.onClose(subscription::close);
                tail.replay(getAll());
            } catch (RuntimeException e) {
                tail.close();
                throw e;
            }
        }
        return tail;
    }
}
