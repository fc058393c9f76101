package io.streamqueue.shared;

import io.streamqueue.CancellationSignal;
import io.streamqueue.CorruptMessageException;
import io.streamqueue.EventMessage;
import io.streamqueue.LiveTail;
import io.streamqueue.StreamQueue;
import io.streamqueue.spi.SharedStore;
import io.streamqueue.spi.Subscription;
import io.streamqueue.util.MessageCodec;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StreamQueue} kept in a {@link SharedStore}, visible to every process using the store.
 *
 * <p>Each push appends the encoded message to the run's list, resets the list's expiry and
 * publishes a notification frame on the run's channel. A frame is the zero-based list
 * position of the entry as an 8-byte big-endian long, followed by the encoded entry.
 *
 * <p>Live tails subscribe before reading the stored backlog. Frames received while the
 * backlog is being read are held back; those whose position lies inside the backlog are
 * dropped so that every entry is yielded once. {@link #clear()} publishes a bare frame at
 * position {@code -1}, which tells tails that positions start again from zero.
 *
 * <p>Messages are always encoded: {@link #compressMessages()} is {@code true} regardless of
 * the flag the handle was requested with.
 *
 * <p>The cancellation signal belongs to this handle. Other processes learn about a cancel
 * from the {@code __stream_cancel__} entry, which their live tails turn into a local cancel.
 */
public final class SharedStreamQueue implements StreamQueue {
    private static final Logger logger = Logger.getLogger(SharedStreamQueue.class.getName());

    private static final int POSITION_BYTES = Long.BYTES;
    private static final long RESET_POSITION = -1L;

    private final SharedStore store;
    private final KeyNames keyNames;
    private final String id;
    private final Duration ttl;
    private final MessageCodec codec;
    private final Duration graceDelay;
    private final String queueKey;
    private final String channel;
    private final CancellationSignal cancelSignal = new CancellationSignal();

    SharedStreamQueue(SharedStore store, KeyNames keyNames, String id, Duration ttl,
                      MessageCodec codec, Duration graceDelay) {
        this.store = Objects.requireNonNull(store, "store");
        this.keyNames = Objects.requireNonNull(keyNames, "keyNames");
        this.id = Objects.requireNonNull(id, "id");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.graceDelay = Objects.requireNonNull(graceDelay, "graceDelay");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.queueKey = keyNames.queueKey(id);
        this.channel = keyNames.channelKey(id);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean compressMessages() {
        return true;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    String queueKey() {
        return queueKey;
    }

    String channel() {
        return channel;
    }

    @Override
    public void push(EventMessage message) {
        Objects.requireNonNull(message, "message");
        byte[] entry = codec.encode(message);
        long length = store.append(queueKey, entry);
        if (message.isCancel()) {
            cancelSignal.fire();
        }
        store.expire(queueKey, ttl);
        store.publish(channel, frame(length - 1, entry));
    }

    @Override
    public List<EventMessage> getAll() {
        return decodeAll(store.range(queueKey));
    }

    @Override
    public void clear() {
        store.delete(queueKey);
        store.publish(channel, frame(RESET_POSITION, new byte[0]));
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
    public SharedStreamQueue copyToQueue(String newId) {
        return copyToQueue(newId, ttl);
    }

    @Override
    public SharedStreamQueue copyToQueue(String newId, Duration ttl) {
        SharedStreamQueue copy = new SharedStreamQueue(store, keyNames, newId, ttl, codec, graceDelay);
        store.copy(queueKey, copy.queueKey);
        store.expire(copy.queueKey, ttl);
        return copy;
    }

    @Override
    public LiveTail onDataReceive() {
        LiveTail tail = new LiveTail(id, cancelSignal, graceDelay, this::cancel);
        if (cancelSignal.isCancelled()) {
            tail.close();
            return tail;
        }
        TailGate gate = new TailGate(tail);
        try {
            Subscription subscription = store.subscribe(channel, gate::onFrame);
            tail.onClose(subscription::close);
            List<byte[]> backlog = store.range(queueKey);
            if (tail.replay(decodeAll(backlog))) {
                gate.open(backlog.size());
            }
        } catch (RuntimeException e) {
            tail.close();
            throw e;
        }
        return tail;
    }

    private List<EventMessage> decodeAll(List<byte[]> entries) {
        List<EventMessage> result = new ArrayList<>(entries.size());
        for (byte[] entry : entries) {
            result.add(codec.decode(entry));
        }
        return result;
    }

    static byte[] frame(long position, byte[] entry) {
        return ByteBuffer.allocate(POSITION_BYTES + entry.length)
                .putLong(position)
                .put(entry)
                .array();
    }

    /**
     * Holds frames back until the backlog has been replayed, then forwards them to the tail.
     * Frames whose position lies inside the backlog are dropped, however late they arrive,
     * until a reset frame announces that the list was cleared.
     */
    private final class TailGate {
        private final LiveTail tail;
        private final List<byte[]> pending = new ArrayList<>();
        private boolean open;
        private long backlogSize;

        private TailGate(LiveTail tail) {
            this.tail = tail;
        }

        synchronized void open(long backlogSize) {
            this.backlogSize = backlogSize;
            this.open = true;
            for (byte[] frame : pending) {
                forward(frame);
            }
            pending.clear();
        }

        synchronized void onFrame(byte[] frame) {
            if (!open) {
                pending.add(frame);
                return;
            }
            forward(frame);
        }

        private void forward(byte[] frame) {
            if (frame.length < POSITION_BYTES) {
                tail.fail(new CorruptMessageException(
                        "Truncated notification frame on channel " + channel));
                return;
            }
            long position = ByteBuffer.wrap(frame).getLong();
            if (position == RESET_POSITION) {
                backlogSize = 0;
                return;
            }
            if (position < backlogSize) {
                logger.log(Level.FINEST, "Dropping replayed frame {0} of queue {1}",
                        new Object[]{position, id});
                return;
            }
            EventMessage message;
            try {
                message = codec.decode(Arrays.copyOfRange(frame, POSITION_BYTES, frame.length));
            } catch (CorruptMessageException e) {
                tail.fail(e);
                return;
            }
            tail.accept(message);
        }
    }
}
