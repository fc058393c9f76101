package io.streamqueue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Live, single-pass, non-restartable view of a {@link StreamQueue}, returned by
 * {@link StreamQueue#onDataReceive()}.
 *
 * <p>Items delivered by the backend are buffered and handed out in arrival order.
 * {@link #hasNext()} blocks while the buffer is empty until one of the following happens:
 * <ul>
 *   <li>an item arrives;</li>
 *   <li>the queue's {@link CancellationSignal} fires, which ends the tail at once;</li>
 *   <li>the grace delay after a control event ({@code __stream_end__}, {@code __stream_error__},
 *       {@code __stream_cancel__}) elapses, which ends the tail once the buffer is drained;</li>
 *   <li>the consumer thread is interrupted, which closes the tail and keeps the interrupt flag.</li>
 * </ul>
 *
 * <p>A received {@code __stream_cancel__} also cancels the owning queue when its signal is not
 * yet set, so sibling tails observe the cancellation too.
 *
 * <p>Every exit path runs the release actions registered through {@link #onClose(Runnable)}
 * exactly once. Consumers that stop early must call {@link #close()}, typically through
 * try-with-resources:
 * <pre>{@code
 * try (LiveTail tail = queue.onDataReceive()) {
 *     while (tail.hasNext()) {
 *         send(tail.next());
 *     }
 * }
 * }</pre>
 *
 * <p>One thread consumes; any number of backend threads may call {@link #accept},
 * {@link #fail} and {@link #close()} concurrently.
 */
public final class LiveTail implements Iterator<EventMessage>, AutoCloseable {
    private static final Logger logger = Logger.getLogger(LiveTail.class.getName());

    private final String queueId;
    private final CancellationSignal signal;
    private final long graceNanos;
    private final Runnable cancelTrigger;
    private final Runnable wakeOnCancel = this::wake;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<EventMessage> buffer = new ArrayDeque<>();
    private final List<Runnable> releaseActions = new ArrayList<>();
    private final AtomicBoolean released = new AtomicBoolean();

    private boolean closed;
    private boolean ending;
    private long endDeadline;
    private RuntimeException failure;
    private EventMessage next;

    /**
     * Creates a tail bound to a queue's cancellation signal. Intended for {@link StreamQueue}
     * implementations; consumers obtain tails from {@link StreamQueue#onDataReceive()}.
     *
     * @param queueId       id of the owning queue, for diagnostics
     * @param signal        the owning queue's cancellation signal
     * @param graceDelay    how long to keep draining after a control event
     * @param cancelTrigger cancels the owning queue; run when a cancel event arrives first
     */
    public LiveTail(String queueId, CancellationSignal signal, Duration graceDelay, Runnable cancelTrigger) {
        this.queueId = Objects.requireNonNull(queueId, "queueId");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.cancelTrigger = Objects.requireNonNull(cancelTrigger, "cancelTrigger");
        Objects.requireNonNull(graceDelay, "graceDelay");
        if (graceDelay.isNegative()) {
            throw new IllegalArgumentException("graceDelay must be >= 0");
        }
        this.graceNanos = graceDelay.toNanos();
        signal.addListener(wakeOnCancel);
    }

    /**
     * Registers an action to run when the tail terminates, e.g. unsubscribing from the
     * backend. Runs immediately if the tail is already closed.
     *
     * @param action the release action
     */
    public void onClose(Runnable action) {
        Objects.requireNonNull(action, "action");
        lock.lock();
        try {
            if (!released.get()) {
                releaseActions.add(action);
                return;
            }
        } finally {
            lock.unlock();
        }
        runQuietly(action);
    }

    /**
     * Seeds the tail with entries already stored before it subscribed.
     *
     * <p>When the backlog already contains a control event the run is over: the tail closes
     * without yielding anything and, for a cancel event, raises the local cancellation signal
     * without publishing another marker.
     *
     * @param backlog stored entries, oldest first
     * @return {@code false} if the backlog ended the tail
     */
    public boolean replay(List<EventMessage> backlog) {
        boolean terminated = false;
        boolean cancelled = false;
        for (EventMessage message : backlog) {
            if (message.isControl()) {
                terminated = true;
                cancelled |= message.isCancel();
            }
        }
        if (terminated) {
            if (cancelled) {
                signal.fire();
            }
            logger.log(Level.FINE, "Queue {0} already terminated; live tail yields nothing", queueId);
            close();
            return false;
        }
        lock.lock();
        try {
            if (!closed) {
                buffer.addAll(backlog);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        return true;
    }

    /**
     * Delivers one item from the backend. Items arriving after the grace deadline are dropped.
     *
     * @param message the received item
     */
    public void accept(EventMessage message) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            if (closed || (ending && System.nanoTime() - endDeadline >= 0)) {
                return;
            }
            buffer.addLast(message);
            if (message.isControl() && !ending) {
                ending = true;
                endDeadline = System.nanoTime() + graceNanos;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (message.isCancel() && !signal.isCancelled()) {
            try {
                cancelTrigger.run();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to propagate cancel of queue " + queueId, e);
            }
        }
    }

    /**
     * Ends the tail with an error; the next {@link #hasNext()} call rethrows it.
     *
     * @param error the failure, typically a {@link CorruptMessageException}
     */
    public void fail(RuntimeException error) {
        Objects.requireNonNull(error, "error");
        lock.lock();
        try {
            if (!closed && failure == null) {
                failure = error;
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        boolean finished = false;
        RuntimeException thrown = null;
        lock.lock();
        try {
            while (true) {
                if (failure != null) {
                    thrown = failure;
                    failure = null;
                    break;
                }
                if (closed) {
                    return false;
                }
                if (signal.isCancelled()) {
                    finished = true;
                    break;
                }
                EventMessage item = buffer.pollFirst();
                if (item != null) {
                    next = item;
                    return true;
                }
                if (ending) {
                    long remaining = endDeadline - System.nanoTime();
                    if (remaining <= 0) {
                        finished = true;
                        break;
                    }
                    changed.awaitNanos(remaining);
                } else {
                    changed.await();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
        } finally {
            lock.unlock();
        }
        if (finished || thrown != null) {
            close();
        }
        if (thrown != null) {
            throw thrown;
        }
        return false;
    }

    @Override
    public EventMessage next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Live tail of queue " + queueId + " has ended");
        }
        EventMessage item = next;
        next = null;
        return item;
    }

    /**
     * Polls for the next item, waiting at most {@code timeout}.
     *
     * @param timeout maximum time to wait
     * @return the next item, or {@code null} if none arrived in time or the tail ended
     * @throws InterruptedException if interrupted while waiting
     */
    public EventMessage poll(Duration timeout) throws InterruptedException {
        if (next != null) {
            EventMessage item = next;
            next = null;
            return item;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean finished = false;
        RuntimeException thrown = null;
        lock.lockInterruptibly();
        try {
            while (true) {
                if (failure != null) {
                    thrown = failure;
                    failure = null;
                    break;
                }
                if (closed) {
                    return null;
                }
                if (signal.isCancelled()) {
                    finished = true;
                    break;
                }
                EventMessage item = buffer.pollFirst();
                if (item != null) {
                    return item;
                }
                long now = System.nanoTime();
                if (ending && endDeadline - now <= 0) {
                    finished = true;
                    break;
                }
                long remaining = deadline - now;
                if (remaining <= 0) {
                    return null;
                }
                if (ending) {
                    remaining = Math.min(remaining, endDeadline - now);
                }
                changed.await(remaining, TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
        if (finished || thrown != null) {
            close();
        }
        if (thrown != null) {
            throw thrown;
        }
        return null;
    }

    /**
     * Returns whether the tail has terminated.
     *
     * @return {@code true} once closed, cancelled or ended
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a sequential stream over the remaining items. Closing the stream closes the tail.
     *
     * @return an ordered stream view of this tail
     */
    public Stream<EventMessage> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(this::close);
    }

    /**
     * Stops the tail: wakes a waiting consumer, discards buffered items, and runs the
     * release actions. Idempotent.
     */
    @Override
    public void close() {
        List<Runnable> actions;
        lock.lock();
        try {
            closed = true;
            buffer.clear();
            changed.signalAll();
            if (!released.compareAndSet(false, true)) {
                return;
            }
            actions = new ArrayList<>(releaseActions);
            releaseActions.clear();
        } finally {
            lock.unlock();
        }
        signal.removeListener(wakeOnCancel);
        for (Runnable action : actions) {
            runQuietly(action);
        }
    }

    private void wake() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void runQuietly(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to release live tail of queue " + queueId, e);
        }
    }
}
