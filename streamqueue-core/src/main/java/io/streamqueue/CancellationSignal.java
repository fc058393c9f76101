package io.streamqueue;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-fire broadcast flag: once {@link #fire()} is called, {@link #isCancelled()} stays
 * {@code true} forever and every registered listener runs exactly once.
 *
 * <p>Listeners added after the signal fired run immediately on the calling thread.
 * This class is thread-safe.
 */
public final class CancellationSignal {
    private static final Logger logger = Logger.getLogger(CancellationSignal.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Sets the signal and notifies listeners.
     *
     * @return {@code true} if this call set the signal, {@code false} if it was already set
     */
    public boolean fire() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                notify(listener);
            }
        }
        return true;
    }

    /**
     * Registers a listener to run when the signal fires.
     *
     * @param listener the callback
     */
    public void addListener(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            notify(listener);
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    private static void notify(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cancellation listener failed", e);
        }
    }
}
