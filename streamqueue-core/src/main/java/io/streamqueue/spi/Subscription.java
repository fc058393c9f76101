package io.streamqueue.spi;

/**
 * Handle to an active notification subscription. Closing it stops further deliveries.
 *
 * <p>{@link #close()} must be idempotent and must not throw checked exceptions.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
