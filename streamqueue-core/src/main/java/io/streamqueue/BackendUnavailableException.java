package io.streamqueue;

/**
 * Unchecked exception wrapping connectivity failures of a queue backend on push, read
 * or subscribe.
 *
 * <p>No retry happens inside the library; retry policy belongs to the caller.
 */
public final class BackendUnavailableException extends RuntimeException {
    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
