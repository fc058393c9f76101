package io.streamqueue;

/**
 * Thrown when stored or published bytes cannot be decoded into an {@link EventMessage}.
 *
 * <p>Entries are never skipped or replaced by a default value, since that would silently
 * break the completeness of the ordered log.
 */
public final class CorruptMessageException extends RuntimeException {

    public CorruptMessageException(String message) {
        super(message);
    }

    public CorruptMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
