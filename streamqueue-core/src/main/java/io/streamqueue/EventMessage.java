package io.streamqueue;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable unit of data flowing through a {@link StreamQueue}.
 *
 * <p>The {@link #event() event} discriminant is opaque to the queue except for the three
 * reserved control values {@link #STREAM_END}, {@link #STREAM_ERROR} and {@link #STREAM_CANCEL}.
 * A control event bounds a {@link LiveTail}: once appended, no further payload events are
 * meaningful for that run.
 *
 * <p>The {@link #payload() payload} is any JSON-compatible value: {@code Map<String, ?>},
 * {@code List<?>}, {@link String}, {@link Number}, {@link Boolean} or {@code null}.
 *
 * @param event   the discriminant, never {@code null}
 * @param payload producer-defined data, may be {@code null}
 */
public record EventMessage(String event, Object payload) {

    /** Normal end of a run. */
    public static final String STREAM_END = "__stream_end__";

    /** A run ended with an error; the payload usually describes it. */
    public static final String STREAM_ERROR = "__stream_error__";

    /** A run was cancelled by one of its participants. */
    public static final String STREAM_CANCEL = "__stream_cancel__";

    private static final Set<String> CONTROL_EVENTS = Set.of(STREAM_END, STREAM_ERROR, STREAM_CANCEL);

    public EventMessage {
        Objects.requireNonNull(event, "event");
    }

    public static EventMessage of(String event, Object payload) {
        return new EventMessage(event, payload);
    }

    public static EventMessage end() {
        return new EventMessage(STREAM_END, null);
    }

    public static EventMessage error(Object payload) {
        return new EventMessage(STREAM_ERROR, payload);
    }

    /**
     * Creates the {@code __stream_cancel__} control message appended by {@link StreamQueue#cancel()}.
     *
     * @return a new cancel event
     */
    public static EventMessage cancel() {
        return new EventMessage(STREAM_CANCEL, "user cancel this run");
    }

    /**
     * Returns {@code true} for the reserved end, error and cancel discriminants.
     *
     * @return whether this message bounds a live tail
     */
    public boolean isControl() {
        return CONTROL_EVENTS.contains(event);
    }

    public boolean isCancel() {
        return STREAM_CANCEL.equals(event);
    }
}
