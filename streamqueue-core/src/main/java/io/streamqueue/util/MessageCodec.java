package io.streamqueue.util;

import io.streamqueue.CorruptMessageException;
import io.streamqueue.EventMessage;

/**
 * Reversible binary codec for {@link EventMessage}s.
 *
 * <p>{@code decode(encode(m))} must equal {@code m} for every payload built from the canonical
 * types: {@code Map<String, Object>}, {@code List<Object>}, {@link String}, {@link Boolean},
 * {@link Integer}, {@link Long} outside the {@code int} range, {@link java.math.BigInteger}
 * outside the {@code long} range, {@link Double} and {@code null}. Other values are accepted
 * but come back as their canonical equivalent: {@code 5L} decodes as {@code Integer 5},
 * a {@link Float} or {@link java.math.BigDecimal} as a {@link Double}, any other
 * {@link java.util.Collection} as a {@link java.util.List}.
 * The default implementation ({@link JsonMessageCodec}) is a zero-dependency UTF-8 JSON
 * encoder. Users who already have Jackson, Gson, or another serializer on the classpath can
 * implement this interface and hand it to the queue factories.
 *
 * @see #getDefault()
 */
public interface MessageCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link MessageCodec}
     */
    static MessageCodec getDefault() {
        return JsonMessageCodec.INSTANCE;
    }

    /**
     * Encodes a message.
     *
     * @param message the message to encode
     * @return the encoded bytes, never {@code null}
     * @throws IllegalArgumentException if the payload holds a value that is not JSON-compatible
     */
    byte[] encode(EventMessage message);

    /**
     * Decodes bytes produced by {@link #encode}.
     *
     * @param bytes the encoded message
     * @return the decoded message
     * @throws CorruptMessageException if the bytes are not a valid encoded message
     */
    EventMessage decode(byte[] bytes);
}
