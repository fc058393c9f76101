package io.streamqueue.shared;

import java.util.Objects;

/**
 * Derives store keys for shared queues: {@code <queuePrefix><id>} for the ordered list and
 * {@code <channelPrefix><id>} for the notification channel.
 */
public final class KeyNames {
    public static final String DEFAULT_QUEUE_PREFIX = "queue:";
    public static final String DEFAULT_CHANNEL_PREFIX = "channel:";
    public static final KeyNames DEFAULT = new KeyNames(DEFAULT_QUEUE_PREFIX, DEFAULT_CHANNEL_PREFIX);

    private static final String PREFIX_PATTERN = "[A-Za-z0-9_.:{}-]*";

    private final String queuePrefix;
    private final String channelPrefix;

    private KeyNames(String queuePrefix, String channelPrefix) {
        this.queuePrefix = queuePrefix;
        this.channelPrefix = channelPrefix;
    }

    public static KeyNames of(String queuePrefix, String channelPrefix) {
        return new KeyNames(validatePrefix(queuePrefix), validatePrefix(channelPrefix));
    }

    public static String validatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (!prefix.matches(PREFIX_PATTERN)) {
            throw new IllegalArgumentException("Invalid key prefix: " + prefix);
        }
        return prefix;
    }

    public String queueKey(String id) {
        return queuePrefix + requireId(id);
    }

    public String channelKey(String id) {
        return channelPrefix + requireId(id);
    }

    public String queuePrefix() {
        return queuePrefix;
    }

    public String channelPrefix() {
        return channelPrefix;
    }

    private static String requireId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Queue id must not be empty");
        }
        return id;
    }
}
