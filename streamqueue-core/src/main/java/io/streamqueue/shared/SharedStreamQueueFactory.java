package io.streamqueue.shared;

import io.streamqueue.StreamQueueFactory;
import io.streamqueue.spi.SharedStore;
import io.streamqueue.util.MessageCodec;

import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link SharedStreamQueue} handles on a {@link SharedStore}. A run that another
 * process created is reported by {@link #exists} until its list is deleted or expires.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SharedStreamQueueFactory implements StreamQueueFactory<SharedStreamQueue> {
    private final SharedStore store;
    private final KeyNames keyNames;
    private final MessageCodec codec;
    private final Duration graceDelay;

    private SharedStreamQueueFactory(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.keyNames = builder.keyNames != null ? builder.keyNames : KeyNames.DEFAULT;
        this.codec = builder.codec != null ? builder.codec : MessageCodec.getDefault();
        this.graceDelay = builder.graceDelay != null ? builder.graceDelay : Duration.ofMillis(300);
        if (graceDelay.isNegative()) {
            throw new IllegalArgumentException("graceDelay must be >= 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public SharedStreamQueue create(String id, boolean compressMessages, Duration ttl) {
        return new SharedStreamQueue(store, keyNames, id, ttl, codec, graceDelay);
    }

    @Override
    public boolean exists(String id) {
        return store.exists(keyNames.queueKey(id));
    }

    /** Builder for {@link SharedStreamQueueFactory}. */
    public static final class Builder {
        private SharedStore store;
        private KeyNames keyNames;
        private MessageCodec codec;
        private Duration graceDelay;

        private Builder() {
        }

        /**
         * Sets the store holding queue lists and notification channels.
         *
         * <p><b>Required.</b>
         *
         * @param store the shared store
         * @return this builder
         */
        public Builder store(SharedStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the key naming scheme. Defaults to {@link KeyNames#DEFAULT}.
         *
         * @param keyNames the key names
         * @return this builder
         */
        public Builder keyNames(KeyNames keyNames) {
            this.keyNames = keyNames;
            return this;
        }

        /**
         * Sets the message codec. Defaults to {@link MessageCodec#getDefault()}.
         *
         * @param codec the codec
         * @return this builder
         */
        public Builder codec(MessageCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets how long live tails keep draining after a control event. Defaults to 300 ms.
         *
         * @param graceDelay the grace delay
         * @return this builder
         */
        public Builder graceDelay(Duration graceDelay) {
            this.graceDelay = graceDelay;
            return this;
        }

        public SharedStreamQueueFactory build() {
            return new SharedStreamQueueFactory(this);
        }
    }
}
