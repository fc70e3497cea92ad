package com.questrail.push.protocol.binary.config;

import com.questrail.push.protocol.binary.codec.PushWireFormat;

import java.util.Objects;

/**
 * Aggregated configuration for a single push connection.
 *
 * @param replayBufferCapacity number of most recent submissions retained for
 *                             loss reconstruction
 * @param maxFrameSize         upper bound of a written frame, header included
 * @param maxPayloadSize       upper bound of a marshaled notification body
 * @param timingPolicy         flush timing
 */
public record PushConnectionConfig(
        int replayBufferCapacity,
        int maxFrameSize,
        int maxPayloadSize,
        PushTimingPolicy timingPolicy
) {
    public static final int DEFAULT_REPLAY_BUFFER_CAPACITY = 10_000;

    public PushConnectionConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (replayBufferCapacity < 1) {
            throw new IllegalArgumentException("replayBufferCapacity must be at least 1");
        }
        if (maxPayloadSize < 1) {
            throw new IllegalArgumentException("maxPayloadSize must be at least 1");
        }
        if (PushWireFormat.itemLength(maxPayloadSize) > 0xFFFF) {
            throw new IllegalArgumentException("maxPayloadSize " + maxPayloadSize
                    + " exceeds the two-byte item length field");
        }
        int smallestFrame = PushWireFormat.FRAME_HEADER_LENGTH
                + PushWireFormat.ITEM_PREFIX_LENGTH
                + PushWireFormat.itemLength(maxPayloadSize);
        if (maxFrameSize < smallestFrame) {
            throw new IllegalArgumentException("maxFrameSize " + maxFrameSize
                    + " cannot hold an item with a " + maxPayloadSize + " byte payload (needs "
                    + smallestFrame + ")");
        }
    }

    public static PushConnectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int replayBufferCapacity = DEFAULT_REPLAY_BUFFER_CAPACITY;
        private int maxFrameSize = PushWireFormat.DEFAULT_MAX_FRAME_SIZE;
        private int maxPayloadSize = PushWireFormat.DEFAULT_MAX_PAYLOAD_SIZE;
        private PushTimingPolicy timingPolicy = PushTimingPolicy.defaults();

        public Builder withReplayBufferCapacity(int capacity) {
            this.replayBufferCapacity = capacity;
            return this;
        }

        public Builder withMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder withMaxPayloadSize(int maxPayloadSize) {
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        public Builder withTimingPolicy(PushTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public PushConnectionConfig build() {
            return new PushConnectionConfig(replayBufferCapacity, maxFrameSize, maxPayloadSize, timingPolicy);
        }
    }
}
