/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */


package io.softenclave.channel;

import static java.util.Objects.requireNonNull;

import java.time.Clock;

/**
 * Tunable per-channel settings. Use {@link #defaults()} or {@link #builder()}.
 */
public final class ChannelOptions {
    public static final long DEFAULT_RENEGOTIATION_MARGIN = 65536;

    private final int replayCacheCapacity;
    private final SequencePolicy sequencePolicy;
    private final long maxOutboundSequence;
    private final long renegotiationMargin;
    private final int maxConsecutiveFailures;
    private final Clock clock;

    private ChannelOptions(Builder builder) {
        this.replayCacheCapacity = builder.replayCacheCapacity;
        this.sequencePolicy = builder.sequencePolicy;
        this.maxOutboundSequence = builder.maxOutboundSequence;
        this.renegotiationMargin = builder.renegotiationMargin;
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.clock = builder.clock;
    }

    public static ChannelOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int replayCacheCapacity() {
        return replayCacheCapacity;
    }

    public SequencePolicy sequencePolicy() {
        return sequencePolicy;
    }

    public long maxOutboundSequence() {
        return maxOutboundSequence;
    }

    public long renegotiationMargin() {
        return renegotiationMargin;
    }

    /**
     * The number of consecutive inbound failures after which the channel closes itself, or 0 if it never does.
     */
    public int maxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public Clock clock() {
        return clock;
    }

    public static final class Builder {
        private int replayCacheCapacity = ReplayCache.DEFAULT_CAPACITY;
        private SequencePolicy sequencePolicy = SequencePolicy.strict();
        private long maxOutboundSequence = Nonces.MAX_SEQUENCE;
        private long renegotiationMargin = DEFAULT_RENEGOTIATION_MARGIN;
        private int maxConsecutiveFailures = 0;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder replayCacheCapacity(int capacity) {
            this.replayCacheCapacity = (int) Require.between(capacity, 1, Integer.MAX_VALUE,
                    "Replay cache capacity must be positive");
            return this;
        }

        public Builder sequencePolicy(SequencePolicy policy) {
            this.sequencePolicy = requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Caps the outbound sequence below the protocol maximum of {@code 2^32 - 1}.
         */
        public Builder maxOutboundSequence(long maxSequence) {
            this.maxOutboundSequence = Require.between(maxSequence, 1, Nonces.MAX_SEQUENCE,
                    "Maximum sequence must be in [1, 2^32 - 1]");
            return this;
        }

        public Builder renegotiationMargin(long margin) {
            this.renegotiationMargin = Require.between(margin, 0, Nonces.MAX_SEQUENCE,
                    "Renegotiation margin out of range");
            return this;
        }

        public Builder maxConsecutiveFailures(int maxFailures) {
            this.maxConsecutiveFailures = (int) Require.between(maxFailures, 0, Integer.MAX_VALUE,
                    "Maximum consecutive failures must not be negative");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = requireNonNull(clock, "clock");
            return this;
        }

        public ChannelOptions build() {
            return new ChannelOptions(this);
        }
    }
}
