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
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters describing the health of one channel. All methods are thread-safe.
 */
public final class ChannelMetrics {
    private final Clock clock;
    private final Instant keysEstablishedAt;

    private final LongAdder sealed = new LongAdder();
    private final LongAdder opened = new LongAdder();
    private final LongAdder replayRejections = new LongAdder();
    private final LongAdder sequenceViolations = new LongAdder();
    private final LongAdder authenticationFailures = new LongAdder();
    private final LongAdder secretExposures = new LongAdder();
    private final LongAdder secretExposureNanos = new LongAdder();

    ChannelMetrics(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        this.keysEstablishedAt = clock.instant();
    }

    void recordSealed() {
        sealed.increment();
    }

    void recordOpened() {
        opened.increment();
    }

    void recordFailure(ErrorKind kind) {
        switch (kind) {
            case REPLAY_DETECTED -> replayRejections.increment();
            case SEQUENCE_VIOLATION -> sequenceViolations.increment();
            case AUTHENTICATION -> authenticationFailures.increment();
            default -> { }
        }
    }

    /**
     * Records how long a long-term secret (such as a signing key) was held in plaintext while serving a request.
     */
    public void recordSecretExposure(Duration exposure) {
        requireNonNull(exposure, "exposure");
        Require.require(!exposure.isNegative(), "Exposure must not be negative");
        secretExposures.increment();
        secretExposureNanos.add(exposure.toNanos());
    }

    /**
     * How long the current session keys have been in use.
     */
    public Duration keyLifetime() {
        return Duration.between(keysEstablishedAt, clock.instant());
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(sealed.sum(), opened.sum(), replayRejections.sum(), sequenceViolations.sum(),
                authenticationFailures.sum(), keyLifetime(), secretExposures.sum(),
                Duration.ofNanos(secretExposureNanos.sum()));
    }
}
