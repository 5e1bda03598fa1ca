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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import org.testng.annotations.Test;

public class ChannelMetricsTest {

    @Test
    public void shouldTrackKeyLifetimeWithClock() {
        // Given
        var now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
        var clock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        var metrics = new ChannelMetrics(clock);

        // When
        now.set(now.get().plusSeconds(90));

        // Then
        assertThat(metrics.keyLifetime()).isEqualTo(Duration.ofSeconds(90));
        assertThat(metrics.snapshot().keyLifetime()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    public void shouldAccumulateSecretExposure() {
        var metrics = new ChannelMetrics(Clock.systemUTC());

        metrics.recordSecretExposure(Duration.ofMillis(3));
        metrics.recordSecretExposure(Duration.ofMillis(4));

        var snapshot = metrics.snapshot();
        assertThat(snapshot.secretExposures()).isEqualTo(2);
        assertThat(snapshot.totalSecretExposure()).isEqualTo(Duration.ofMillis(7));
        assertThatIllegalArgumentException().isThrownBy(() -> metrics.recordSecretExposure(Duration.ofMillis(-1)));
    }

    @Test
    public void shouldCountFailuresByKind() {
        var metrics = new ChannelMetrics(Clock.systemUTC());

        metrics.recordFailure(ErrorKind.REPLAY_DETECTED);
        metrics.recordFailure(ErrorKind.AUTHENTICATION);
        metrics.recordFailure(ErrorKind.AUTHENTICATION);
        metrics.recordFailure(ErrorKind.SEQUENCE_VIOLATION);
        metrics.recordFailure(ErrorKind.HANDSHAKE_FAILED);

        var snapshot = metrics.snapshot();
        assertThat(snapshot.replayRejections()).isEqualTo(1);
        assertThat(snapshot.authenticationFailures()).isEqualTo(2);
        assertThat(snapshot.sequenceViolations()).isEqualTo(1);
    }

    @Test
    public void snapshotShouldSurviveJson() throws Exception {
        var snapshot = new MetricsSnapshot(5, 4, 3, 2, 1, Duration.ofMillis(1234), 7, Duration.ofMillis(56));

        var json = snapshot.toJson();

        assertThat(json).contains("\"replayRejections\":3");
        assertThat(MetricsSnapshot.fromJson(json)).isEqualTo(snapshot);
    }
}
