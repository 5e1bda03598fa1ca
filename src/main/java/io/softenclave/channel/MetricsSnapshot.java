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

import java.time.Duration;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * An immutable point-in-time copy of {@link ChannelMetrics}.
 */
public record MetricsSnapshot(long sealed, long opened, long replayRejections, long sequenceViolations,
        long authenticationFailures, Duration keyLifetime, long secretExposures, Duration totalSecretExposure) {

    public JsonObject toJsonObject() {
        return JsonObject.builder()
                .value("sealed", sealed)
                .value("opened", opened)
                .value("replayRejections", replayRejections)
                .value("sequenceViolations", sequenceViolations)
                .value("authenticationFailures", authenticationFailures)
                .value("keyLifetimeMs", keyLifetime.toMillis())
                .value("secretExposures", secretExposures)
                .value("totalSecretExposureMs", totalSecretExposure.toMillis())
                .done();
    }

    public String toJson() {
        return JsonWriter.string(toJsonObject());
    }

    public static MetricsSnapshot fromJson(JsonObject json) {
        return new MetricsSnapshot(
                json.getLong("sealed"),
                json.getLong("opened"),
                json.getLong("replayRejections"),
                json.getLong("sequenceViolations"),
                json.getLong("authenticationFailures"),
                Duration.ofMillis(json.getLong("keyLifetimeMs")),
                json.getLong("secretExposures"),
                Duration.ofMillis(json.getLong("totalSecretExposureMs")));
    }

    public static MetricsSnapshot fromJson(String json) throws JsonParserException {
        return fromJson(JsonParser.object().from(json));
    }
}
