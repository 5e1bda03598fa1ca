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


package io.softenclave.channel.handshake;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.softenclave.channel.Base64url;
import io.softenclave.channel.Role;

/**
 * The hello each side sends during the handshake. Encoded as a JSON object:
 * <pre>{@code
 * {"type":"hello","protocol":"soft-enclave/v1","role":"initiator","endpoint":"https://host.example",
 *  "code":"", "alg":"P-256","pub":"BCm..."}
 * }</pre>
 * The public key is URL-safe base64 without padding.
 */
public record HandshakeMessage(String protocol, Role role, String endpoint, String codeIdentity, String algorithm,
        byte[] publicKey) {
    static final String TYPE = "hello";

    public HandshakeMessage {
        requireNonNull(protocol, "protocol");
        requireNonNull(role, "role");
        requireNonNull(endpoint, "endpoint");
        codeIdentity = codeIdentity == null ? "" : codeIdentity;
        requireNonNull(algorithm, "algorithm");
        publicKey = requireNonNull(publicKey, "publicKey").clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    public byte[] toBytes() {
        return JsonWriter.string(JsonObject.builder()
                .value("type", TYPE)
                .value("protocol", protocol)
                .value("role", role.name().toLowerCase(Locale.ROOT))
                .value("endpoint", endpoint)
                .value("code", codeIdentity)
                .value("alg", algorithm)
                .value("pub", Base64url.encode(publicKey))
                .done()).getBytes(UTF_8);
    }

    /**
     * Parses a hello message.
     *
     * @throws HandshakeException with reason {@link FailureReason#MALFORMED_MESSAGE} if the message is not valid JSON
     * or any field is missing or has the wrong type.
     */
    public static HandshakeMessage parse(byte[] message) throws HandshakeException {
        JsonObject json;
        try {
            json = JsonParser.object().from(new String(message, UTF_8));
        } catch (JsonParserException e) {
            throw malformed("Hello is not a JSON object", e);
        }
        if (!TYPE.equals(requiredString(json, "type"))) {
            throw malformed("Not a hello message", null);
        }
        var role = switch (requiredString(json, "role")) {
            case "initiator" -> Role.INITIATOR;
            case "responder" -> Role.RESPONDER;
            default -> throw malformed("Unknown role", null);
        };
        byte[] publicKey;
        try {
            publicKey = Base64url.decode(requiredString(json, "pub"));
        } catch (IllegalArgumentException e) {
            throw malformed("Public key is not valid base64url", e);
        }
        return new HandshakeMessage(requiredString(json, "protocol"), role, requiredString(json, "endpoint"),
                requiredString(json, "code"), requiredString(json, "alg"), publicKey);
    }

    private static String requiredString(JsonObject json, String field) throws HandshakeException {
        if (!json.isString(field)) {
            throw malformed("Missing or invalid field: " + field, null);
        }
        return json.getString(field);
    }

    private static HandshakeException malformed(String message, Throwable cause) {
        return new HandshakeException(FailureReason.MALFORMED_MESSAGE, message, cause);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof HandshakeMessage that)) { return false; }
        return protocol.equals(that.protocol) && role == that.role && endpoint.equals(that.endpoint) &&
                codeIdentity.equals(that.codeIdentity) && algorithm.equals(that.algorithm) &&
                Arrays.equals(publicKey, that.publicKey);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(protocol, role, endpoint, codeIdentity, algorithm) +
                Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "HandshakeMessage{protocol='" + protocol + "', role=" + role + ", endpoint='" + endpoint +
                "', codeIdentity='" + codeIdentity + "', algorithm='" + algorithm + "'}";
    }
}
