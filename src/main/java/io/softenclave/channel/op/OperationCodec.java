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


package io.softenclave.channel.op;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Duration;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.softenclave.channel.Base64url;
import io.softenclave.channel.MetricsSnapshot;
import io.softenclave.channel.op.OperationMessage.Execute;
import io.softenclave.channel.op.OperationMessage.ExecuteResult;
import io.softenclave.channel.op.OperationMessage.Failure;
import io.softenclave.channel.op.OperationMessage.GetMetrics;
import io.softenclave.channel.op.OperationMessage.Metrics;
import io.softenclave.channel.op.OperationMessage.Ping;
import io.softenclave.channel.op.OperationMessage.Pong;
import io.softenclave.channel.op.OperationMessage.SignResult;
import io.softenclave.channel.op.OperationMessage.SignTransaction;

/**
 * Encodes operation messages as the JSON bodies that are sealed inside a channel envelope. Every body carries the
 * operation name ({@code "op"}) and a correlation id ({@code "id"}) used to match responses to requests.
 */
public final class OperationCodec {

    /**
     * A decoded body.
     */
    public record Decoded(String correlationId, OperationMessage message) {}

    public static byte[] encode(String correlationId, OperationMessage message) {
        requireNonNull(correlationId, "correlationId");
        var json = JsonObject.builder()
                .value("op", message.operation().wireName())
                .value("id", correlationId);
        switch (message.operation()) {
            case EXECUTE -> {
                var execute = (Execute) message;
                json.value("code", execute.code())
                        .value("context", execute.contextJson())
                        .value("timeoutMs", execute.timeout().toMillis());
            }
            case EXECUTE_RESULT -> {
                var result = (ExecuteResult) message;
                json.value("result", result.resultJson())
                        .value("durationMs", result.duration().toMillis())
                        .value("keyExposureMs", result.keyExposure().toMillis());
            }
            case SIGN_TRANSACTION -> {
                var sign = (SignTransaction) message;
                json.value("key", Base64url.encode(sign.encryptedKey()))
                        .value("tx", sign.transactionJson());
            }
            case SIGN_RESULT -> {
                var result = (SignResult) message;
                json.value("sig", Base64url.encode(result.signature()))
                        .value("keyExposureMs", result.keyExposure().toMillis());
            }
            case METRICS -> json.value("metrics", ((Metrics) message).snapshot().toJsonObject());
            case ERROR -> json.value("error", ((Failure) message).error());
            case PING, PONG, GET_METRICS -> { }
        }
        return JsonWriter.string(json.done()).getBytes(UTF_8);
    }

    /**
     * Decodes a body that was authenticated under the given operation.
     *
     * @param expected the operation the enclosing envelope was opened under.
     * @param body the decrypted body.
     * @return the correlation id and message.
     * @throws IOException if the body is not valid JSON, names a different operation or lacks a required field.
     */
    public static Decoded decode(Operation expected, byte[] body) throws IOException {
        JsonObject json;
        try {
            json = JsonParser.object().from(new String(body, UTF_8));
        } catch (JsonParserException e) {
            throw new IOException("Operation body is not a JSON object", e);
        }
        var op = string(json, "op");
        if (!expected.wireName().equals(op)) {
            throw new IOException("Body names operation '" + op + "' but was sealed as " + expected.wireName());
        }
        var id = string(json, "id");
        OperationMessage message = switch (expected) {
            case EXECUTE -> new Execute(string(json, "code"), string(json, "context"),
                    Duration.ofMillis(number(json, "timeoutMs")));
            case EXECUTE_RESULT -> new ExecuteResult(string(json, "result"),
                    Duration.ofMillis(number(json, "durationMs")), Duration.ofMillis(number(json, "keyExposureMs")));
            case SIGN_TRANSACTION -> new SignTransaction(bytes(json, "key"), string(json, "tx"));
            case SIGN_RESULT -> new SignResult(bytes(json, "sig"), Duration.ofMillis(number(json, "keyExposureMs")));
            case PING -> new Ping();
            case PONG -> new Pong();
            case GET_METRICS -> new GetMetrics();
            case METRICS -> new Metrics(metrics(json));
            case ERROR -> new Failure(string(json, "error"));
        };
        return new Decoded(id, message);
    }

    private static String string(JsonObject json, String field) throws IOException {
        if (!json.isString(field)) {
            throw new IOException("Missing or invalid string field: " + field);
        }
        return json.getString(field);
    }

    private static long number(JsonObject json, String field) throws IOException {
        if (!json.isNumber(field)) {
            throw new IOException("Missing or invalid numeric field: " + field);
        }
        long value = json.getLong(field);
        if (value < 0) {
            throw new IOException("Negative value for field: " + field);
        }
        return value;
    }

    private static byte[] bytes(JsonObject json, String field) throws IOException {
        try {
            return Base64url.decode(string(json, field));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid base64url in field: " + field, e);
        }
    }

    private static MetricsSnapshot metrics(JsonObject json) throws IOException {
        if (!(json.get("metrics") instanceof JsonObject metrics)) {
            throw new IOException("Missing metrics object");
        }
        return MetricsSnapshot.fromJson(metrics);
    }

    private OperationCodec() {}
}
