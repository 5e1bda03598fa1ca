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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import io.softenclave.channel.MetricsSnapshot;

/**
 * The typed payload of each {@link Operation}.
 */
public sealed interface OperationMessage {

    Operation operation();

    /**
     * Runs code inside the enclave's sandbox.
     *
     * @param code the source code to evaluate.
     * @param contextJson a JSON document exposed to the code as its input.
     * @param timeout the maximum execution time.
     */
    record Execute(String code, String contextJson, Duration timeout) implements OperationMessage {
        public Execute {
            requireNonNull(code, "code");
            contextJson = contextJson == null ? "null" : contextJson;
            requireNonNull(timeout, "timeout");
        }

        @Override
        public Operation operation() {
            return Operation.EXECUTE;
        }
    }

    /**
     * @param resultJson the JSON-encoded result of the evaluation.
     * @param duration how long the evaluation took.
     * @param keyExposure how long any secret was held in plaintext, or zero.
     */
    record ExecuteResult(String resultJson, Duration duration, Duration keyExposure) implements OperationMessage {
        public ExecuteResult {
            requireNonNull(resultJson, "resultJson");
            requireNonNull(duration, "duration");
            keyExposure = keyExposure == null ? Duration.ZERO : keyExposure;
        }

        @Override
        public Operation operation() {
            return Operation.EXECUTE_RESULT;
        }
    }

    /**
     * @param encryptedKey the signing key, encrypted for the enclave.
     * @param transactionJson the transaction to sign.
     */
    record SignTransaction(byte[] encryptedKey, String transactionJson) implements OperationMessage {
        public SignTransaction {
            encryptedKey = requireNonNull(encryptedKey, "encryptedKey").clone();
            requireNonNull(transactionJson, "transactionJson");
        }

        @Override
        public byte[] encryptedKey() {
            return encryptedKey.clone();
        }

        @Override
        public Operation operation() {
            return Operation.SIGN_TRANSACTION;
        }
    }

    record SignResult(byte[] signature, Duration keyExposure) implements OperationMessage {
        public SignResult {
            signature = requireNonNull(signature, "signature").clone();
            keyExposure = keyExposure == null ? Duration.ZERO : keyExposure;
        }

        @Override
        public byte[] signature() {
            return signature.clone();
        }

        @Override
        public Operation operation() {
            return Operation.SIGN_RESULT;
        }
    }

    record Ping() implements OperationMessage {
        @Override
        public Operation operation() {
            return Operation.PING;
        }
    }

    record Pong() implements OperationMessage {
        @Override
        public Operation operation() {
            return Operation.PONG;
        }
    }

    record GetMetrics() implements OperationMessage {
        @Override
        public Operation operation() {
            return Operation.GET_METRICS;
        }
    }

    record Metrics(MetricsSnapshot snapshot) implements OperationMessage {
        public Metrics {
            requireNonNull(snapshot, "snapshot");
        }

        @Override
        public Operation operation() {
            return Operation.METRICS;
        }
    }

    /**
     * The enclave could not complete a request.
     */
    record Failure(String error) implements OperationMessage {
        public Failure {
            error = error == null ? "" : error;
        }

        @Override
        public Operation operation() {
            return Operation.ERROR;
        }
    }
}
