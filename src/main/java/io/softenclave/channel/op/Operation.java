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

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of operations exchanged between host and enclave. Each operation has a versioned tag that is
 * authenticated as associated data, so a message sealed for one operation cannot be opened as another.
 */
public enum Operation {
    EXECUTE("execute"),
    EXECUTE_RESULT("execute-result"),
    SIGN_TRANSACTION("sign-transaction"),
    SIGN_RESULT("sign-result"),
    PING("ping"),
    PONG("pong"),
    GET_METRICS("get-metrics"),
    METRICS("metrics"),
    ERROR("error");

    public static final String PROTOCOL_VERSION = "v1";

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The associated data string, {@code soft-enclave/op=<name>/v1}.
     */
    public String aad() {
        return "soft-enclave/op=" + wireName + "/" + PROTOCOL_VERSION;
    }

    public boolean isRequest() {
        return switch (this) {
            case EXECUTE, SIGN_TRANSACTION, PING, GET_METRICS -> true;
            case EXECUTE_RESULT, SIGN_RESULT, PONG, METRICS, ERROR -> false;
        };
    }

    /**
     * The operation of a successful response to this request. Any request may instead be answered with
     * {@link #ERROR}.
     *
     * @throws IllegalStateException if this operation is not a request.
     */
    public Operation response() {
        return switch (this) {
            case EXECUTE -> EXECUTE_RESULT;
            case SIGN_TRANSACTION -> SIGN_RESULT;
            case PING -> PONG;
            case GET_METRICS -> METRICS;
            case EXECUTE_RESULT, SIGN_RESULT, PONG, METRICS, ERROR ->
                    throw new IllegalStateException(this + " is not a request");
        };
    }

    public static Optional<Operation> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(op -> op.wireName.equals(wireName)).findFirst();
    }
}
