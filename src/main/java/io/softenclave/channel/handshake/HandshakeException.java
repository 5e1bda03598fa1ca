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

import static java.util.Objects.requireNonNull;

import io.softenclave.channel.ChannelException;
import io.softenclave.channel.ErrorKind;

/**
 * Thrown when a handshake fails. The handshake cannot be retried; build a new {@link HandshakeOrchestrator}, which
 * generates fresh ephemeral keys.
 */
public class HandshakeException extends ChannelException {
    private final FailureReason reason;

    public HandshakeException(FailureReason reason, String message) {
        this(ErrorKind.HANDSHAKE_FAILED, reason, message, null);
    }

    public HandshakeException(FailureReason reason, String message, Throwable cause) {
        this(ErrorKind.HANDSHAKE_FAILED, reason, message, cause);
    }

    protected HandshakeException(ErrorKind kind, FailureReason reason, String message, Throwable cause) {
        super(kind, message, cause);
        this.reason = requireNonNull(reason, "reason");
    }

    public FailureReason reason() {
        return reason;
    }
}
