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

import java.security.GeneralSecurityException;

/**
 * Base class of all checked protocol errors. Each subclass reports a fixed {@link ErrorKind} so that callers can
 * handle failures without inspecting messages.
 */
public abstract class ChannelException extends GeneralSecurityException {
    private final ErrorKind kind;

    protected ChannelException(ErrorKind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind, "kind");
    }

    protected ChannelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
