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

/**
 * Thrown when a sequence number outside {@code [1, 2^32 - 1]} is used to derive a nonce. This always indicates a
 * programming error rather than a hostile peer.
 */
public final class InvalidSequenceException extends IllegalArgumentException {

    public InvalidSequenceException(long sequence) {
        super("Sequence number out of range: " + sequence);
    }

    public ErrorKind kind() {
        return ErrorKind.INVALID_SEQUENCE;
    }
}
