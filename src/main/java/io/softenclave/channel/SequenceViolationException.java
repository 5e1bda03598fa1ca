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
 * Thrown when an authenticated message carries a sequence number the inbound policy does not accept, or carries no
 * valid sequence number at all.
 */
public final class SequenceViolationException extends ChannelException {
    private final long expected;
    private final long actual;

    public SequenceViolationException(long expected, long actual) {
        super(ErrorKind.SEQUENCE_VIOLATION, "Expected sequence " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public SequenceViolationException(String message) {
        super(ErrorKind.SEQUENCE_VIOLATION, message);
        this.expected = -1;
        this.actual = -1;
    }

    /**
     * The sequence number the policy expected next, or -1 if the message had no decodable sequence.
     */
    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
