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

public enum FailureReason {
    /** The peer hello did not arrive before the deadline. */
    TIMEOUT,
    /** The peer sent something that is not a well-formed hello. */
    MALFORMED_MESSAGE,
    /** The peer hello is well-formed but incompatible: wrong protocol, algorithm, role or peer identity. */
    PROTOCOL_MISMATCH,
    /** The peer public key was rejected by the key agreement. */
    KEY_AGREEMENT,
    /** The local hello could not be sent. */
    TRANSPORT,
    /** The waiting thread was interrupted. */
    CANCELLED
}
