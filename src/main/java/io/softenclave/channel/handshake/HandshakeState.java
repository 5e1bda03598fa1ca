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

/**
 * States of the {@link HandshakeOrchestrator}. Every run moves forward through these states in declaration order,
 * ending in either {@link #READY} or {@link #FAILED}.
 */
public enum HandshakeState {
    IDLE,
    KEYS_GENERATED,
    LOCAL_ANNOUNCED,
    PEER_KEY_RECEIVED,
    SESSION_DERIVED,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
