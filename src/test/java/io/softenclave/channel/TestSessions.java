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

import java.security.SecureRandom;

/**
 * Builds matching host and enclave channels without running a handshake.
 */
public final class TestSessions {
    public static final SessionContext CONTEXT =
            new SessionContext("https://host.example", "https://enclave.example", "sha256-code");

    private static final SecureRandom RANDOM = new SecureRandom();

    public record Pair(Channel host, Channel enclave) {}

    public static Pair channels() throws KeyAgreementException {
        return channels(ChannelOptions.defaults());
    }

    public static Pair channels(ChannelOptions options) throws KeyAgreementException {
        return channels(CONTEXT, CONTEXT, options);
    }

    public static Pair channels(SessionContext hostContext, SessionContext enclaveContext, ChannelOptions options)
            throws KeyAgreementException {
        var deriver = SessionDeriver.standard();
        try (var hostKeys = KeyAgreementAlgorithm.P256.generate();
             var enclaveKeys = KeyAgreementAlgorithm.P256.generate()) {
            var hostSession = deriver.deriveSession(hostKeys, enclaveKeys.publicKey(), hostContext);
            var enclaveSession = deriver.deriveSession(enclaveKeys, hostKeys.publicKey(), enclaveContext);
            return new Pair(new Channel(hostSession, Role.INITIATOR, options),
                    new Channel(enclaveSession, Role.RESPONDER, options));
        }
    }

    public static byte[] randomBytes(int numBytes) {
        var bytes = new byte[numBytes];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    private TestSessions() {}
}
