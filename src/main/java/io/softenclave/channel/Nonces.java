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

import static io.softenclave.channel.Crypto.NONCE_SIZE_BYTES;

/**
 * Derives per-message AES-GCM nonces from a session base IV and a message sequence number.
 */
public final class Nonces {
    /**
     * The largest sequence number that can be encoded into a nonce.
     */
    public static final long MAX_SEQUENCE = 0xFFFF_FFFFL;

    /**
     * Derives the nonce for the given sequence number by XORing it, as a big-endian 32-bit integer, into the last four
     * bytes of the base IV. The base IV is not modified.
     *
     * @param baseIV the 12-byte base IV.
     * @param sequence the sequence number, in the range {@code [1, 2^32 - 1]}.
     * @return the derived 12-byte nonce.
     * @throws InvalidSequenceException if the sequence is out of range.
     * @throws IllegalArgumentException if the base IV is not 12 bytes long.
     */
    public static byte[] fromSequence(byte[] baseIV, long sequence) {
        Require.length(baseIV, NONCE_SIZE_BYTES, "Base IV must be " + NONCE_SIZE_BYTES + " bytes");
        if (sequence < 1 || sequence > MAX_SEQUENCE) {
            throw new InvalidSequenceException(sequence);
        }
        var nonce = baseIV.clone();
        nonce[8] ^= (byte) (sequence >>> 24);
        nonce[9] ^= (byte) (sequence >>> 16);
        nonce[10] ^= (byte) (sequence >>> 8);
        nonce[11] ^= (byte) sequence;
        return nonce;
    }

    /**
     * Returns the base IV used by messages sent from the given role. The responder's IV differs from the initiator's
     * in the top bit of the first byte, which the sequence XOR never touches.
     */
    static byte[] directionalIV(byte[] baseIV, Role sender) {
        var iv = baseIV.clone();
        if (sender == Role.RESPONDER) {
            iv[0] ^= (byte) 0x80;
        }
        return iv;
    }

    private Nonces() {}
}
