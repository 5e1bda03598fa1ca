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

import static io.softenclave.channel.Crypto.AEAD_TAG_SIZE_BYTES;
import static io.softenclave.channel.Crypto.NONCE_SIZE_BYTES;

import java.io.IOException;
import java.util.Arrays;

import io.softenclave.channel.io.CborReader;
import io.softenclave.channel.io.CborWriter;
import software.pando.crypto.nacl.Bytes;

/**
 * A sealed message as it crosses the transport: the 12-byte nonce and the AES-GCM ciphertext with its 16-byte tag
 * appended. Nothing else is ever sent.
 */
public final class WireEnvelope {
    private final byte[] nonce;
    private final byte[] ciphertext;

    public WireEnvelope(byte[] nonce, byte[] ciphertext) {
        this.nonce = Require.length(nonce, NONCE_SIZE_BYTES, "Nonce must be " + NONCE_SIZE_BYTES + " bytes").clone();
        Require.require(ciphertext != null && ciphertext.length >= AEAD_TAG_SIZE_BYTES,
                "Ciphertext must include the authentication tag");
        this.ciphertext = ciphertext.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    /**
     * Encodes the envelope as the CBOR array {@code [nonce, ciphertext]}.
     */
    public byte[] toBytes() {
        return CborWriter.encodeArray(nonce, ciphertext);
    }

    public static WireEnvelope fromBytes(byte[] encoded) throws IOException {
        try (var array = CborReader.readSingleArray(encoded)) {
            var nonce = array.readFixedLengthBytes(NONCE_SIZE_BYTES);
            var ciphertext = array.readBytes();
            return fromParts(nonce, ciphertext);
        }
    }

    /**
     * Encodes the envelope as {@code base64url(nonce) "." base64url(ciphertext)} for text-only transports.
     */
    public String toText() {
        return Base64url.encode(nonce) + "." + Base64url.encode(ciphertext);
    }

    public static WireEnvelope fromText(String text) throws IOException {
        var dot = text.indexOf('.');
        if (dot < 0 || text.indexOf('.', dot + 1) >= 0) {
            throw new IOException("Envelope must have exactly two parts");
        }
        try {
            var nonce = Base64url.decode(text.substring(0, dot));
            var ciphertext = Base64url.decode(text.substring(dot + 1));
            if (nonce.length != NONCE_SIZE_BYTES) {
                throw new IOException("Invalid nonce length: " + nonce.length);
            }
            return fromParts(nonce, ciphertext);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid base64url in envelope", e);
        }
    }

    static WireEnvelope fromParts(byte[] nonce, byte[] ciphertext) throws IOException {
        if (ciphertext.length < AEAD_TAG_SIZE_BYTES) {
            throw new IOException("Ciphertext too short");
        }
        return new WireEnvelope(nonce, ciphertext);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof WireEnvelope that)) { return false; }
        return Arrays.equals(nonce, that.nonce) && Bytes.equal(ciphertext, that.ciphertext);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nonce) + Arrays.hashCode(ciphertext);
    }

    @Override
    public String toString() {
        return "WireEnvelope{nonce=" + Utils.hex(nonce) + ", ciphertextLength=" + ciphertext.length + '}';
    }
}
