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

import static io.softenclave.channel.Crypto.AEAD_KEY_SIZE_BYTES;
import static io.softenclave.channel.Crypto.NONCE_SIZE_BYTES;
import static java.util.Objects.requireNonNull;

import javax.security.auth.Destroyable;

import software.pando.crypto.nacl.Bytes;

/**
 * The symmetric material of one session: the AES-256-GCM key and the 12-byte base IV. The key never leaves this
 * package; only a {@link Channel} can use it.
 */
public final class SessionKeys implements Destroyable, AutoCloseable {
    private final DestroyableSecretKey aeadKey;
    private final byte[] baseIV;

    SessionKeys(DestroyableSecretKey aeadKey, byte[] baseIV) {
        this.aeadKey = requireNonNull(aeadKey, "aeadKey");
        Require.require(aeadKey.length() == AEAD_KEY_SIZE_BYTES, "AEAD key must be 256 bits");
        this.baseIV = Require.length(baseIV, NONCE_SIZE_BYTES, "Base IV must be 12 bytes").clone();
    }

    DestroyableSecretKey aeadKey() {
        return aeadKey;
    }

    byte[] baseIV() {
        return baseIV.clone();
    }

    /**
     * Compares the key material of two sessions in constant time. Intended for tests and diagnostics.
     */
    public boolean sameKeysAs(SessionKeys other) {
        return aeadKey.equals(other.aeadKey) && Bytes.equal(baseIV, other.baseIV);
    }

    @Override
    public void destroy() {
        aeadKey.destroy();
        Utils.wipe(baseIV);
    }

    @Override
    public boolean isDestroyed() {
        return aeadKey.isDestroyed();
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "SessionKeys{destroyed=" + isDestroyed() + "}";
    }
}
