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

import java.security.PrivateKey;

import javax.security.auth.Destroyable;

/**
 * A freshly generated key agreement key pair. A new pair is generated for every handshake attempt and destroyed once
 * the session keys have been derived. Destruction is best effort, as some JCA providers do not support destroying
 * private keys.
 */
public final class EphemeralKeyPair implements Destroyable, AutoCloseable {
    private final KeyAgreementAlgorithm algorithm;
    private final byte[] publicKey;
    private volatile PrivateKey privateKey;

    EphemeralKeyPair(KeyAgreementAlgorithm algorithm, PrivateKey privateKey, byte[] publicKey) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.privateKey = requireNonNull(privateKey, "privateKey");
        this.publicKey = requireNonNull(publicKey, "publicKey").clone();
    }

    public KeyAgreementAlgorithm algorithm() {
        return algorithm;
    }

    /**
     * The raw encoded public key, safe to send to the peer.
     */
    public byte[] publicKey() {
        return publicKey.clone();
    }

    PrivateKey privateKey() {
        var key = privateKey;
        if (key == null) {
            throw new IllegalStateException("Key pair has been destroyed");
        }
        return key;
    }

    @Override
    public void destroy() {
        var key = privateKey;
        privateKey = null;
        Utils.destroy(key);
    }

    @Override
    public boolean isDestroyed() {
        return privateKey == null;
    }

    @Override
    public void close() {
        destroy();
    }
}
