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

import java.util.Arrays;
import java.util.Locale;

import javax.crypto.SecretKey;

import software.pando.crypto.nacl.Bytes;

/**
 * A drop-in replacement for {@link javax.crypto.spec.SecretKeySpec} where the {@link #destroy()} method actually
 * works: it scrubs the key material from memory. Session AEAD keys and HKDF intermediate keys are held in this form
 * so that a channel can wipe them on close.
 */
public final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private volatile boolean destroyed = false;

    private final String algorithm;
    private final byte[] keyBytes;

    /**
     * Copies the key bytes. The caller remains responsible for wiping its own array.
     */
    public DestroyableSecretKey(byte[] key, String algorithm) {
        this.keyBytes = requireNonNull(key, "key").clone();
        this.algorithm = requireNonNull(algorithm, "algorithm");
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyBytes.clone();
    }

    /**
     * The length of the key in bytes. Available even after the key has been destroyed.
     */
    public int length() {
        return keyBytes.length;
    }

    @Override
    public void destroy() {
        this.destroyed = true;
        Arrays.fill(keyBytes, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof DestroyableSecretKey that)) { return false; }
        checkDestroyed();
        that.checkDestroyed();
        return algorithm.equalsIgnoreCase(that.algorithm) && Bytes.equal(keyBytes, that.keyBytes);
    }

    @Override
    public int hashCode() {
        // Must not leak key material, so only the algorithm and length contribute
        return 31 * algorithm.toLowerCase(Locale.ROOT).hashCode() + keyBytes.length;
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", bits=" + keyBytes.length * 8 +
                ", destroyed=" + destroyed +
                '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }
}
