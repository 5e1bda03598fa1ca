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

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Optional;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

/**
 * Stateless wrappers around the JCA primitives used by the channel: SHA-256, HMAC-SHA-256 and AES-256-GCM.
 */
final class Crypto {
    /** Shared source of randomness for ephemeral key generation. */
    static final SecureRandom SECURE_RANDOM = new SecureRandom();

    static final String HMAC_ALGORITHM = "HmacSHA256";
    static final String HASH_ALGORITHM = "SHA-256";
    static final String AEAD_ALGORITHM = "AES/GCM/NoPadding";
    static final int HMAC_TAG_SIZE_BYTES = 32;
    static final int AEAD_KEY_SIZE_BYTES = 32;
    static final int AEAD_TAG_SIZE_BYTES = 16;
    static final int NONCE_SIZE_BYTES = 12;

    static {
        try {
            Cipher.getInstance(AEAD_ALGORITHM);
            Mac.getInstance(HMAC_ALGORITHM);
            MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("All Java implementations must support AES/GCM, HmacSHA256 and SHA-256", e);
        }
    }

    static byte[] hmac(Key key, byte[]... data) {
        try {
            var hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(key);
            for (byte[] block : data) {
                hmac.update(block);
            }
            return hmac.doFinal();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Wraps the given bytes as an HMAC key. The input array is wiped after it has been copied into the key.
     */
    static DestroyableSecretKey hmacKey(byte[] keyData) {
        try {
            return new DestroyableSecretKey(keyData, HMAC_ALGORITHM);
        } finally {
            Utils.wipe(keyData);
        }
    }

    static byte[] sha256(byte[]... data) {
        try {
            var digest = MessageDigest.getInstance(HASH_ALGORITHM);
            for (byte[] block : data) {
                digest.update(block);
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Encrypts and authenticates the plaintext with AES-GCM, returning the ciphertext with the 16-byte tag appended.
     * A fresh {@link Cipher} is used for every call so that no cipher state is shared between channels.
     */
    static byte[] aeadSeal(SecretKey key, byte[] nonce, byte[] associatedData, byte[] plaintext) {
        try {
            var cipher = Cipher.getInstance(AEAD_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(AEAD_TAG_SIZE_BYTES * 8, nonce));
            cipher.updateAAD(associatedData);
            return cipher.doFinal(plaintext);
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Decrypts and verifies an AES-GCM ciphertext. Returns an empty result if authentication fails for any reason,
     * without revealing why.
     */
    static Optional<byte[]> aeadOpen(SecretKey key, byte[] nonce, byte[] associatedData, byte[] ciphertext) {
        if (ciphertext.length < AEAD_TAG_SIZE_BYTES) {
            return Optional.empty();
        }
        try {
            var cipher = Cipher.getInstance(AEAD_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(AEAD_TAG_SIZE_BYTES * 8, nonce));
            cipher.updateAAD(associatedData);
            return Optional.of(cipher.doFinal(ciphertext));
        } catch (AEADBadTagException e) {
            return Optional.empty();
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private Crypto() {}
}
