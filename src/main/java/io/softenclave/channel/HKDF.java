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

import static io.softenclave.channel.Crypto.HMAC_TAG_SIZE_BYTES;
import static io.softenclave.channel.Crypto.hmac;
import static io.softenclave.channel.Crypto.hmacKey;

import java.security.Key;

/**
 * HKDF with HMAC-SHA-256, as specified in <a href="https://datatracker.ietf.org/doc/html/rfc5869">RFC 5869</a>.
 */
final class HKDF {

    /**
     * The HKDF-Extract step. Neither argument is modified.
     *
     * @return the pseudorandom key, which the caller must destroy after use.
     */
    static DestroyableSecretKey extract(byte[] salt, byte[] inputKeyMaterial) {
        try (var saltKey = hmacKey(salt.clone())) {
            return hmacKey(hmac(saltKey, inputKeyMaterial));
        }
    }

    static byte[] expand(Key prk, byte[] info, int outputKeySizeBytes) {
        if (outputKeySizeBytes <= 0 || outputKeySizeBytes > 255 * HMAC_TAG_SIZE_BYTES) {
            throw new IllegalArgumentException("Output size must be >= 1 and <= " + 255 * HMAC_TAG_SIZE_BYTES);
        }
        byte[] last = new byte[0];
        byte[] counter = new byte[1];
        byte[] output = new byte[outputKeySizeBytes];
        for (int i = 0; i < outputKeySizeBytes; i += HMAC_TAG_SIZE_BYTES) {
            counter[0]++;
            var block = hmac(prk, last, info, counter);
            Utils.wipe(last);
            last = block;
            System.arraycopy(last, 0, output, i, Math.min(outputKeySizeBytes - i, HMAC_TAG_SIZE_BYTES));
        }
        Utils.wipe(last);
        return output;
    }

    private HKDF() {}
}
