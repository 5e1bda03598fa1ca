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

import java.util.Base64;

/**
 * URL-safe Base64 without padding, used for public keys in handshake hellos and for the textual envelope form.
 */
public final class Base64url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    /**
     * Decodes URL-safe base64 data. Padding is accepted but not required.
     *
     * @throws IllegalArgumentException if the input contains characters outside the URL-safe alphabet.
     */
    public static byte[] decode(String encoded) {
        return DECODER.decode(encoded);
    }

    private Base64url() {}
}
