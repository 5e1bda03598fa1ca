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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

/**
 * Byte-array helpers shared by the key agreement, derivation and channel code.
 */
final class Utils {
    private static final RedactedLogger logger = RedactedLogger.getLogger(Utils.class);
    private static final HexFormat HEX = HexFormat.of();

    static byte[] concat(byte[]... parts) {
        var buffer = ByteBuffer.allocate(Arrays.stream(parts).mapToInt(part -> part.length).reduce(0, Math::addExact));
        for (var part : parts) {
            buffer.put(part);
        }
        return buffer.array();
    }

    static void reverse(byte[] data) {
        for (int lo = 0, hi = data.length - 1; lo < hi; ++lo, --hi) {
            var b = data[lo];
            data[lo] = data[hi];
            data[hi] = b;
        }
    }

    /**
     * Left-pads the magnitude of a non-negative integer with zeroes to exactly {@code length} bytes.
     *
     * @throws IllegalArgumentException if the value is negative or needs more than {@code length} bytes.
     */
    static byte[] toUnsignedBigEndian(BigInteger value, int length) {
        if (value.signum() < 0 || value.bitLength() > length * 8) {
            throw new IllegalArgumentException("Value does not fit in " + length + " unsigned bytes");
        }
        var magnitude = value.toByteArray();
        // toByteArray() may add a leading sign byte, which bitLength() has already ruled out as significant
        int significant = Math.min(magnitude.length, length);
        var result = new byte[length];
        System.arraycopy(magnitude, magnitude.length - significant, result, length - significant, significant);
        return result;
    }

    static byte[] toUnsignedLittleEndian(BigInteger value, int length) {
        var bytes = toUnsignedBigEndian(value, length);
        reverse(bytes);
        return bytes;
    }

    static BigInteger fromUnsignedLittleEndian(byte[] littleEndian) {
        var bigEndian = littleEndian.clone();
        reverse(bigEndian);
        return new BigInteger(1, bigEndian);
    }

    static String hex(byte[] data) {
        return HEX.formatHex(data);
    }

    /**
     * Constant-time check that every byte is zero, used to reject degenerate key agreement outputs.
     */
    static boolean allZero(byte[] data) {
        int acc = 0;
        for (var b : data) {
            acc |= b & 0xFF;
        }
        return acc == 0;
    }

    /**
     * Overwrites key material, nonces and plaintext buffers with zeroes once they are no longer needed. Best effort
     * only: the garbage collector may already have copied the array. Null arrays are skipped.
     */
    static void wipe(byte[]... buffers) {
        for (var buffer : buffers) {
            if (buffer != null) {
                Arrays.fill(buffer, (byte) 0);
            }
        }
    }

    static void destroy(Destroyable... secrets) {
        for (var secret : secrets) {
            if (secret == null || secret.isDestroyed()) {
                continue;
            }
            try {
                secret.destroy();
            } catch (DestroyFailedException e) {
                // JDK EC and XDH private keys refuse to be destroyed; the caller drops its reference instead
                logger.trace("{} cannot be destroyed", secret.getClass().getSimpleName());
            }
        }
    }

    private Utils() {}
}
