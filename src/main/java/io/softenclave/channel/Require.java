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

/**
 * Utilities for checking preconditions.
 */
public final class Require {

    public static void require(boolean condition, String msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg);
        }
    }

    public static String notBlank(String item, String msg) {
        if (item == null || item.isBlank()) {
            throw new IllegalArgumentException(msg);
        }
        return item;
    }

    public static byte[] length(byte[] data, int expectedLength, String msg) {
        if (data == null || data.length != expectedLength) {
            throw new IllegalArgumentException(msg);
        }
        return data;
    }

    public static long between(long value, long lowerBound, long upperBound, String msg) {
        if (value < lowerBound || value > upperBound) {
            throw new IllegalArgumentException(msg);
        }
        return value;
    }

    private Require() {}
}
