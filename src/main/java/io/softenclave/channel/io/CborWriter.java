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


package io.softenclave.channel.io;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Writes the <a href="https://cbor.io">CBOR</a> items used on the wire: byte strings, text strings, unsigned integers
 * and flat definite-length arrays of those.
 */
public final class CborWriter implements Closeable {
    private final OutputStream out;
    private final CborEncoder encoder;

    public CborWriter(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
        this.encoder = new CborEncoder(out);
    }

    /**
     * Encodes a single array in memory.
     *
     * @param items each a {@code byte[]}, a {@code String} or a non-negative {@code Long} or {@code Integer}.
     * @return the encoded array.
     * @throws IllegalArgumentException if an item has any other type or is negative.
     */
    public static byte[] encodeArray(Object... items) {
        var buffer = new ByteArrayOutputStream();
        try {
            new CborWriter(buffer).writeArray(items);
        } catch (IOException e) {
            // ByteArrayOutputStream never throws
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    public CborWriter writeBytes(byte[] bytes) throws IOException {
        return write(new ByteString(bytes));
    }

    public CborWriter writeString(String string) throws IOException {
        return write(new UnicodeString(string));
    }

    public CborWriter writeUnsigned(long value) throws IOException {
        return write(unsigned(value));
    }

    /**
     * Writes a definite-length array. See {@link #encodeArray(Object...)} for the accepted item types.
     */
    public CborWriter writeArray(Object... items) throws IOException {
        var array = new Array();
        for (var item : items) {
            array.add(toDataItem(item));
        }
        return write(array);
    }

    @Override
    public void close() throws IOException {
        out.close();
    }

    private CborWriter write(DataItem item) throws IOException {
        try {
            encoder.encode(item);
        } catch (CborException e) {
            throw e.getCause() instanceof IOException io ? io : new IOException("CBOR encoding failed", e);
        }
        return this;
    }

    private static DataItem toDataItem(Object item) {
        if (item instanceof byte[] bytes) {
            return new ByteString(bytes);
        } else if (item instanceof String string) {
            return new UnicodeString(string);
        } else if (item instanceof Long || item instanceof Integer) {
            return unsigned(((Number) item).longValue());
        }
        throw new IllegalArgumentException("Unsupported array item: " +
                (item == null ? "null" : item.getClass().getSimpleName()));
    }

    private static UnsignedInteger unsigned(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Value must be non-negative: " + value);
        }
        return new UnsignedInteger(value);
    }
}
