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

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import co.nstant.in.cbor.CborDecoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Reads the <a href="https://cbor.io">CBOR</a> items that envelopes and frames are made of. Every structural problem
 * (wrong item type, missing or surplus items, trailing bytes, oversized integers) is reported as an
 * {@link IOException}, which callers treat as a malformed message.
 */
public final class CborReader implements Closeable {
    private static final BigInteger LONG_LIMIT = BigInteger.valueOf(Long.MAX_VALUE);

    private final InputStream in;
    private final CborDecoder decoder;

    public CborReader(InputStream in) {
        this.in = Objects.requireNonNull(in, "in");
        this.decoder = new CborDecoder(in);
    }

    /**
     * Decodes a message that must consist of exactly one CBOR array.
     *
     * @param encoded the complete message.
     * @return a reader over the array items.
     * @throws IOException if the message is not a single well-formed array.
     */
    public static ArrayReader readSingleArray(byte[] encoded) throws IOException {
        try (var reader = new CborReader(new ByteArrayInputStream(encoded))) {
            var array = reader.readArray();
            reader.requireEndOfInput();
            return array;
        }
    }

    public byte[] readBytes() throws IOException {
        return next(ByteString.class).getBytes();
    }

    public String readString() throws IOException {
        return next(UnicodeString.class).getString();
    }

    public long readUnsigned() throws IOException {
        return toLong(next(UnsignedInteger.class));
    }

    /**
     * Reads a whole array. Closing the returned reader checks that every item was consumed.
     */
    public ArrayReader readArray() throws IOException {
        return new ArrayReader(next(Array.class).getDataItems());
    }

    /**
     * @throws IOException if anything follows the items read so far.
     */
    public void requireEndOfInput() throws IOException {
        DataItem trailing;
        try {
            trailing = decoder.decodeNext();
        } catch (CborException e) {
            throw new IOException("Trailing bytes after CBOR item", e);
        }
        if (trailing != null) {
            throw new IOException("Trailing " + trailing.getMajorType() + " after CBOR item");
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private <T extends DataItem> T next(Class<T> type) throws IOException {
        DataItem item;
        try {
            item = decoder.decodeNext();
        } catch (CborException e) {
            throw e.getCause() instanceof IOException io ? io : new IOException("Malformed CBOR", e);
        }
        if (item == null) {
            throw new EOFException("Expected " + type.getSimpleName() + " but input ended");
        }
        return cast(item, type);
    }

    private static <T extends DataItem> T cast(DataItem item, Class<T> type) throws IOException {
        if (!type.isInstance(item)) {
            throw new IOException("Expected " + type.getSimpleName() + " but got " + item.getClass().getSimpleName());
        }
        return type.cast(item);
    }

    private static long toLong(UnsignedInteger item) throws IOException {
        var value = item.getValue();
        if (value.compareTo(LONG_LIMIT) > 0) {
            throw new IOException("Unsigned integer too large: " + value);
        }
        return value.longValue();
    }

    /**
     * Sequential access to the items of an already decoded array.
     */
    public static final class ArrayReader implements Closeable {
        private final List<DataItem> items;
        private int position;

        private ArrayReader(List<DataItem> items) {
            this.items = items;
        }

        /**
         * The number of items in the array, regardless of how many have been read.
         */
        public int size() {
            return items.size();
        }

        public byte[] readBytes() throws IOException {
            return next(ByteString.class).getBytes();
        }

        /**
         * @throws IOException if the next item is not a byte string of exactly {@code length} bytes.
         */
        public byte[] readFixedLengthBytes(int length) throws IOException {
            var bytes = readBytes();
            if (bytes.length != length) {
                throw new IOException("Expected " + length + " bytes but got " + bytes.length);
            }
            return bytes;
        }

        public String readString() throws IOException {
            return next(UnicodeString.class).getString();
        }

        public long readUnsigned() throws IOException {
            return toLong(next(UnsignedInteger.class));
        }

        /**
         * @throws IOException if any item was left unread.
         */
        @Override
        public void close() throws IOException {
            if (position < items.size()) {
                throw new IOException("Extra items in array: " + (items.size() - position) + " unread");
            }
        }

        private <T extends DataItem> T next(Class<T> type) throws IOException {
            if (position >= items.size()) {
                throw new EOFException("Expected " + type.getSimpleName() + " but array ended");
            }
            return cast(items.get(position++), type);
        }
    }
}
