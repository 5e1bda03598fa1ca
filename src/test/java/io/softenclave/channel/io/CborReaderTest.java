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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;

import org.testng.annotations.Test;

public class CborReaderTest {

    @Test
    public void shouldReadArrayItemsInOrder() throws Exception {
        var encoded = CborWriter.encodeArray("ping", 4294967295L, new byte[] { 1, 2 });

        try (var array = CborReader.readSingleArray(encoded)) {
            assertThat(array.size()).isEqualTo(3);
            assertThat(array.readString()).isEqualTo("ping");
            assertThat(array.readUnsigned()).isEqualTo(4294967295L);
            assertThat(array.readBytes()).containsExactly(1, 2);
        }
    }

    @Test
    public void shouldReadTopLevelItems() throws Exception {
        var out = new ByteArrayOutputStream();
        try (var writer = new CborWriter(out)) {
            writer.writeString("a").writeUnsigned(7).writeBytes(new byte[3]);
        }

        try (var reader = new CborReader(new ByteArrayInputStream(out.toByteArray()))) {
            assertThat(reader.readString()).isEqualTo("a");
            assertThat(reader.readUnsigned()).isEqualTo(7);
            assertThat(reader.readBytes()).hasSize(3);
            reader.requireEndOfInput();
            assertThatIOException().isThrownBy(reader::readBytes).isInstanceOf(EOFException.class);
        }
    }

    @Test
    public void shouldRejectUnreadArrayItems() throws Exception {
        var array = CborReader.readSingleArray(CborWriter.encodeArray("a", "b"));
        array.readString();

        assertThatIOException().isThrownBy(array::close).withMessageContaining("Extra items");
    }

    @Test
    public void shouldRejectWrongItemType() throws Exception {
        var array = CborReader.readSingleArray(CborWriter.encodeArray("a"));

        assertThatIOException().isThrownBy(array::readBytes).withMessageContaining("UnicodeString");
    }

    @Test
    public void shouldRejectReadingPastEndOfArray() throws Exception {
        var array = CborReader.readSingleArray(CborWriter.encodeArray());

        assertThatIOException().isThrownBy(array::readString).isInstanceOf(EOFException.class);
    }

    @Test
    public void shouldRejectNonArrayInput() throws Exception {
        var out = new ByteArrayOutputStream();
        new CborWriter(out).writeString("not an array");

        assertThatIOException().isThrownBy(() -> CborReader.readSingleArray(out.toByteArray()));
    }

    @Test
    public void shouldRejectUnsupportedArrayItems() {
        assertThatIllegalArgumentException().isThrownBy(() -> CborWriter.encodeArray(1.5d));
        assertThatIllegalArgumentException().isThrownBy(() -> CborWriter.encodeArray(-1L));
    }
}
