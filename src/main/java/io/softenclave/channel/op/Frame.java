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


package io.softenclave.channel.op;

import static java.util.Objects.requireNonNull;

import java.io.IOException;

import io.softenclave.channel.WireEnvelope;
import io.softenclave.channel.io.CborReader;
import io.softenclave.channel.io.CborWriter;

/**
 * What the operation layer puts on the transport: the CBOR array {@code [operation, nonce, ciphertext]}. The operation
 * name is sent in clear for routing; it is also the associated data of the envelope, so altering it makes the
 * envelope fail to open.
 */
public record Frame(Operation operation, WireEnvelope envelope) {

    public Frame {
        requireNonNull(operation, "operation");
        requireNonNull(envelope, "envelope");
    }

    public byte[] toBytes() {
        return CborWriter.encodeArray(operation.wireName(), envelope.nonce(), envelope.ciphertext());
    }

    public static Frame fromBytes(byte[] encoded) throws IOException {
        try (var array = CborReader.readSingleArray(encoded)) {
            var name = array.readString();
            var operation = Operation.fromWireName(name)
                    .orElseThrow(() -> new IOException("Unknown operation: " + name));
            var nonce = array.readFixedLengthBytes(12);
            var ciphertext = array.readBytes();
            if (ciphertext.length < 16) {
                throw new IOException("Ciphertext too short");
            }
            return new Frame(operation, new WireEnvelope(nonce, ciphertext));
        }
    }
}
