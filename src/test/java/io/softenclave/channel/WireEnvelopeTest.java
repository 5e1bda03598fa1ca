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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import io.softenclave.channel.io.CborWriter;
import org.testng.annotations.Test;

public class WireEnvelopeTest {
    private final WireEnvelope envelope = new WireEnvelope(TestSessions.randomBytes(12), TestSessions.randomBytes(40));

    @Test
    public void shouldDecodeBinaryForm() throws Exception {
        assertThat(WireEnvelope.fromBytes(envelope.toBytes())).isEqualTo(envelope);
    }

    @Test
    public void shouldDecodeTextForm() throws Exception {
        var text = envelope.toText();

        assertThat(text).matches("[A-Za-z0-9_-]{16}\\.[A-Za-z0-9_-]+");
        assertThat(WireEnvelope.fromText(text)).isEqualTo(envelope);
    }

    @Test
    public void shouldRejectTrailingData() {
        var encoded = envelope.toBytes();
        var withTrailer = Utils.concat(encoded, new byte[] { 0x01 });

        assertThatIOException().isThrownBy(() -> WireEnvelope.fromBytes(withTrailer));
    }

    @Test
    public void shouldRejectWrongNonceLength() {
        var encoded = CborWriter.encodeArray(new byte[8], new byte[32]);

        assertThatIOException().isThrownBy(() -> WireEnvelope.fromBytes(encoded));
    }

    @Test
    public void shouldRejectShortCiphertext() {
        var encoded = CborWriter.encodeArray(new byte[12], new byte[15]);

        assertThatIOException().isThrownBy(() -> WireEnvelope.fromBytes(encoded));
    }

    @Test
    public void shouldRejectExtraArrayItems() {
        var encoded = CborWriter.encodeArray(new byte[12], new byte[16], new byte[1]);

        assertThatIOException().isThrownBy(() -> WireEnvelope.fromBytes(encoded));
    }

    @Test
    public void shouldRejectMalformedText() {
        assertThatIOException().isThrownBy(() -> WireEnvelope.fromText("no-dot"));
        assertThatIOException().isThrownBy(() -> WireEnvelope.fromText("a.b.c"));
        assertThatIOException().isThrownBy(() -> WireEnvelope.fromText("!!!!.AAAA"));
        assertThatIOException().isThrownBy(() -> WireEnvelope.fromText(
                Base64url.encode(new byte[12]) + "." + Base64url.encode(new byte[4])));
    }

    @Test
    public void shouldValidateConstructorArguments() {
        assertThatIllegalArgumentException().isThrownBy(() -> new WireEnvelope(new byte[11], new byte[16]));
        assertThatIllegalArgumentException().isThrownBy(() -> new WireEnvelope(new byte[12], new byte[15]));
    }

    @Test
    public void shouldNotExposeInternalArrays() throws Exception {
        envelope.nonce()[0] ^= 1;
        envelope.ciphertext()[0] ^= 1;

        assertThat(WireEnvelope.fromParts(envelope.nonce(), envelope.ciphertext())).isEqualTo(envelope);
    }
}
