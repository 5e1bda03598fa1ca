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

import org.testng.annotations.Test;

public class KeyAgreementAlgorithmTest {

    @Test
    public void shouldExportRawPublicKeysOfFixedLength() {
        assertThat(KeyAgreementAlgorithm.P256.generate().publicKey()).hasSize(65).startsWith((byte) 0x04);
        assertThat(KeyAgreementAlgorithm.X25519.generate().publicKey()).hasSize(32);
    }

    @Test
    public void shouldGenerateFreshKeysEveryTime() {
        assertThat(KeyAgreementAlgorithm.P256.generate().publicKey())
                .isNotEqualTo(KeyAgreementAlgorithm.P256.generate().publicKey());
    }

    @Test
    public void shouldAgreeOnSameSecret() throws Exception {
        for (var algorithm : KeyAgreementAlgorithm.values()) {
            var a = algorithm.generate();
            var b = algorithm.generate();

            var ab = algorithm.agree(a.privateKey(), b.publicKey());
            var ba = algorithm.agree(b.privateKey(), a.publicKey());

            assertThat(ab).hasSize(32).isEqualTo(ba);
        }
    }

    @Test
    public void shouldLookUpByIdentifier() {
        assertThat(KeyAgreementAlgorithm.fromIdentifier("P-256")).contains(KeyAgreementAlgorithm.P256);
        assertThat(KeyAgreementAlgorithm.fromIdentifier("X25519")).contains(KeyAgreementAlgorithm.X25519);
        assertThat(KeyAgreementAlgorithm.fromIdentifier("P-384")).isEmpty();
    }
}
