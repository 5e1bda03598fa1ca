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

public class RedactedLoggerTest {

    @Test
    public void shouldMaskLongByteArrays() {
        var secret = new byte[32];
        secret[0] = 0x0a;
        secret[31] = (byte) 0xff;

        assertThat(RedactedLogger.redact(secret)).isEqualTo("0a0000...0000ff");
    }

    @Test
    public void shouldFullyRedactShortByteArrays() {
        assertThat(RedactedLogger.redact(new byte[12])).isEqualTo("<redacted>");
    }

    @Test
    public void shouldRedactKeysAndNoteDestroyedOnes() {
        var key = new DestroyableSecretKey(new byte[32], "AES");
        assertThat(RedactedLogger.redact(key)).isEqualTo("000000...000000");

        key.destroy();

        assertThat(RedactedLogger.redact(key)).isEqualTo("<destroyed>");
    }

    @Test
    public void shouldPassOtherArgumentsThrough() {
        var exception = new IllegalStateException();
        assertThat(RedactedLogger.redact("text")).isEqualTo("text");
        assertThat(RedactedLogger.redact(exception)).isSameAs(exception);
        assertThat(RedactedLogger.redact(null)).isNull();
    }
}
