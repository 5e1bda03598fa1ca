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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;

import java.time.Duration;

import org.testng.annotations.Test;

import io.softenclave.channel.MetricsSnapshot;
import io.softenclave.channel.op.OperationMessage.Execute;
import io.softenclave.channel.op.OperationMessage.ExecuteResult;
import io.softenclave.channel.op.OperationMessage.Failure;
import io.softenclave.channel.op.OperationMessage.Metrics;
import io.softenclave.channel.op.OperationMessage.Ping;
import io.softenclave.channel.op.OperationMessage.SignResult;
import io.softenclave.channel.op.OperationMessage.SignTransaction;

public class OperationCodecTest {

    @Test
    public void shouldCarryExecuteRequest() throws Exception {
        var request = new Execute("return ctx.a + 1", "{\"a\":41}", Duration.ofSeconds(2));

        var decoded = OperationCodec.decode(Operation.EXECUTE, OperationCodec.encode("call-1", request));

        assertThat(decoded.correlationId()).isEqualTo("call-1");
        assertThat(decoded.message()).isEqualTo(request);
    }

    @Test
    public void shouldCarryBinaryFieldsAsBase64url() throws Exception {
        var request = new SignTransaction(new byte[] { (byte) 0xfb, (byte) 0xff }, "{\"to\":\"0xabc\"}");

        var body = OperationCodec.encode("id", request);
        var decoded = (SignTransaction) OperationCodec.decode(Operation.SIGN_TRANSACTION, body).message();

        assertThat(new String(body, UTF_8)).contains("\"key\":\"-_8\"");
        assertThat(decoded.encryptedKey()).containsExactly(0xfb, 0xff);
        assertThat(decoded.transactionJson()).isEqualTo("{\"to\":\"0xabc\"}");
    }

    @Test
    public void shouldCarryResultsWithExposure() throws Exception {
        var result = new ExecuteResult("42", Duration.ofMillis(12), null);
        var signed = new SignResult(new byte[64], Duration.ofMillis(3));

        var decodedResult = OperationCodec.decode(Operation.EXECUTE_RESULT, OperationCodec.encode("a", result));
        var decodedSigned = OperationCodec.decode(Operation.SIGN_RESULT, OperationCodec.encode("b", signed));

        assertThat(decodedResult.message()).isEqualTo(new ExecuteResult("42", Duration.ofMillis(12), Duration.ZERO));
        assertThat(((SignResult) decodedSigned.message()).keyExposure()).isEqualTo(Duration.ofMillis(3));
    }

    @Test
    public void shouldCarryMetricsSnapshot() throws Exception {
        var snapshot = new MetricsSnapshot(1, 2, 3, 4, 5, Duration.ofSeconds(6), 7, Duration.ofMillis(8));

        var decoded = OperationCodec.decode(Operation.METRICS, OperationCodec.encode("m", new Metrics(snapshot)));

        assertThat(decoded.message()).isEqualTo(new Metrics(snapshot));
    }

    @Test
    public void shouldRejectBodySealedUnderAnotherOperation() {
        var body = OperationCodec.encode("id", new Ping());

        assertThatIOException().isThrownBy(() -> OperationCodec.decode(Operation.GET_METRICS, body))
                .withMessageContaining("ping");
    }

    @Test
    public void shouldRejectMissingOrInvalidFields() {
        assertThatIOException().isThrownBy(() -> decode(Operation.PING, "not json"));
        assertThatIOException().isThrownBy(() -> decode(Operation.PING, "{\"op\":\"ping\"}"));
        assertThatIOException().isThrownBy(() -> decode(Operation.EXECUTE,
                "{\"op\":\"execute\",\"id\":\"x\",\"code\":\"1\",\"context\":\"{}\",\"timeoutMs\":\"soon\"}"));
        assertThatIOException().isThrownBy(() -> decode(Operation.EXECUTE,
                "{\"op\":\"execute\",\"id\":\"x\",\"code\":\"1\",\"context\":\"{}\",\"timeoutMs\":-5}"));
        assertThatIOException().isThrownBy(() -> decode(Operation.SIGN_RESULT,
                "{\"op\":\"sign-result\",\"id\":\"x\",\"sig\":\"***\",\"keyExposureMs\":0}"));
        assertThatIOException().isThrownBy(() -> decode(Operation.METRICS, "{\"op\":\"metrics\",\"id\":\"x\"}"));
    }

    @Test
    public void shouldCarryErrorText() throws Exception {
        var decoded = decode(Operation.ERROR, "{\"op\":\"error\",\"id\":\"x\",\"error\":\"boom\"}");

        assertThat(decoded.message()).isEqualTo(new Failure("boom"));
    }

    private static OperationCodec.Decoded decode(Operation operation, String body) throws Exception {
        return OperationCodec.decode(operation, body.getBytes(UTF_8));
    }
}
