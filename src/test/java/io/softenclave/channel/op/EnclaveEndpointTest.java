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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.softenclave.channel.LoopbackTransport;
import io.softenclave.channel.TestSessions;
import io.softenclave.channel.op.OperationMessage.Pong;

public class EnclaveEndpointTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    private LoopbackTransport.Pair transports;
    private TestSessions.Pair sessions;
    private EnclaveService service;
    private HostClient client;
    private EnclaveEndpoint endpoint;

    @BeforeMethod
    public void setup() throws Exception {
        transports = LoopbackTransport.create();
        sessions = TestSessions.channels();
        service = mock(EnclaveService.class);
        client = new HostClient(sessions.host(), transports.host());
        endpoint = new EnclaveEndpoint(sessions.enclave(), transports.enclave(), service);
    }

    @AfterMethod
    public void tearDown() {
        endpoint.close();
        client.close();
        transports.close();
    }

    @Test
    public void shouldDropReplayedRequests() throws Exception {
        client.ping(WAIT).get();
        var ping = transports.host().sentFrames().get(0);

        transports.enclave().inject(ping);
        var metrics = client.metrics().get().snapshot();

        assertThat(metrics.replayRejections()).isEqualTo(1);
        assertThat(metrics.opened()).isEqualTo(2);
        assertThat(transports.enclave().sentFrames()).hasSize(2);
    }

    @Test
    public void shouldDropFramesThatAreNotRequests() throws Exception {
        var pong = sessions.host().seal(OperationCodec.encode("x", new Pong()), Operation.PONG.aad());
        transports.host().send(new Frame(Operation.PONG, pong).toBytes());

        client.ping(WAIT).get();

        assertThat(transports.enclave().sentFrames()).hasSize(1);
        assertThat(sessions.enclave().metrics().snapshot().opened()).isEqualTo(1);
        verifyNoInteractions(service);
    }

    @Test
    public void shouldDropGarbageAndTamperedFrames() throws Exception {
        transports.enclave().inject(new byte[] { 1, 2, 3 });
        var envelope = sessions.host().seal(OperationCodec.encode("x", new OperationMessage.Ping()),
                Operation.PING.aad());
        transports.host().send(new Frame(Operation.GET_METRICS, envelope).toBytes());

        var metrics = client.metrics().get().snapshot();

        assertThat(metrics.authenticationFailures()).isEqualTo(1);
        assertThat(metrics.opened()).isEqualTo(1);
        assertThat(transports.enclave().sentFrames()).hasSize(1);
    }

    @Test
    public void shouldStopServingWhenClosed() {
        endpoint.close();

        assertThat(client.ping(Duration.ofMillis(100))).failsWithin(WAIT);
        assertThat(transports.enclave().sentFrames()).isEmpty();
    }
}
