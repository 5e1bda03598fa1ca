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
import java.time.Duration;

import io.softenclave.channel.Channel;
import io.softenclave.channel.ChannelException;
import io.softenclave.channel.RedactedLogger;
import io.softenclave.channel.Transport;
import io.softenclave.channel.op.OperationMessage.Execute;
import io.softenclave.channel.op.OperationMessage.Failure;
import io.softenclave.channel.op.OperationMessage.Metrics;
import io.softenclave.channel.op.OperationMessage.Pong;
import io.softenclave.channel.op.OperationMessage.SignTransaction;

/**
 * Serves host requests inside the enclave. Each inbound frame is opened on the channel, dispatched, and answered with
 * a response sealed under the response operation. Frames that fail to open are dropped without a response.
 */
public final class EnclaveEndpoint implements AutoCloseable {
    private static final RedactedLogger logger = RedactedLogger.getLogger(EnclaveEndpoint.class);

    private final Channel channel;
    private final Transport transport;
    private final EnclaveService service;
    private final Transport.Subscription subscription;
    private final Object sendLock = new Object();

    public EnclaveEndpoint(Channel channel, Transport transport, EnclaveService service) {
        this.channel = requireNonNull(channel, "channel");
        this.transport = requireNonNull(transport, "transport");
        this.service = requireNonNull(service, "service");
        this.subscription = transport.onReceive(this::onFrame);
    }

    private void onFrame(byte[] bytes) {
        OperationCodec.Decoded request;
        try {
            var frame = Frame.fromBytes(bytes);
            if (!frame.operation().isRequest()) {
                logger.warn("Dropping {} frame: not a request", frame.operation());
                return;
            }
            var body = channel.open(frame.envelope(), frame.operation().aad());
            request = OperationCodec.decode(frame.operation(), body);
        } catch (IOException | ChannelException | IllegalStateException e) {
            logger.warn("Dropping inbound frame: {}", e.getMessage());
            return;
        }

        OperationMessage response;
        try {
            response = dispatch(request.message());
        } catch (Exception e) {
            logger.warn("{} request {} failed", request.message().operation(), request.correlationId(), e);
            response = new Failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        reply(request.correlationId(), response);
    }

    private OperationMessage dispatch(OperationMessage request) throws Exception {
        return switch (request.operation()) {
            case EXECUTE -> {
                var result = service.execute((Execute) request);
                recordExposure(result.keyExposure());
                yield result;
            }
            case SIGN_TRANSACTION -> {
                var result = service.signTransaction((SignTransaction) request);
                recordExposure(result.keyExposure());
                yield result;
            }
            case PING -> new Pong();
            case GET_METRICS -> new Metrics(channel.metrics().snapshot());
            case EXECUTE_RESULT, SIGN_RESULT, PONG, METRICS, ERROR ->
                    throw new IllegalArgumentException(request.operation() + " is not a request");
        };
    }

    private void recordExposure(Duration exposure) {
        if (!exposure.isZero()) {
            channel.metrics().recordSecretExposure(exposure);
        }
    }

    private void reply(String correlationId, OperationMessage response) {
        var operation = response.operation();
        try {
            synchronized (sendLock) {
                var envelope = channel.seal(OperationCodec.encode(correlationId, response), operation.aad());
                transport.send(new Frame(operation, envelope).toBytes());
            }
            logger.debug("Sent {} response {}", operation, correlationId);
        } catch (ChannelException | IOException | IllegalStateException e) {
            logger.error("Failed to send {} response {}", operation, correlationId, e);
        }
    }

    @Override
    public void close() {
        subscription.close();
    }
}
