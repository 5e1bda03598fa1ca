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
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import io.softenclave.channel.Channel;
import io.softenclave.channel.ChannelException;
import io.softenclave.channel.RedactedLogger;
import io.softenclave.channel.Require;
import io.softenclave.channel.Transport;
import io.softenclave.channel.op.OperationMessage.Execute;
import io.softenclave.channel.op.OperationMessage.ExecuteResult;
import io.softenclave.channel.op.OperationMessage.Failure;
import io.softenclave.channel.op.OperationMessage.GetMetrics;
import io.softenclave.channel.op.OperationMessage.Metrics;
import io.softenclave.channel.op.OperationMessage.Ping;
import io.softenclave.channel.op.OperationMessage.SignResult;
import io.softenclave.channel.op.OperationMessage.SignTransaction;

/**
 * The host's view of an enclave: sends requests over an established {@link Channel} and completes each call when the
 * matching response arrives. Responses are matched by correlation id, so calls may be outstanding concurrently.
 * <p>
 * A call that receives no acceptable response within its timeout completes exceptionally with a
 * {@link java.util.concurrent.TimeoutException}; responses that fail to open are dropped and never complete a call.
 */
public final class HostClient implements AutoCloseable {
    private static final RedactedLogger logger = RedactedLogger.getLogger(HostClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final Channel channel;
    private final Transport transport;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final Transport.Subscription subscription;
    // Held across seal and send so frames leave in sequence order
    private final Object sendLock = new Object();

    private record PendingCall(Operation request, CompletableFuture<OperationMessage> result) {}

    public HostClient(Channel channel, Transport transport) {
        this.channel = requireNonNull(channel, "channel");
        this.transport = requireNonNull(transport, "transport");
        this.subscription = transport.onReceive(this::onFrame);
    }

    /**
     * Sends a request and returns a future for its response.
     *
     * @param request the request, whose operation must be a request operation.
     * @param timeout how long to wait for the response.
     * @return a future completing with the response, or exceptionally with {@link RemoteOperationException},
     * {@link java.util.concurrent.TimeoutException} or the error that prevented sending.
     */
    public CompletableFuture<OperationMessage> call(OperationMessage request, Duration timeout) {
        requireNonNull(request, "request");
        requireNonNull(timeout, "timeout");
        Require.require(request.operation().isRequest(), request.operation() + " is not a request");

        var correlationId = UUID.randomUUID().toString();
        var result = new CompletableFuture<OperationMessage>();
        pending.put(correlationId, new PendingCall(request.operation(), result));
        result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> pending.remove(correlationId));

        try {
            synchronized (sendLock) {
                var envelope = channel.seal(OperationCodec.encode(correlationId, request), request.operation().aad());
                transport.send(new Frame(request.operation(), envelope).toBytes());
            }
            logger.debug("Sent {} request {}", request.operation(), correlationId);
        } catch (ChannelException | IOException | IllegalStateException e) {
            logger.warn("Failed to send {} request: {}", request.operation(), e.getMessage());
            result.completeExceptionally(e);
        }
        return result;
    }

    public CompletableFuture<ExecuteResult> execute(String code, String contextJson, Duration timeout) {
        return call(new Execute(code, contextJson, timeout), timeout.plus(DEFAULT_TIMEOUT))
                .thenApply(ExecuteResult.class::cast);
    }

    public CompletableFuture<SignResult> signTransaction(byte[] encryptedKey, String transactionJson) {
        return call(new SignTransaction(encryptedKey, transactionJson), DEFAULT_TIMEOUT)
                .thenApply(SignResult.class::cast);
    }

    public CompletableFuture<Void> ping(Duration timeout) {
        return call(new Ping(), timeout).thenApply(pong -> null);
    }

    public CompletableFuture<Metrics> metrics() {
        return call(new GetMetrics(), DEFAULT_TIMEOUT).thenApply(Metrics.class::cast);
    }

    int pendingCalls() {
        return pending.size();
    }

    private void onFrame(byte[] bytes) {
        OperationCodec.Decoded decoded;
        try {
            var frame = Frame.fromBytes(bytes);
            var body = channel.open(frame.envelope(), frame.operation().aad());
            decoded = OperationCodec.decode(frame.operation(), body);
        } catch (IOException | ChannelException | IllegalStateException e) {
            logger.warn("Dropping inbound frame: {}", e.getMessage());
            return;
        }

        var call = pending.remove(decoded.correlationId());
        if (call == null) {
            logger.warn("Dropping response to unknown or expired call {}", decoded.correlationId());
            return;
        }
        var response = decoded.message();
        if (response instanceof Failure failure) {
            call.result().completeExceptionally(new RemoteOperationException(call.request(), failure.error()));
        } else if (response.operation() != call.request().response()) {
            call.result().completeExceptionally(new IOException("Unexpected " + response.operation() +
                    " response to " + call.request()));
        } else {
            call.result().complete(response);
        }
    }

    /**
     * Stops listening for responses. Outstanding calls time out. The channel itself is not closed.
     */
    @Override
    public void close() {
        subscription.close();
    }
}
