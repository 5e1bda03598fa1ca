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


package io.softenclave.channel.handshake;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.softenclave.channel.Channel;
import io.softenclave.channel.ChannelOptions;
import io.softenclave.channel.EphemeralKeyPair;
import io.softenclave.channel.KeyAgreementAlgorithm;
import io.softenclave.channel.KeyAgreementException;
import io.softenclave.channel.RedactedLogger;
import io.softenclave.channel.Require;
import io.softenclave.channel.Role;
import io.softenclave.channel.SessionContext;
import io.softenclave.channel.SessionDeriver;
import io.softenclave.channel.Transport;

/**
 * Drives the one-time exchange of ephemeral public keys between host and enclave and produces a {@link Channel} for
 * the local side.
 * <p>
 * Both sides run the same sequence: generate an ephemeral key pair, subscribe to the transport, send a hello, wait for
 * the peer's hello, validate it, and derive the session keys. The handshake subscription is closed as soon as the
 * peer hello arrives, so that any later message stays buffered in the transport for whoever subscribes next.
 * <p>
 * The session context is always {@code (initiator endpoint, responder endpoint, code identity)}. The responder
 * announces its own code identity. The initiator uses the announced value, unless it was configured with a pinned
 * code identity; in that case the pinned value is used, and a mismatch makes every message fail authentication.
 * <p>
 * An orchestrator runs exactly once. After a failure, create a new one.
 */
public final class HandshakeOrchestrator {
    private static final RedactedLogger logger = RedactedLogger.getLogger(HandshakeOrchestrator.class);

    private final Transport transport;
    private final Role role;
    private final String localEndpoint;
    private final String expectedPeer;
    private final String codeIdentity;
    private final KeyAgreementAlgorithm algorithm;
    private final SessionDeriver deriver;
    private final ChannelOptions channelOptions;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile HandshakeState state = HandshakeState.IDLE;
    private volatile FailureReason failureReason;

    private HandshakeOrchestrator(Builder builder) {
        this.transport = builder.transport;
        this.role = builder.role;
        this.localEndpoint = builder.localEndpoint;
        this.expectedPeer = builder.expectedPeer;
        this.codeIdentity = builder.codeIdentity;
        this.algorithm = builder.algorithm;
        this.deriver = builder.deriver;
        this.channelOptions = builder.channelOptions;
    }

    /**
     * Starts building the host side of a handshake.
     *
     * @param transport the transport to the enclave.
     * @param localEndpoint the host's endpoint identifier, for example its origin.
     */
    public static Builder initiator(Transport transport, String localEndpoint) {
        return new Builder(transport, Role.INITIATOR, localEndpoint);
    }

    /**
     * Starts building the enclave side of a handshake.
     *
     * @param transport the transport to the host.
     * @param localEndpoint the enclave's endpoint identifier.
     */
    public static Builder responder(Transport transport, String localEndpoint) {
        return new Builder(transport, Role.RESPONDER, localEndpoint);
    }

    public HandshakeState state() {
        return state;
    }

    /**
     * The reason the handshake failed, or {@code null} unless the state is {@link HandshakeState#FAILED}.
     */
    public FailureReason failureReason() {
        return failureReason;
    }

    public Role role() {
        return role;
    }

    /**
     * Runs the handshake on a background thread.
     */
    public CompletableFuture<Channel> start(Duration timeout) {
        requireNonNull(timeout, "timeout");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return perform(timeout);
            } catch (HandshakeException e) {
                throw new CompletionException(e);
            }
        });
    }

    /**
     * Runs the handshake on the calling thread.
     *
     * @param timeout how long to wait for the peer's hello.
     * @return the established channel.
     * @throws HandshakeException if the handshake fails for any reason.
     * @throws IllegalStateException if this orchestrator has already been run.
     */
    public Channel perform(Duration timeout) throws HandshakeException {
        requireNonNull(timeout, "timeout");
        Require.require(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Handshake has already been performed");
        }

        try (var localKeys = algorithm.generate()) {
            transition(HandshakeState.KEYS_GENERATED);
            var peerHello = exchangeHellos(localKeys, timeout);
            transition(HandshakeState.PEER_KEY_RECEIVED);

            validate(peerHello);
            var context = contextFor(peerHello);
            var sessionKeys = deriver.deriveSession(localKeys, peerHello.publicKey(), context);
            transition(HandshakeState.SESSION_DERIVED);

            var channel = new Channel(sessionKeys, role, channelOptions);
            transition(HandshakeState.READY);
            logger.info("Handshake complete: role={}, peer={}, alg={}", role, peerHello.endpoint(),
                    algorithm.identifier());
            return channel;
        } catch (KeyAgreementException e) {
            throw fail(new HandshakeException(FailureReason.KEY_AGREEMENT, "Peer public key rejected", e));
        } catch (HandshakeException e) {
            throw fail(e);
        }
    }

    private HandshakeMessage exchangeHellos(EphemeralKeyPair localKeys, Duration timeout)
            throws HandshakeException {
        var peerHello = new CompletableFuture<byte[]>();
        var subscriptionRef = new AtomicReference<Transport.Subscription>();
        Transport.Subscription subscription;
        try {
            subscription = transport.onReceive(message -> {
                if (peerHello.complete(message)) {
                    var sub = subscriptionRef.get();
                    if (sub != null) {
                        sub.close();
                    }
                }
            });
        } catch (RuntimeException e) {
            throw new HandshakeException(FailureReason.TRANSPORT, "Failed to subscribe to transport", e);
        }
        try {
            subscriptionRef.set(subscription);
            if (peerHello.isDone()) {
                subscription.close();
            }

            var hello = new HandshakeMessage(deriver.protocolId(), role, localEndpoint, codeIdentity,
                    algorithm.identifier(), localKeys.publicKey());
            try {
                transport.send(hello.toBytes());
            } catch (IOException | RuntimeException e) {
                throw new HandshakeException(FailureReason.TRANSPORT, "Failed to send hello", e);
            }
            transition(HandshakeState.LOCAL_ANNOUNCED);

            var received = peerHello.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            logger.debug("Received peer hello ({} bytes)", received.length);
            return HandshakeMessage.parse(received);
        } catch (TimeoutException e) {
            throw new HandshakeTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandshakeException(FailureReason.CANCELLED, "Interrupted waiting for peer hello", e);
        } catch (ExecutionException e) {
            throw new HandshakeException(FailureReason.TRANSPORT, "Transport failed", e.getCause());
        } finally {
            subscription.close();
        }
    }

    private void validate(HandshakeMessage peer) throws HandshakeException {
        if (!deriver.protocolId().equals(peer.protocol())) {
            throw mismatch("Unsupported protocol: " + peer.protocol());
        }
        var peerAlgorithm = KeyAgreementAlgorithm.fromIdentifier(peer.algorithm())
                .orElseThrow(() -> mismatch("Unsupported key agreement algorithm: " + peer.algorithm()));
        if (peerAlgorithm != algorithm) {
            throw mismatch("Peer uses " + peerAlgorithm.identifier() + " but " + algorithm.identifier()
                    + " is required");
        }
        if (peer.role() != role.opposite()) {
            throw mismatch("Peer has the same role: " + peer.role());
        }
        if (peer.endpoint().isBlank()) {
            throw new HandshakeException(FailureReason.MALFORMED_MESSAGE, "Peer endpoint is empty");
        }
        if (expectedPeer != null && !expectedPeer.equals(peer.endpoint())) {
            throw mismatch("Unexpected peer endpoint: " + peer.endpoint());
        }
        if (peer.publicKey().length != algorithm.publicKeyLength()) {
            throw new HandshakeException(FailureReason.KEY_AGREEMENT, "Peer public key has the wrong length");
        }
    }

    private SessionContext contextFor(HandshakeMessage peer) {
        if (role == Role.INITIATOR) {
            var code = codeIdentity.isEmpty() ? peer.codeIdentity() : codeIdentity;
            return new SessionContext(localEndpoint, peer.endpoint(), code);
        }
        return new SessionContext(peer.endpoint(), localEndpoint, codeIdentity);
    }

    private void transition(HandshakeState next) {
        logger.debug("Handshake {} -> {} ({})", state, next, role);
        state = next;
    }

    private HandshakeException fail(HandshakeException e) {
        failureReason = e.reason();
        state = HandshakeState.FAILED;
        logger.warn("Handshake failed: role={}, reason={}, message={}", role, e.reason(), e.getMessage());
        return e;
    }

    private static HandshakeException mismatch(String message) {
        return new HandshakeException(FailureReason.PROTOCOL_MISMATCH, message);
    }

    public static final class Builder {
        private final Transport transport;
        private final Role role;
        private final String localEndpoint;
        private String expectedPeer;
        private String codeIdentity = "";
        private KeyAgreementAlgorithm algorithm = KeyAgreementAlgorithm.P256;
        private SessionDeriver deriver = SessionDeriver.standard();
        private ChannelOptions channelOptions = ChannelOptions.defaults();

        private Builder(Transport transport, Role role, String localEndpoint) {
            this.transport = requireNonNull(transport, "transport");
            this.role = role;
            this.localEndpoint = Require.notBlank(localEndpoint, "Local endpoint must not be blank");
        }

        /**
         * Rejects the handshake unless the peer announces exactly this endpoint identifier.
         */
        public Builder expectedPeer(String peerEndpoint) {
            this.expectedPeer = Require.notBlank(peerEndpoint, "Expected peer must not be blank");
            return this;
        }

        /**
         * On the responder, the code identity to announce. On the initiator, a pinned code identity that overrides
         * whatever the responder announces.
         */
        public Builder codeIdentity(String codeIdentity) {
            this.codeIdentity = codeIdentity == null ? "" : codeIdentity;
            return this;
        }

        public Builder algorithm(KeyAgreementAlgorithm algorithm) {
            this.algorithm = requireNonNull(algorithm, "algorithm");
            return this;
        }

        public Builder deriver(SessionDeriver deriver) {
            this.deriver = requireNonNull(deriver, "deriver");
            return this;
        }

        public Builder channelOptions(ChannelOptions channelOptions) {
            this.channelOptions = requireNonNull(channelOptions, "channelOptions");
            return this;
        }

        public HandshakeOrchestrator build() {
            return new HandshakeOrchestrator(this);
        }
    }
}
