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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;

import io.softenclave.channel.io.CborReader;
import io.softenclave.channel.io.CborWriter;
import software.pando.crypto.nacl.Bytes;

/**
 * One side of an established secure session. A channel seals outbound messages under a strictly increasing sequence
 * number and opens inbound messages, rejecting replays, forgeries, reflected messages and out-of-order delivery.
 * <p>
 * Every message is bound to an <em>operation tag</em> supplied by the caller, which is authenticated as AES-GCM
 * associated data. A message sealed under one tag cannot be opened under another.
 * <p>
 * All methods are thread-safe. Sequence counters and the inbound tracker are only changed by calls that succeed. The
 * replay cache remembers every nonce it has not seen before as soon as it arrives, so an envelope is consumed even
 * when it fails to authenticate. A failed {@link #open(WireEnvelope, String)} drops that one message and leaves the session usable, unless
 * the channel is configured to close after a number of consecutive failures.
 */
public final class Channel implements AutoCloseable {
    private static final RedactedLogger logger = RedactedLogger.getLogger(Channel.class);

    private final Role role;
    private final SessionKeys keys;
    private final byte[] outboundIV;
    private final byte[] inboundIV;
    private final ChannelOptions options;
    private final ReplayCache replayCache;
    private final SequencePolicy.Tracker inbound;
    private final ChannelMetrics metrics;

    private long outboundSequence = 0;
    private int consecutiveFailures = 0;
    private boolean closed = false;

    public Channel(SessionKeys keys, Role role) {
        this(keys, role, ChannelOptions.defaults());
    }

    /**
     * Creates a channel that takes ownership of the given session keys. The keys are destroyed when the channel is
     * closed.
     *
     * @param keys the session keys, derived identically on both sides.
     * @param role which side of the session this channel is.
     * @param options the channel options.
     */
    public Channel(SessionKeys keys, Role role, ChannelOptions options) {
        this.keys = requireNonNull(keys, "keys");
        this.role = requireNonNull(role, "role");
        this.options = requireNonNull(options, "options");
        var baseIV = keys.baseIV();
        this.outboundIV = Nonces.directionalIV(baseIV, role);
        this.inboundIV = Nonces.directionalIV(baseIV, role.opposite());
        Utils.wipe(baseIV);
        this.replayCache = new ReplayCache(options.replayCacheCapacity());
        this.inbound = options.sequencePolicy().newTracker();
        this.metrics = new ChannelMetrics(options.clock());
    }

    /**
     * Encrypts and authenticates a message body.
     *
     * @param body the plaintext body.
     * @param operationTag the operation tag the message is bound to.
     * @return the envelope to send to the peer.
     * @throws SequenceExhaustedException if the outbound sequence space is used up.
     * @throws IllegalStateException if the channel has been closed.
     */
    public synchronized WireEnvelope seal(byte[] body, String operationTag) throws SequenceExhaustedException {
        requireNonNull(body, "body");
        requireNonNull(operationTag, "operationTag");
        checkOpen();
        if (outboundSequence >= options.maxOutboundSequence()) {
            logger.warn("Outbound sequence exhausted on {} channel", role);
            throw new SequenceExhaustedException(options.maxOutboundSequence());
        }

        long sequence = outboundSequence + 1;
        var nonce = Nonces.fromSequence(outboundIV, sequence);
        var plaintext = CborWriter.encodeArray(sequence, body);
        try {
            var ciphertext = Crypto.aeadSeal(keys.aeadKey(), nonce, operationTag.getBytes(UTF_8), plaintext);
            outboundSequence = sequence;
            metrics.recordSealed();
            logger.debug("Sealed seq={} op={} nonce={}", sequence, operationTag, nonce);
            return new WireEnvelope(nonce, ciphertext);
        } finally {
            Utils.wipe(plaintext);
        }
    }

    /**
     * Verifies and decrypts an envelope received from the peer.
     *
     * @param envelope the received envelope.
     * @param operationTag the operation tag the message is expected to be bound to.
     * @return the plaintext body.
     * @throws ReplayDetectedException if the envelope's nonce has been seen before, including by an earlier call
     * that failed.
     * @throws AuthenticationException if the envelope fails to authenticate under this session and operation tag,
     * or was not sent by the peer.
     * @throws SequenceViolationException if the sequence number is not acceptable.
     * @throws IllegalStateException if the channel has been closed.
     */
    public synchronized byte[] open(WireEnvelope envelope, String operationTag)
            throws ReplayDetectedException, AuthenticationException, SequenceViolationException {
        requireNonNull(envelope, "envelope");
        requireNonNull(operationTag, "operationTag");
        checkOpen();
        try {
            var body = doOpen(envelope, operationTag);
            consecutiveFailures = 0;
            metrics.recordOpened();
            return body;
        } catch (ChannelException e) {
            metrics.recordFailure(e.kind());
            logger.warn("Rejected inbound message on {} channel: {} ({})", role, e.kind(), e.getMessage());
            if (options.maxConsecutiveFailures() > 0 && ++consecutiveFailures >= options.maxConsecutiveFailures()) {
                logger.warn("Closing {} channel after {} consecutive failures", role, consecutiveFailures);
                close();
            }
            throw e;
        }
    }

    private byte[] doOpen(WireEnvelope envelope, String operationTag)
            throws ReplayDetectedException, AuthenticationException, SequenceViolationException {
        var nonce = envelope.nonce();
        if (replayCache.contains(nonce)) {
            throw new ReplayDetectedException();
        }
        // Consumed on first sight, whether or not it authenticates
        replayCache.remember(nonce);

        var plaintext = Crypto.aeadOpen(keys.aeadKey(), nonce, operationTag.getBytes(UTF_8), envelope.ciphertext())
                .orElseThrow(AuthenticationException::new);
        long sequence;
        byte[] body;
        try (var array = CborReader.readSingleArray(plaintext)) {
            sequence = array.readUnsigned();
            body = array.readBytes();
        } catch (IOException e) {
            throw new SequenceViolationException("Malformed authenticated payload");
        } finally {
            Utils.wipe(plaintext);
        }
        if (sequence < 1 || sequence > Nonces.MAX_SEQUENCE) {
            throw new SequenceViolationException("Sequence number out of range: " + sequence);
        }

        if (!Bytes.equal(nonce, Nonces.fromSequence(inboundIV, sequence))) {
            throw new AuthenticationException();
        }
        inbound.check(sequence);
        inbound.accept(sequence);
        logger.debug("Opened seq={} op={}", sequence, operationTag);
        return body;
    }

    public Role role() {
        return role;
    }

    public ChannelMetrics metrics() {
        return metrics;
    }

    public synchronized long outboundSequence() {
        return outboundSequence;
    }

    public synchronized long lastInboundSequence() {
        return inbound.lastAccepted();
    }

    /**
     * Whether the outbound sequence is close enough to its limit that a fresh handshake should be started.
     */
    public synchronized boolean needsRenegotiation() {
        return outboundSequence >= options.maxOutboundSequence() - options.renegotiationMargin();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Destroys the session keys. Further calls to {@link #seal(byte[], String)} or {@link #open(WireEnvelope, String)}
     * fail with {@link IllegalStateException}. Closing twice has no effect.
     */
    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            keys.destroy();
            replayCache.clear();
            Utils.wipe(outboundIV, inboundIV);
            logger.debug("Closed {} channel after {} sealed messages", role, outboundSequence);
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Channel is closed");
        }
    }

    @Override
    public String toString() {
        return "Channel{role=" + role + ", closed=" + closed + '}';
    }
}
