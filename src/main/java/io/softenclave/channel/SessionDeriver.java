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

import static io.softenclave.channel.Crypto.AEAD_KEY_SIZE_BYTES;
import static io.softenclave.channel.Crypto.NONCE_SIZE_BYTES;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;

/**
 * Derives {@link SessionKeys} from an ephemeral key agreement and a {@link SessionContext}.
 * <p>
 * The shared secret is run through HKDF-SHA-256 with a salt of {@code SHA-256(initiator|responder|codeIdentity)},
 * so sessions bound to different contexts never share keys. With transcript binding enabled (the default) the
 * HKDF info strings also include a hash of both ephemeral public keys, which ties the keys to one specific handshake.
 * Instances are immutable and can be shared.
 */
public final class SessionDeriver {
    private static final RedactedLogger logger = RedactedLogger.getLogger(SessionDeriver.class);

    public static final String DEFAULT_PROTOCOL_ID = "soft-enclave/v1";

    private final String protocolId;
    private final boolean transcriptBinding;

    private SessionDeriver(String protocolId, boolean transcriptBinding) {
        this.protocolId = Require.notBlank(protocolId, "Protocol id must not be blank");
        this.transcriptBinding = transcriptBinding;
    }

    /**
     * The default deriver: protocol id {@value #DEFAULT_PROTOCOL_ID} with transcript binding.
     */
    public static SessionDeriver standard() {
        return new SessionDeriver(DEFAULT_PROTOCOL_ID, true);
    }

    /**
     * A deriver that binds keys to the session context only, without the handshake transcript. Both peers must use
     * the same mode.
     */
    public static SessionDeriver contextOnly() {
        return new SessionDeriver(DEFAULT_PROTOCOL_ID, false);
    }

    public static SessionDeriver of(String protocolId, boolean transcriptBinding) {
        return new SessionDeriver(protocolId, transcriptBinding);
    }

    public String protocolId() {
        return protocolId;
    }

    public boolean isTranscriptBound() {
        return transcriptBinding;
    }

    /**
     * Performs the key agreement and derives the session keys. The raw shared secret and the HKDF pseudorandom key
     * are wiped before this method returns.
     *
     * @param local the local ephemeral key pair.
     * @param remotePublicKey the peer's raw public key, in the encoding of the local key pair's algorithm.
     * @param context the session context, which both sides must construct identically.
     * @return the derived session keys.
     * @throws KeyAgreementException if the peer public key is not acceptable.
     */
    public SessionKeys deriveSession(EphemeralKeyPair local, byte[] remotePublicKey, SessionContext context)
            throws KeyAgreementException {
        requireNonNull(local, "local");
        requireNonNull(context, "context");
        local.algorithm().checkLength(remotePublicKey);

        var secret = local.algorithm().agree(local.privateKey(), remotePublicKey);
        var salt = contextSalt(context);
        var transcript = transcriptBinding ? transcriptHash(local.publicKey(), remotePublicKey) : new byte[0];
        logger.trace("Deriving session: context={}, salt={}, transcript={}", context, salt, transcript);

        byte[] keyBytes = null;
        byte[] baseIV = null;
        try (var prk = HKDF.extract(salt, secret)) {
            keyBytes = HKDF.expand(prk, info("/aead/", transcript), AEAD_KEY_SIZE_BYTES);
            baseIV = HKDF.expand(prk, info("/iv/", transcript), NONCE_SIZE_BYTES);
            return new SessionKeys(new DestroyableSecretKey(keyBytes, "AES"), baseIV);
        } finally {
            Utils.wipe(secret, keyBytes, baseIV);
        }
    }

    private byte[] info(String label, byte[] transcript) {
        return Utils.concat((protocolId + label).getBytes(UTF_8), transcript);
    }

    static byte[] contextSalt(SessionContext context) {
        return Crypto.sha256(context.canonicalString().getBytes(UTF_8));
    }

    /**
     * Hashes both public keys in a canonical order (shorter first, then unsigned byte-wise), so that both peers
     * compute the same value regardless of which key is theirs.
     */
    static byte[] transcriptHash(byte[] publicKeyA, byte[] publicKeyB) {
        boolean aFirst = publicKeyA.length != publicKeyB.length
                ? publicKeyA.length < publicKeyB.length
                : Arrays.compareUnsigned(publicKeyA, publicKeyB) <= 0;
        return aFirst ? Crypto.sha256(publicKeyA, publicKeyB) : Crypto.sha256(publicKeyB, publicKeyA);
    }

    @Override
    public String toString() {
        return "SessionDeriver{protocolId='" + protocolId + "', transcriptBinding=" + transcriptBinding + '}';
    }
}
