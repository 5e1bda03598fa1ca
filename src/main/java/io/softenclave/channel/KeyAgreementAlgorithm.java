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

import static software.pando.crypto.nacl.Subtle.scalarMultiplication;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.InvalidParameterSpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPublicKeySpec;
import java.util.Arrays;
import java.util.Optional;

import javax.crypto.KeyAgreement;

/**
 * The supported ephemeral key agreement algorithms. Public keys are always exchanged in a fixed-length raw encoding.
 */
public enum KeyAgreementAlgorithm {
    /**
     * ECDH over NIST P-256. Public keys are 65-byte uncompressed points ({@code 0x04 || x || y}).
     */
    P256("P-256", 65) {
        @Override
        public EphemeralKeyPair generate() {
            try {
                var generator = KeyPairGenerator.getInstance("EC");
                generator.initialize(new ECGenParameterSpec(P256Curve.CURVE_NAME), Crypto.SECURE_RANDOM);
                var keyPair = generator.generateKeyPair();
                var point = ((ECPublicKey) keyPair.getPublic()).getW();
                var encoded = Utils.concat(new byte[] { 0x04 },
                        Utils.toUnsignedBigEndian(point.getAffineX(), 32),
                        Utils.toUnsignedBigEndian(point.getAffineY(), 32));
                return new EphemeralKeyPair(this, keyPair.getPrivate(), encoded);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("P-256 key generation failed", e);
            }
        }

        @Override
        byte[] agree(PrivateKey privateKey, byte[] peerPublicKey) throws KeyAgreementException {
            var peerKey = P256Curve.decodePublicKey(peerPublicKey);
            try {
                var keyAgreement = KeyAgreement.getInstance("ECDH");
                keyAgreement.init(privateKey);
                keyAgreement.doPhase(peerKey, true);
                return keyAgreement.generateSecret();
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            } catch (InvalidKeyException | IllegalStateException e) {
                throw new KeyAgreementException("ECDH failed", e);
            }
        }
    },

    /**
     * X25519 (RFC 7748). Public keys are the 32-byte little-endian u-coordinate.
     */
    X25519("X25519", 32) {
        @Override
        public EphemeralKeyPair generate() {
            try {
                var generator = KeyPairGenerator.getInstance("X25519");
                generator.initialize(NamedParameterSpec.X25519, Crypto.SECURE_RANDOM);
                var keyPair = generator.generateKeyPair();
                var encoded = Utils.toUnsignedLittleEndian(((XECPublicKey) keyPair.getPublic()).getU(), 32);
                return new EphemeralKeyPair(this, keyPair.getPrivate(), encoded);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("X25519 key generation failed", e);
            }
        }

        @Override
        byte[] agree(PrivateKey privateKey, byte[] peerPublicKey) throws KeyAgreementException {
            checkLength(peerPublicKey);
            PublicKey peerKey;
            try {
                peerKey = KeyFactory.getInstance("X25519").generatePublic(
                        new XECPublicKeySpec(NamedParameterSpec.X25519, Utils.fromUnsignedLittleEndian(peerPublicKey)));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            } catch (InvalidKeySpecException e) {
                throw new KeyAgreementException("Invalid X25519 public key", e);
            }
            byte[] secret;
            try {
                secret = scalarMultiplication(privateKey, peerKey);
            } catch (RuntimeException e) {
                // Providers differ in how they reject degenerate points
                throw new KeyAgreementException("X25519 failed", e);
            }
            if (Utils.allZero(secret)) {
                throw new KeyAgreementException("Peer public key has low order");
            }
            return secret;
        }
    };

    private final String identifier;
    private final int publicKeyLength;

    KeyAgreementAlgorithm(String identifier, int publicKeyLength) {
        this.identifier = identifier;
        this.publicKeyLength = publicKeyLength;
    }

    /**
     * The identifier announced in handshake messages, for example {@code P-256}.
     */
    public String identifier() {
        return identifier;
    }

    public int publicKeyLength() {
        return publicKeyLength;
    }

    /**
     * Looks up an algorithm by the identifier a peer announced.
     */
    public static Optional<KeyAgreementAlgorithm> fromIdentifier(String identifier) {
        return Arrays.stream(values()).filter(alg -> alg.identifier.equals(identifier)).findFirst();
    }

    /**
     * Generates a fresh ephemeral key pair for a single handshake.
     */
    public abstract EphemeralKeyPair generate();

    /**
     * Computes the raw shared secret between the local private key and the peer's raw public key.
     *
     * @throws KeyAgreementException if the peer key is malformed or otherwise unacceptable.
     */
    abstract byte[] agree(PrivateKey privateKey, byte[] peerPublicKey) throws KeyAgreementException;

    void checkLength(byte[] peerPublicKey) throws KeyAgreementException {
        if (peerPublicKey == null || peerPublicKey.length != publicKeyLength) {
            throw new KeyAgreementException("Public key for " + identifier + " must be " + publicKeyLength +
                    " bytes");
        }
    }

    private static final class P256Curve {
        static final String CURVE_NAME = "secp256r1";
        static final ECParameterSpec PARAMS;
        static final BigInteger P;

        static {
            try {
                var parameters = AlgorithmParameters.getInstance("EC");
                parameters.init(new ECGenParameterSpec(CURVE_NAME));
                PARAMS = parameters.getParameterSpec(ECParameterSpec.class);
                P = ((ECFieldFp) PARAMS.getCurve().getField()).getP();
            } catch (NoSuchAlgorithmException | InvalidParameterSpecException e) {
                throw new AssertionError("All Java implementations must support secp256r1", e);
            }
        }

        static PublicKey decodePublicKey(byte[] encoded) throws KeyAgreementException {
            P256.checkLength(encoded);
            if (encoded[0] != 0x04) {
                throw new KeyAgreementException("Only uncompressed P-256 points are supported");
            }
            var x = new BigInteger(1, Arrays.copyOfRange(encoded, 1, 33));
            var y = new BigInteger(1, Arrays.copyOfRange(encoded, 33, 65));
            if (!isOnCurve(x, y)) {
                throw new KeyAgreementException("Point is not on the P-256 curve");
            }
            try {
                return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(new ECPoint(x, y), PARAMS));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            } catch (InvalidKeySpecException e) {
                throw new KeyAgreementException("Invalid P-256 public key", e);
            }
        }

        // P-256 has cofactor 1, so every affine point on the curve is in the prime-order group
        private static boolean isOnCurve(BigInteger x, BigInteger y) {
            if (x.compareTo(P) >= 0 || y.compareTo(P) >= 0) {
                return false;
            }
            var curve = PARAMS.getCurve();
            var lhs = y.multiply(y).mod(P);
            var rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(P);
            return lhs.equals(rhs);
        }
    }
}
