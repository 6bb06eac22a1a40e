package com.questrail.bhumi.relay.testing;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.PresenceRecord;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;

/**
 * A device key pair for tests.
 */
public final class TestIdentity {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Ed25519PrivateKeyParameters privateKey;
    private final Id52 id52;

    private TestIdentity(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.id52 = Id52.of(privateKey.generatePublicKey().getEncoded());
    }

    public static TestIdentity generate() {
        return new TestIdentity(new Ed25519PrivateKeyParameters(RANDOM));
    }

    public Id52 id52() {
        return id52;
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    /**
     * Signature proving ownership of this identity to a connection that sent {@code nonce}.
     */
    public byte[] prove(int nonce) {
        return sign(ConnectionRegistry.challenge(nonce, id52));
    }

    public PresenceRecord presence(String relayId, Instant issuedAt, Duration ttl) {
        PresenceRecord unsigned = new PresenceRecord(id52, relayId, issuedAt, ttl, new byte[PresenceRecord.SIGNATURE_LENGTH]);
        return new PresenceRecord(id52, relayId, issuedAt, ttl, sign(unsigned.signedBytes()));
    }
}
