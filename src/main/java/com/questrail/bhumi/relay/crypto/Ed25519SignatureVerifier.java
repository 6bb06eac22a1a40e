package com.questrail.bhumi.relay.crypto;

import com.questrail.bhumi.relay.api.Id52;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Objects;

/**
 * Ed25519 {@link SignatureVerifier} backed by BouncyCastle's lightweight API.
 *
 * <p>Stateless; a fresh {@link Ed25519Signer} is created per call, so a single
 * instance is safe to share across event loops.</p>
 */
public final class Ed25519SignatureVerifier implements SignatureVerifier {
    public static final int SIGNATURE_LENGTH = 64;

    @Override
    public boolean verify(Id52 signer, byte[] message, byte[] signature) {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(message, "message");
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }

        final Ed25519PublicKeyParameters key;
        try {
            key = new Ed25519PublicKeyParameters(signer.bytes(), 0);
        } catch (IllegalArgumentException e) {
            // not a point on the curve
            return false;
        }

        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, key);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }
}
