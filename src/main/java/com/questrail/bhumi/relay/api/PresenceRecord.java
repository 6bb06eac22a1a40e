package com.questrail.bhumi.relay.api;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * PresenceRecord
 * =============================================================================
 * Signed, TTL-bounded claim by an identity that it is currently reachable
 * through the named relay.
 *
 * <p>The relay stores and forwards these records but never mints, renews or
 * alters them: {@code issuedAt} and {@code ttl} are exactly what the issuer
 * signed.</p>
 *
 * @param id52      issuing identity
 * @param relayId   free-form identifier of the relay the issuer is attached to
 * @param issuedAt  wall-clock issue time, millisecond precision
 * @param ttl       lifetime from {@code issuedAt}, whole seconds
 * @param signature Ed25519 signature by {@code id52} over {@link #signedBytes()}
 */
public record PresenceRecord(Id52 id52, String relayId, Instant issuedAt, Duration ttl, byte[] signature) {
    public static final int SIGNATURE_LENGTH = 64;

    public PresenceRecord {
        Objects.requireNonNull(id52, "id52");
        Objects.requireNonNull(relayId, "relayId");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(signature, "signature");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative");
        }
        if (signature.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        if (relayId.getBytes(StandardCharsets.UTF_8).length > 0xFFFF) {
            throw new IllegalArgumentException("relayId too long");
        }
    }

    public Instant expiresAt() {
        return issuedAt.plus(ttl);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }

    /**
     * The byte string covered by the signature: every wire field of the record
     * that precedes the signature, in wire order.
     */
    public byte[] signedBytes() {
        byte[] relay = relayId.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(Id52.LENGTH + 2 + relay.length + 12);
        out.writeBytes(id52.bytes());
        out.write(relay.length >>> 8);
        out.write(relay.length);
        out.writeBytes(relay);
        out.writeBytes(ByteBuffer.allocate(12)
                .putLong(issuedAt.toEpochMilli())
                .putInt((int) ttl.getSeconds())
                .array());
        return out.toByteArray();
    }
}
