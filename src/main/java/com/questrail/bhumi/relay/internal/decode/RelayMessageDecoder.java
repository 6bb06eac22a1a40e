package com.questrail.bhumi.relay.internal.decode;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.api.PresenceRecord;
import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import com.questrail.bhumi.relay.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RelayMessageDecoder
 * ============================================================================
 * Converts a {@link RelayFrame} into a semantic {@link RelayMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between frame mechanics (type codes, payload byte
 * layout) and relay semantics. Everything above it reasons about
 * {@link RelayMessage} values only.
 *
 * <h2>Strictness</h2>
 * A payload must be consumed exactly: truncated fields and trailing bytes are
 * both rejected. Relay-to-client types (HELLO, DELIVER, SEND_RESULT) are
 * decodable too, so the same decoder serves test clients.
 */
public final class RelayMessageDecoder
{
    /**
     * Decodes a frame into a semantic message.
     *
     * @throws RelayDecodeException if the frame type is unknown or the payload
     *         does not match the layout of its type
     */
    public RelayMessage decode(RelayFrame frame) {
        Objects.requireNonNull(frame, "frame");

        RelayMessageType type = RelayMessageType.fromCode(frame.type())
                .orElseThrow(() -> new RelayDecodeException(
                        "Unknown relay frame type: 0x" + Integer.toHexString(frame.type())));

        RelayMessage message = switch (type) {
            case HELLO -> decodeHello(frame.payload());
            case I_AM -> decodeIAm(frame.payload());
            case SEND -> decodeSend(frame.payload());
            case DELIVER -> decodeDeliver(frame.payload());
            case ACK -> decodeAck(frame.payload());
            case KEEPALIVE -> decodeKeepalive(frame.payload());
            case SEND_RESULT -> decodeSendResult(frame.payload());
            case PRESENCE -> decodePresence(frame.payload());
        };
        return message;
    }

    private Hello decodeHello(byte[] payload) {
        PayloadReader r = new PayloadReader("HELLO", payload);
        int version = r.u8();
        int nonce = (int) r.u32();
        long max = r.u32();
        r.requireFullyConsumed();
        if (max == 0 || max > Integer.MAX_VALUE) {
            throw new RelayDecodeException("HELLO max payload size out of range: " + max);
        }
        return new Hello(version, nonce, (int) max);
    }

    private IAm decodeIAm(byte[] payload) {
        PayloadReader r = new PayloadReader("I_AM", payload);
        Id52 id52 = Id52.of(r.fixed(Id52.LENGTH, "id52"));
        byte[] signature = r.fixed(IAm.SIGNATURE_LENGTH, "signature");

        int commitCount = r.u16();
        if ((long) commitCount * Commit.LENGTH > r.remaining()) {
            throw new RelayDecodeException("I_AM commits truncated");
        }
        List<Commit> commits = new ArrayList<>(commitCount);
        for (int i = 0; i < commitCount; i++) {
            commits.add(Commit.of(r.fixed(Commit.LENGTH, "commit")));
        }

        int responseCount = r.u16();
        List<IAm.RecentResponse> responses = new ArrayList<>(Math.min(responseCount, 64));
        for (int i = 0; i < responseCount; i++) {
            Preimage preimage = Preimage.of(r.fixed(Preimage.LENGTH, "response preimage"));
            byte[] response = r.lengthPrefixed("response");
            responses.add(new IAm.RecentResponse(preimage, response));
        }
        r.requireFullyConsumed();
        return new IAm(id52, signature, commits, responses);
    }

    private Send decodeSend(byte[] payload) {
        PayloadReader r = new PayloadReader("SEND", payload);
        Id52 to = Id52.of(r.fixed(Id52.LENGTH, "to"));
        Preimage preimage = Preimage.of(r.fixed(Preimage.LENGTH, "preimage"));
        byte[] body = r.lengthPrefixed("payload");
        r.requireFullyConsumed();
        return new Send(to, preimage, body);
    }

    private Deliver decodeDeliver(byte[] payload) {
        PayloadReader r = new PayloadReader("DELIVER", payload);
        long correlationId = r.u32();
        byte[] body = r.lengthPrefixed("payload");
        r.requireFullyConsumed();
        return new Deliver(correlationId, body);
    }

    private Ack decodeAck(byte[] payload) {
        PayloadReader r = new PayloadReader("ACK", payload);
        long correlationId = r.u32();
        byte[] body = r.lengthPrefixed("payload");
        r.requireFullyConsumed();
        return new Ack(correlationId, body);
    }

    private Keepalive decodeKeepalive(byte[] payload) {
        if (payload.length != 0) {
            throw new RelayDecodeException("KEEPALIVE must not carry payload bytes");
        }
        return Keepalive.INSTANCE;
    }

    private SendResult decodeSendResult(byte[] payload) {
        PayloadReader r = new PayloadReader("SEND_RESULT", payload);
        int code = r.u8();
        byte[] body = r.lengthPrefixed("payload");
        r.requireFullyConsumed();
        try {
            return new SendResult(SendStatus.fromCode(code), body);
        } catch (IllegalArgumentException e) {
            throw new RelayDecodeException("SEND_RESULT status invalid", e);
        }
    }

    private Presence decodePresence(byte[] payload) {
        PayloadReader r = new PayloadReader("PRESENCE", payload);
        Id52 id52 = Id52.of(r.fixed(Id52.LENGTH, "id52"));
        int relayIdLength = r.u16();
        String relayId = r.utf8(relayIdLength, "relayId");
        long issuedAtMillis = r.i64();
        long ttlSeconds = r.u32();
        byte[] signature = r.fixed(PresenceRecord.SIGNATURE_LENGTH, "signature");
        r.requireFullyConsumed();
        return new Presence(new PresenceRecord(
                id52,
                relayId,
                Instant.ofEpochMilli(issuedAtMillis),
                Duration.ofSeconds(ttlSeconds),
                signature));
    }
}
