package com.questrail.bhumi.relay.internal.encode;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.PresenceRecord;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import com.questrail.bhumi.relay.model.*;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * RelayMessageEncoder
 * =============================================================================
 * Converts a semantic {@link RelayMessage} into a {@link RelayFrame}.
 *
 * <p>Mirror image of {@code RelayMessageDecoder}. The encoder does not enforce
 * the maximum payload size; the frame encoder does.</p>
 */
public final class RelayMessageEncoder
{
    public RelayFrame encode(RelayMessage message) {
        Objects.requireNonNull(message, "message");

        byte[] payload = switch (message.type()) {
            case HELLO -> encodeHello((Hello) message);
            case I_AM -> encodeIAm((IAm) message);
            case SEND -> encodeSend((Send) message);
            case DELIVER -> encodeCorrelated(((Deliver) message).correlationId(), ((Deliver) message).payload());
            case ACK -> encodeCorrelated(((Ack) message).correlationId(), ((Ack) message).payload());
            case KEEPALIVE -> new byte[0];
            case SEND_RESULT -> encodeSendResult((SendResult) message);
            case PRESENCE -> encodePresence(((Presence) message).record());
        };
        return new RelayFrame(message.type().code(), payload);
    }

    private static byte[] encodeHello(Hello hello) {
        Writer w = new Writer(9);
        w.u8(hello.version());
        w.u32(hello.nonce());
        w.u32(hello.maxPayloadSize());
        return w.toByteArray();
    }

    private static byte[] encodeIAm(IAm iAm) {
        Writer w = new Writer(32 + 64 + 4 + iAm.commits().size() * Commit.LENGTH);
        w.bytes(iAm.id52().bytes());
        w.bytes(iAm.signature());
        w.u16(iAm.commits().size());
        for (Commit c : iAm.commits()) {
            w.bytes(c.bytes());
        }
        w.u16(iAm.recentResponses().size());
        for (IAm.RecentResponse r : iAm.recentResponses()) {
            w.bytes(r.preimage().bytes());
            w.lengthPrefixed(r.response());
        }
        return w.toByteArray();
    }

    private static byte[] encodeSend(Send send) {
        Writer w = new Writer(68 + send.payload().length);
        w.bytes(send.to().bytes());
        w.bytes(send.preimage().bytes());
        w.lengthPrefixed(send.payload());
        return w.toByteArray();
    }

    private static byte[] encodeCorrelated(long correlationId, byte[] payload) {
        Writer w = new Writer(8 + payload.length);
        w.u32((int) correlationId);
        w.lengthPrefixed(payload);
        return w.toByteArray();
    }

    private static byte[] encodeSendResult(SendResult result) {
        Writer w = new Writer(5 + result.payload().length);
        w.u8(result.status().code());
        w.lengthPrefixed(result.payload());
        return w.toByteArray();
    }

    private static byte[] encodePresence(PresenceRecord record) {
        Writer w = new Writer(160);
        // signedBytes() is every field before the signature, in wire order
        w.bytes(record.signedBytes());
        w.bytes(record.signature());
        return w.toByteArray();
    }

    private static final class Writer {
        private final ByteArrayOutputStream out;

        Writer(int sizeHint) {
            this.out = new ByteArrayOutputStream(sizeHint);
        }

        void u8(int v) {
            out.write(v);
        }

        void u16(int v) {
            if (v > 0xFFFF) {
                throw new IllegalArgumentException("count does not fit in u16: " + v);
            }
            out.write(v >>> 8);
            out.write(v);
        }

        void u32(int v) {
            out.write(v >>> 24);
            out.write(v >>> 16);
            out.write(v >>> 8);
            out.write(v);
        }

        void bytes(byte[] b) {
            out.writeBytes(b);
        }

        void lengthPrefixed(byte[] b) {
            u32(b.length);
            bytes(b);
        }

        byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
