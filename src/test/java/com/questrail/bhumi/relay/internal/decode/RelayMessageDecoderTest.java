package com.questrail.bhumi.relay.internal.decode;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.api.PresenceRecord;
import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.internal.encode.RelayMessageEncoder;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import com.questrail.bhumi.relay.model.*;
import com.questrail.bhumi.relay.testing.Preimages;
import com.questrail.bhumi.relay.testing.TestIdentity;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RelayMessageDecoderTest
 * -----------------------------------------------------------------------------
 * Payload layouts per message type and strict rejection of malformed payloads.
 */
final class RelayMessageDecoderTest
{
    private final RelayMessageDecoder decoder = new RelayMessageDecoder();
    private final RelayMessageEncoder encoder = new RelayMessageEncoder();

    @Test
    void decodesSendLayout() {
        byte[] to = filled(32, (byte) 0x11);
        byte[] preimage = filled(32, (byte) 0x22);
        byte[] payload = ByteBuffer.allocate(32 + 32 + 4 + 3)
                .put(to).put(preimage).putInt(3).put(new byte[] { 7, 8, 9 })
                .array();

        RelayMessage m = decoder.decode(new RelayFrame(0x03, payload));

        Send send = assertInstanceOf(Send.class, m);
        assertEquals(Id52.of(to), send.to());
        assertEquals(Preimage.of(preimage), send.preimage());
        assertArrayEquals(new byte[] { 7, 8, 9 }, send.payload());
    }

    @Test
    void decodesAckWithUnsignedCorrelationId() {
        byte[] payload = ByteBuffer.allocate(4 + 4 + 1)
                .putInt(0xFFFF_FFFE).putInt(1).put((byte) 0x55)
                .array();

        Ack ack = assertInstanceOf(Ack.class, decoder.decode(new RelayFrame(0x05, payload)));

        assertEquals(0xFFFF_FFFEL, ack.correlationId());
        assertArrayEquals(new byte[] { 0x55 }, ack.payload());
    }

    @Test
    void decodesIAmWithCommitsAndRecentResponses() {
        TestIdentity alice = TestIdentity.generate();
        Preimage p1 = Preimages.random();
        Preimage p2 = Preimages.random();
        IAm original = new IAm(alice.id52(), alice.prove(1234),
                List.of(Preimages.commitOf(p1)),
                List.of(new IAm.RecentResponse(p2, new byte[] { 1, 2 })));

        IAm decoded = assertInstanceOf(IAm.class, decoder.decode(encoder.encode(original)));

        assertEquals(alice.id52(), decoded.id52());
        assertArrayEquals(original.signature(), decoded.signature());
        assertEquals(List.of(Preimages.commitOf(p1)), decoded.commits());
        assertEquals(1, decoded.recentResponses().size());
        assertEquals(p2, decoded.recentResponses().get(0).preimage());
        assertArrayEquals(new byte[] { 1, 2 }, decoded.recentResponses().get(0).response());
    }

    @Test
    void decodesPresenceAndKeepsSignedFieldsIntact() {
        TestIdentity alice = TestIdentity.generate();
        PresenceRecord record = alice.presence("relay-eu-1", Instant.ofEpochMilli(1_700_000_000_123L), Duration.ofSeconds(60));

        Presence decoded = assertInstanceOf(Presence.class, decoder.decode(encoder.encode(new Presence(record))));

        assertEquals(record.id52(), decoded.record().id52());
        assertEquals("relay-eu-1", decoded.record().relayId());
        assertEquals(record.issuedAt(), decoded.record().issuedAt());
        assertEquals(record.ttl(), decoded.record().ttl());
        assertArrayEquals(record.signedBytes(), decoded.record().signedBytes());
    }

    @Test
    void helloCarriesVersionNonceAndMaxPayload() {
        RelayFrame frame = encoder.encode(new Hello(Hello.CURRENT_VERSION, 0xCAFEBABE, 65536));

        assertEquals(0x01, frame.type());
        assertArrayEquals(new byte[] { 1, (byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE, 0, 1, 0, 0 },
                frame.payload());
    }

    @Test
    void sendResultCarriesStatusCode() {
        RelayFrame frame = encoder.encode(SendResult.failure(SendStatus.RECIPIENT_TIMEOUT));

        assertEquals(0x07, frame.type());
        assertArrayEquals(new byte[] { 3, 0, 0, 0, 0 }, frame.payload());
    }

    @Test
    void rejectsTruncatedSend() {
        byte[] payload = new byte[32 + 32 + 2];

        assertThrows(RelayDecodeException.class, () -> decoder.decode(new RelayFrame(0x03, payload)));
    }

    @Test
    void rejectsLengthPrefixPastEndOfPayload() {
        byte[] payload = ByteBuffer.allocate(4 + 4 + 1).putInt(7).putInt(100).put((byte) 1).array();

        assertThrows(RelayDecodeException.class, () -> decoder.decode(new RelayFrame(0x05, payload)));
    }

    @Test
    void rejectsTrailingBytes() {
        byte[] payload = ByteBuffer.allocate(4 + 4 + 1 + 1).putInt(7).putInt(1).put((byte) 1).put((byte) 2).array();

        assertThrows(RelayDecodeException.class, () -> decoder.decode(new RelayFrame(0x05, payload)));
    }

    @Test
    void rejectsKeepaliveWithPayload() {
        assertThrows(RelayDecodeException.class, () -> decoder.decode(new RelayFrame(0x06, new byte[] { 0 })));
    }

    @Test
    void rejectsIAmWithMoreCommitsThanBytes() {
        byte[] payload = ByteBuffer.allocate(32 + 64 + 2)
                .put(new byte[96]).putShort((short) 5)
                .array();

        assertThrows(RelayDecodeException.class, () -> decoder.decode(new RelayFrame(0x02, payload)));
    }

    @Test
    void unknownTypeIsADecodeError() {
        assertThrows(RelayDecodeException.class, () -> decoder.decode(RelayFrame.empty(0x7F)));
    }

    @Test
    void commitListIsReturnedInWireOrder() {
        Commit a = Commit.of(filled(32, (byte) 1));
        Commit b = Commit.of(filled(32, (byte) 2));
        IAm iam = new IAm(Id52.of(new byte[32]), new byte[64], List.of(b, a), List.of());

        IAm decoded = (IAm) decoder.decode(encoder.encode(iam));

        assertEquals(List.of(b, a), decoded.commits());
    }

    private static byte[] filled(int n, byte v) {
        byte[] b = new byte[n];
        Arrays.fill(b, v);
        return b;
    }
}
