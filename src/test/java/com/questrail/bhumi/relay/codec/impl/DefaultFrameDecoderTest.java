package com.questrail.bhumi.relay.codec.impl;

import com.questrail.bhumi.relay.codec.FramingException;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Streaming behavior of {@link DefaultFrameDecoder}: chunking, bounds and the
 * fatal nature of framing errors.
 */
final class DefaultFrameDecoderTest
{
    private final DefaultFrameEncoder encoder = new DefaultFrameEncoder();

    @Test
    void decodesSingleFrameDeliveredWhole() throws FramingException {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder();
        byte[] wire = encoder.encode(new RelayFrame(0x03, new byte[] { 1, 2, 3 }));

        List<RelayFrame> frames = decoder.feed(wire);

        assertEquals(1, frames.size());
        assertEquals(0x03, frames.get(0).type());
        assertArrayEquals(new byte[] { 1, 2, 3 }, frames.get(0).payload());
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    void headerLayoutIsTypeThenLengthBigEndian() throws FramingException {
        byte[] wire = { 0x00, 0x07, 0x00, 0x00, 0x00, 0x02, 0x0A, 0x0B };

        List<RelayFrame> frames = new DefaultFrameDecoder().feed(wire);

        assertEquals(1, frames.size());
        assertEquals(0x07, frames.get(0).type());
        assertArrayEquals(new byte[] { 0x0A, 0x0B }, frames.get(0).payload());
    }

    @Test
    void reassemblesFramesSplitAtEveryByte() throws FramingException {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder();
        byte[] wire = concat(
                encoder.encode(new RelayFrame(0x05, new byte[] { 9, 8, 7, 6 })),
                encoder.encode(RelayFrame.empty(0x06)),
                encoder.encode(new RelayFrame(0x0102, new byte[] { 42 })));

        List<RelayFrame> frames = new ArrayList<>();
        for (byte b : wire) {
            frames.addAll(decoder.feed(new byte[] { b }));
        }

        assertEquals(3, frames.size());
        assertEquals(0x05, frames.get(0).type());
        assertArrayEquals(new byte[] { 9, 8, 7, 6 }, frames.get(0).payload());
        assertEquals(0x06, frames.get(1).type());
        assertEquals(0, frames.get(1).payload().length);
        assertEquals(0x0102, frames.get(2).type());
    }

    @Test
    void partialFrameStaysBuffered() throws FramingException {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder();
        byte[] wire = encoder.encode(new RelayFrame(0x03, new byte[10]));

        assertTrue(decoder.feed(java.util.Arrays.copyOf(wire, 9)).isEmpty());
        assertEquals(9, decoder.bufferedBytes());

        List<RelayFrame> rest = decoder.feed(java.util.Arrays.copyOfRange(wire, 9, wire.length));
        assertEquals(1, rest.size());
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    void rejectsDeclaredLengthAboveMaximumBeforeBufferingPayload() {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder(16);
        byte[] header = { 0x00, 0x03, 0x00, 0x00, 0x00, 0x11 };

        FramingException e = assertThrows(FramingException.class, () -> decoder.feed(header));
        assertTrue(e.getMessage().contains("exceeds"));
    }

    @Test
    void rejectsImplausibleU32Length() {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder();
        byte[] header = { 0x00, 0x03, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertThrows(FramingException.class, () -> decoder.feed(header));
    }

    @Test
    void decoderIsUnusableAfterFailure() {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder(16);
        assertThrows(FramingException.class,
                () -> decoder.feed(new byte[] { 0x00, 0x03, 0x00, 0x00, 0x01, 0x00 }));

        byte[] valid = encoder.encode(RelayFrame.empty(0x06));
        assertThrows(FramingException.class, () -> decoder.feed(valid));
    }

    @Test
    void acceptsPayloadExactlyAtMaximum() throws FramingException {
        DefaultFrameDecoder decoder = new DefaultFrameDecoder(16);
        byte[] wire = new DefaultFrameEncoder(16).encode(new RelayFrame(0x03, new byte[16]));

        assertEquals(1, decoder.feed(wire).size());
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.writeBytes(p);
        }
        return out.toByteArray();
    }
}
