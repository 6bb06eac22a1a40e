package com.questrail.bhumi.relay.codec.impl;

import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultFrameEncoderTest
{
    @Test
    void writesSixByteHeaderFollowedByPayload() {
        byte[] wire = new DefaultFrameEncoder().encode(new RelayFrame(0x0304, new byte[] { 5, 6 }));

        assertArrayEquals(new byte[] { 0x03, 0x04, 0, 0, 0, 2, 5, 6 }, wire);
    }

    @Test
    void refusesPayloadAboveMaximum() {
        DefaultFrameEncoder encoder = new DefaultFrameEncoder(8);

        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(new RelayFrame(0x03, new byte[9])));
    }

    @Test
    void rejectsUnreasonableMaximum() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultFrameEncoder(0));
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultFrameEncoder(RelayFraming.ABSOLUTE_MAX_PAYLOAD + 1));
    }
}
