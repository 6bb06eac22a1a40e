package com.questrail.bhumi.relay.internal.decode;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Bounds-checked big-endian cursor over a frame payload.
 *
 * <p>Every read that would run past the end raises {@link RelayDecodeException}
 * naming the message being decoded.</p>
 */
final class PayloadReader
{
    private final String message;
    private final byte[] data;
    private int pos;

    PayloadReader(String message, byte[] data) {
        this.message = message;
        this.data = data;
    }

    int u8() {
        require(1, "u8");
        return data[pos++] & 0xFF;
    }

    int u16() {
        require(2, "u16");
        int v = ((data[pos] & 0xFF) << 8) | (data[pos + 1] & 0xFF);
        pos += 2;
        return v;
    }

    long u32() {
        require(4, "u32");
        long v = ((long) (data[pos] & 0xFF) << 24)
                | ((data[pos + 1] & 0xFF) << 16)
                | ((data[pos + 2] & 0xFF) << 8)
                | (data[pos + 3] & 0xFF);
        pos += 4;
        return v;
    }

    long i64() {
        require(8, "i64");
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (data[pos + i] & 0xFF);
        }
        pos += 8;
        return v;
    }

    byte[] fixed(int length, String field) {
        require(length, field);
        byte[] out = Arrays.copyOfRange(data, pos, pos + length);
        pos += length;
        return out;
    }

    /**
     * Reads a {@code u32} length followed by that many bytes.
     */
    byte[] lengthPrefixed(String field) {
        long len = u32();
        if (len > remaining()) {
            throw new RelayDecodeException(message + " " + field + " truncated: declared "
                    + len + " bytes, " + remaining() + " available");
        }
        return fixed((int) len, field);
    }

    String utf8(int length, String field) {
        byte[] raw = fixed(length, field);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RelayDecodeException(message + " " + field + " is not valid UTF-8", e);
        }
    }

    int remaining() {
        return data.length - pos;
    }

    void requireFullyConsumed() {
        if (pos != data.length) {
            throw new RelayDecodeException(message + " has " + remaining() + " trailing bytes");
        }
    }

    private void require(int n, String field) {
        if (remaining() < n) {
            throw new RelayDecodeException(message + " truncated reading " + field);
        }
    }
}
