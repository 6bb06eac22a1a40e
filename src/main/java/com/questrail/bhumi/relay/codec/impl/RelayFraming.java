package com.questrail.bhumi.relay.codec.impl;

/**
 * RelayFraming
 * -----------------------------------------------------------------------------
 * Constants of the relay's length-prefixed framing.
 *
 * <p>The header is a big-endian {@code u16} type followed by a big-endian
 * {@code u32} payload length. Payloads follow immediately; there is no
 * terminator or checksum (integrity is the job of the transport and of the
 * end-to-end payload encryption).</p>
 */
public final class RelayFraming
{
    /** Size of the {@code type ‖ length} header in bytes. */
    static final int HEADER_LENGTH = 6;

    /** Default maximum payload size advertised in HELLO (64 KiB). */
    public static final int DEFAULT_MAX_PAYLOAD = 64 * 1024;

    /** Absolute ceiling for any configured maximum (1 MiB). */
    public static final int ABSOLUTE_MAX_PAYLOAD = 1024 * 1024;

    private RelayFraming() {}

    static int readU16(byte[] b, int off) {
        return ((b[off] & 0xFF) << 8) | (b[off + 1] & 0xFF);
    }

    static long readU32(byte[] b, int off) {
        return ((long) (b[off] & 0xFF) << 24)
                | ((b[off + 1] & 0xFF) << 16)
                | ((b[off + 2] & 0xFF) << 8)
                | (b[off + 3] & 0xFF);
    }

    static void writeHeader(byte[] out, int type, int length) {
        out[0] = (byte) (type >>> 8);
        out[1] = (byte) type;
        out[2] = (byte) (length >>> 24);
        out[3] = (byte) (length >>> 16);
        out[4] = (byte) (length >>> 8);
        out[5] = (byte) length;
    }

    public static int checkMaxPayload(int maxPayload) {
        if (maxPayload <= 0 || maxPayload > ABSOLUTE_MAX_PAYLOAD) {
            throw new IllegalArgumentException(
                    "maxPayload must be in 1.." + ABSOLUTE_MAX_PAYLOAD + ", got " + maxPayload);
        }
        return maxPayload;
    }
}
