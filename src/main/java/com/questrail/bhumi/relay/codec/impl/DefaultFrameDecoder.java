package com.questrail.bhumi.relay.codec.impl;

import com.questrail.bhumi.relay.codec.FrameDecoder;
import com.questrail.bhumi.relay.codec.FramingException;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Streaming implementation of {@link FrameDecoder}.
 *
 * <p>The decoder alternates between two states:</p>
 * <ol>
 *   <li>Collecting the six header bytes</li>
 *   <li>Collecting exactly {@code length} payload bytes</li>
 * </ol>
 *
 * <p>The declared length is checked against {@code maxPayload} as soon as the
 * header is complete, so an implausible length is rejected before a single
 * payload byte is buffered. Total buffering is therefore bounded by
 * {@code 6 + maxPayload}.</p>
 *
 * <p>Not thread-safe. A Netty channel delivers reads on one event loop, which is
 * the only caller.</p>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    private final int maxPayload;

    private final byte[] header = new byte[RelayFraming.HEADER_LENGTH];
    private int headerFill;

    private int pendingType = -1;
    private byte[] payload;
    private int payloadFill;

    private String poisonedBy;

    public DefaultFrameDecoder() {
        this(RelayFraming.DEFAULT_MAX_PAYLOAD);
    }

    public DefaultFrameDecoder(int maxPayload) {
        this.maxPayload = RelayFraming.checkMaxPayload(maxPayload);
    }

    @Override
    public List<RelayFrame> feed(byte[] chunk) throws FramingException {
        if (poisonedBy != null) {
            throw new FramingException("decoder unusable after earlier failure: " + poisonedBy);
        }
        if (chunk == null) {
            throw poison("null chunk");
        }

        List<RelayFrame> frames = new ArrayList<>(1);
        int pos = 0;
        while (pos < chunk.length) {
            if (payload == null) {
                int take = Math.min(RelayFraming.HEADER_LENGTH - headerFill, chunk.length - pos);
                System.arraycopy(chunk, pos, header, headerFill, take);
                headerFill += take;
                pos += take;

                if (headerFill < RelayFraming.HEADER_LENGTH) {
                    break;
                }
                startPayload();
                if (payload.length == 0) {
                    frames.add(completeFrame());
                }
                continue;
            }

            int take = Math.min(payload.length - payloadFill, chunk.length - pos);
            System.arraycopy(chunk, pos, payload, payloadFill, take);
            payloadFill += take;
            pos += take;

            if (payloadFill == payload.length) {
                frames.add(completeFrame());
            }
        }
        return frames;
    }

    @Override
    public int bufferedBytes() {
        return headerFill + payloadFill;
    }

    private void startPayload() throws FramingException {
        int type = RelayFraming.readU16(header, 0);
        long length = RelayFraming.readU32(header, 2);

        if (length > maxPayload) {
            throw poison("declared length " + length + " exceeds maximum " + maxPayload);
        }
        pendingType = type;
        payload = new byte[(int) length];
        payloadFill = 0;
    }

    private RelayFrame completeFrame() {
        RelayFrame frame = new RelayFrame(pendingType, payload);
        Arrays.fill(header, (byte) 0);
        headerFill = 0;
        pendingType = -1;
        payload = null;
        payloadFill = 0;
        return frame;
    }

    private FramingException poison(String reason) {
        poisonedBy = reason;
        payload = null;
        headerFill = 0;
        payloadFill = 0;
        return new FramingException(reason);
    }
}
