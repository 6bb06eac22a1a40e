package com.questrail.bhumi.relay.model;

/**
 * Relay → client greeting sent as soon as a connection opens.
 *
 * @param version         protocol version, currently {@value #CURRENT_VERSION}
 * @param nonce           per-connection challenge the client must sign in I_AM
 * @param maxPayloadSize  largest frame payload the relay will accept
 */
public record Hello(int version, int nonce, int maxPayloadSize) implements RelayMessage
{
    public static final int CURRENT_VERSION = 1;

    public Hello {
        if (version < 0 || version > 0xFF) {
            throw new IllegalArgumentException("version must fit in u8");
        }
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive");
        }
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.HELLO;
    }
}
