package com.questrail.bhumi.relay.model;

import java.util.Optional;

/**
 * Frame type codes of the relay protocol.
 */
public enum RelayMessageType
{
    HELLO(0x01),
    I_AM(0x02),
    SEND(0x03),
    DELIVER(0x04),
    ACK(0x05),
    KEEPALIVE(0x06),
    SEND_RESULT(0x07),
    PRESENCE(0x08);

    private final int code;

    RelayMessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<RelayMessageType> fromCode(int code) {
        for (RelayMessageType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
