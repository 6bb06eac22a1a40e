package com.questrail.bhumi.relay.api;

/**
 * SendStatus
 * =============================================================================
 * Terminal outcome of a SEND, as carried in the status byte of SEND_RESULT.
 *
 * <p>Every accepted SEND resolves to exactly one of these values.</p>
 */
public enum SendStatus {
    /** Recipient acknowledged (or the answer was already cached). */
    OK(0),

    /** No live connection is bound to the recipient identity. */
    RECIPIENT_OFFLINE(1),

    /** Preimage does not match an unconsumed commit of the recipient. */
    INVALID_CAPABILITY(2),

    /** Recipient was reached but did not acknowledge before the deadline. */
    RECIPIENT_TIMEOUT(3),

    /** Recipient connection closed after delivery and before acknowledgment. */
    RECIPIENT_DISCONNECTED(4);

    private final int code;

    SendStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps a wire status byte back to its enum value.
     *
     * @throws IllegalArgumentException if the code is not a known status
     */
    public static SendStatus fromCode(int code) {
        for (SendStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown SEND_RESULT status: " + code);
    }
}
