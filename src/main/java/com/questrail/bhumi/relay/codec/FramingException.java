package com.questrail.bhumi.relay.codec;

/**
 * Raised when the inbound byte stream violates relay framing.
 *
 * <p>A framing error is always fatal to the connection it occurred on; there is
 * no resynchronisation point in a length-prefixed stream.</p>
 */
public final class FramingException extends Exception
{
    public FramingException(String message) {
        super(message);
    }
}
