package com.questrail.bhumi.relay.internal.decode;

/**
 * Indicates that a well-framed {@code RelayFrame} could not be translated into
 * a valid semantic relay message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown or unsupported frame type</li>
 *   <li>A payload that is truncated or longer than its declared fields</li>
 *   <li>A field value outside its legal range</li>
 * </ul>
 */
public final class RelayDecodeException extends RuntimeException
{
    public RelayDecodeException(String message) {
        super(message);
    }

    public RelayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
