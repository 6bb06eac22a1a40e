/**
 * Relay Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the relay
 * protocol: the boundary between raw transport bytes and {@link
 * com.questrail.bhumi.relay.internal.frame.RelayFrame} values.</p>
 *
 * <h2>Wire format</h2>
 * <pre>
 *   +---------+-----------+--------------------+
 *   | u16 type| u32 length| payload[length]    |
 *   +---------+-----------+--------------------+
 *   big-endian, no padding, no terminator
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (TCP read)
 *        → FrameDecoder            (framing rules applied here)
 *            → RelayFrame
 *                → RelayMessageDecoder
 *                    → RelayMessage
 * </pre>
 *
 * <p>Any {@link com.questrail.bhumi.relay.codec.FramingException} is fatal to
 * the connection. The codec never tries to skip ahead to a later frame.</p>
 */
package com.questrail.bhumi.relay.codec;
