/**
 * Relay Codec: Concrete Implementation
 * =============================================================================
 *
 * <pre>
 *   byte[] chunk
 *        → DefaultFrameDecoder  (header accumulation, length check, payload accumulation)
 *        → RelayFrame
 * </pre>
 *
 * <p>This codec layer is strictly transport-agnostic and semantics-free.
 * Any failure here results in the connection being closed.</p>
 */
package com.questrail.bhumi.relay.codec.impl;
