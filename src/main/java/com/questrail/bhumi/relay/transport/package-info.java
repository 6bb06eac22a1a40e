/**
 * Relay Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP, a test double) and the relay sessions.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw inbound bytes as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Connection and transport lifecycle notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode frames or messages</li>
 *   <li>Not schedule timeouts</li>
 * </ul>
 */
package com.questrail.bhumi.relay.transport;
