package com.questrail.bhumi.relay.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a listening, connection-oriented byte-stream transport.
 *
 * <p>The endpoint accepts connections and moves bytes. Higher layers are
 * responsible for:</p>
 * <ul>
 *   <li>feeding inbound bytes into the frame decoder of the right session</li>
 *   <li>writing encoded frames back through {@link StreamConnection#write(byte[])}</li>
 *   <li>closing connections on protocol errors</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Bind the listening socket and begin accepting connections.
     *
     * <p>Returns once the socket is bound. On success the listener is notified
     * via {@link StreamEndpointListener#onTransportUp(SocketAddress)} exactly
     * once; a bind failure is thrown.</p>
     *
     * @throws TransportException if the socket cannot be bound
     */
    void start();

    /**
     * Close the listening socket and every accepted connection, and release
     * all transport resources.
     *
     * <p>The listener is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Register the listener that receives connections, bytes and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * The bound local address, once {@link #start()} has returned.
     */
    Optional<SocketAddress> localAddress();
}
