package com.questrail.bhumi.relay.transport;

import java.net.SocketAddress;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one connection are delivered serially and in order:
 * {@link #onConnectionOpened}, any number of {@link #onBytes}, then
 * {@link #onConnectionClosed}. Callbacks for different connections may run
 * concurrently.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called when the endpoint is listening.
     */
    void onTransportUp(SocketAddress localAddress);

    /**
     * Called when the endpoint stops listening.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    void onConnectionOpened(StreamConnection connection);

    /**
     * Called with bytes exactly as received. Chunk boundaries carry no meaning;
     * the payload is a copy the listener may keep.
     */
    void onBytes(StreamConnection connection, byte[] bytes);

    /**
     * Called once when the connection is gone, whichever side closed it.
     *
     * @param cause transport error that ended the connection, or {@code null}
     */
    void onConnectionClosed(StreamConnection connection, Throwable cause);
}
