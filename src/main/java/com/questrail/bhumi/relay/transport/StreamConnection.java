package com.questrail.bhumi.relay.transport;

import java.net.SocketAddress;

/**
 * One accepted connection of a {@link StreamEndpoint}.
 *
 * <p>An endpoint hands the same instance to every callback for a connection.
 * Implementations keep identity equality; listeners key per-connection state
 * on the instance.</p>
 */
public interface StreamConnection
{
    /**
     * Id for logs, stable for the life of the connection.
     */
    String id();

    SocketAddress remoteAddress();

    /**
     * Queue bytes for writing. Thread-safe; bytes written by one thread are sent
     * in call order. Writes to a closed connection are dropped.
     */
    void write(byte[] bytes);

    /**
     * Close the connection. Idempotent.
     */
    void close();

    boolean isOpen();
}
