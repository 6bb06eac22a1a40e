package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.model.RelayMessage;

/**
 * RelayConnection
 * =============================================================================
 * What the relay core needs from a live device connection: a challenge nonce,
 * a way to push messages, and a way to end it.
 *
 * <p>Implemented by the per-connection session in production and by recording
 * fakes in tests. Transport types never appear here.</p>
 */
public interface RelayConnection {
    /**
     * The nonce sent to this connection in HELLO; an identity claim must sign it.
     */
    int challengeNonce();

    /**
     * Whether the connection can still carry frames. Once {@code false}, it
     * never becomes {@code true} again.
     */
    boolean isOpen();

    /**
     * Queue a message for this connection. Messages sent to a closed
     * connection are dropped.
     */
    void send(RelayMessage message);

    /**
     * Close the connection. Idempotent.
     */
    void close(String reason);
}
