package com.questrail.bhumi.relay.model;

/**
 * RelayMessage
 * =============================================================================
 * Sealed root of the semantic relay messages.
 *
 * <p>Messages are produced only by the message decoder (inbound) or by relay
 * logic (outbound). Transport code never sees them as bytes and protocol code
 * never sees bytes.</p>
 */
public sealed interface RelayMessage
        permits Hello, IAm, Send, Deliver, Ack, Keepalive, SendResult, Presence
{
    RelayMessageType type();
}
