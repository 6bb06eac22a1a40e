/**
 * Send resolution: cache short-circuit, capability check, forwarding and the
 * correlation of ACKs back to waiting senders.
 */
package com.questrail.bhumi.relay.internal.exec;
