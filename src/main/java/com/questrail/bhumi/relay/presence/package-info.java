/**
 * Signed presence hints and their gossip to connected peers.
 */
package com.questrail.bhumi.relay.presence;
