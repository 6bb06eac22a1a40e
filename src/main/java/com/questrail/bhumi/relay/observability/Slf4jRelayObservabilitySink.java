package com.questrail.bhumi.relay.observability;

import com.questrail.bhumi.relay.api.SendStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 *
 * <p>Identities are logged in short hex form. Preimages and payloads are never logged.</p>
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onConnectionEvent(RelayConnectionEvent event) {
        String who = event.identity() != null ? event.identity().shortHex() : "-";
        switch (event.kind()) {
            case OPENED, CLOSED -> log.debug("{} {} id={} {}", event.handle(), event.kind(), who, event.detail());
            default -> log.info("{} {} id={} {}", event.handle(), event.kind(), who, event.detail());
        }
    }

    @Override
    public void onSendResolved(RelaySendEvent event) {
        if (event.status() == SendStatus.OK) {
            log.debug("SEND to {} -> {}{} (corr={})",
                event.recipient().shortHex(),
                event.status(),
                event.fromCache() ? " [cached]" : "",
                event.correlationId());
        } else {
            log.info("SEND to {} -> {} (corr={})",
                event.recipient().shortHex(),
                event.status(),
                event.correlationId());
        }
    }

    @Override
    public void onPresenceEvent(RelayPresenceEvent event) {
        if (event.kind() == RelayPresenceEvent.Kind.GOSSIP_ROUND) {
            log.debug("Presence gossip round forwarded {} records", event.count());
        } else {
            log.debug("Presence {} for {}", event.kind(),
                event.identity() != null ? event.identity().shortHex() : "-");
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        if (event.fatal()) {
            log.warn("Relay error on {} (connection closed): {}", event.handle(), event.message(), event.cause());
        } else {
            log.debug("Relay anomaly on {}: {}", event.handle(), event.message(), event.cause());
        }
    }
}
