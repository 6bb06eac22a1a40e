package com.questrail.bhumi.relay.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * RelayTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration of the relay.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>sendTimeout</b>: How long a forwarded SEND waits for the recipient's
 *       ACK before resolving as a recipient timeout.</li>
 *   <li><b>responseCacheTtl</b>: Lifetime of a cached response, both for ACK
 *       payloads and for responses re-uploaded in I_AM.</li>
 *   <li><b>cacheSweepInterval</b>: Period of the background sweep that removes
 *       expired cache entries nobody asked for.</li>
 *   <li><b>idleTimeout</b>: Connections with no inbound bytes for this long are
 *       closed. KEEPALIVE counts as inbound bytes.</li>
 *   <li><b>gossipInterval</b>: Period of presence gossip rounds.</li>
 * </ul>
 */
public record RelayTimingPolicy(
        Duration sendTimeout,
        Duration responseCacheTtl,
        Duration cacheSweepInterval,
        Duration idleTimeout,
        Duration gossipInterval
) {
    public RelayTimingPolicy {
        requirePositive(sendTimeout, "sendTimeout");
        requirePositive(responseCacheTtl, "responseCacheTtl");
        requirePositive(cacheSweepInterval, "cacheSweepInterval");
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(gossipInterval, "gossipInterval");
    }

    /**
     * Creates a policy with only the send timeout changed from the defaults.
     */
    public static RelayTimingPolicy withSendTimeout(Duration sendTimeout) {
        RelayTimingPolicy d = defaults();
        return new RelayTimingPolicy(
                sendTimeout,
                d.responseCacheTtl(),
                d.cacheSweepInterval(),
                d.idleTimeout(),
                d.gossipInterval()
        );
    }

    /**
     * Default values:
     * <ul>
     *   <li>sendTimeout: 30s</li>
     *   <li>responseCacheTtl: 5min</li>
     *   <li>cacheSweepInterval: 30s</li>
     *   <li>idleTimeout: 90s</li>
     *   <li>gossipInterval: 15s</li>
     * </ul>
     */
    public static RelayTimingPolicy defaults() {
        return new RelayTimingPolicy(
                Duration.ofSeconds(30),
                Duration.ofMinutes(5),
                Duration.ofSeconds(30),
                Duration.ofSeconds(90),
                Duration.ofSeconds(15)
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
