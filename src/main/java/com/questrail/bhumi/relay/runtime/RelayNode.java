package com.questrail.bhumi.relay.runtime;

import com.questrail.bhumi.relay.codec.FrameEncoder;
import com.questrail.bhumi.relay.codec.impl.DefaultFrameDecoder;
import com.questrail.bhumi.relay.internal.decode.RelayMessageDecoder;
import com.questrail.bhumi.relay.internal.encode.RelayMessageEncoder;
import com.questrail.bhumi.relay.internal.exec.RelayTimingPolicy;
import com.questrail.bhumi.relay.internal.exec.SendOrchestrator;
import com.questrail.bhumi.relay.internal.state.CapabilityStore;
import com.questrail.bhumi.relay.internal.state.ConnectionActivityTracker;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import com.questrail.bhumi.relay.internal.state.ResponseCache;
import com.questrail.bhumi.relay.internal.time.WallClock;
import com.questrail.bhumi.relay.observability.RelayErrorEvent;
import com.questrail.bhumi.relay.observability.RelayObservabilitySink;
import com.questrail.bhumi.relay.presence.PresenceService;
import com.questrail.bhumi.relay.transport.StreamConnection;
import com.questrail.bhumi.relay.transport.StreamEndpointListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntSupplier;

/**
 * RelayNode
 * =============================================================================
 * Shared relay services plus the transport listener that gives every accepted
 * connection its own {@link RelaySession}.
 *
 * <p>No protocol semantics live here. The node routes transport callbacks to
 * the right session and hands sessions the services they dispatch into.</p>
 */
public final class RelayNode implements StreamEndpointListener {
    private final ConnectionRegistry registry;
    private final ConnectionActivityTracker activity;
    private final CapabilityStore capabilities;
    private final ResponseCache cache;
    private final SendOrchestrator orchestrator;
    private final PresenceService presence;
    private final RelayMessageDecoder messageDecoder;
    private final RelayMessageEncoder messageEncoder;
    private final FrameEncoder frameEncoder;
    private final RelayTimingPolicy timing;
    private final int maxPayloadSize;
    private final IntSupplier nonces;
    private final WallClock wallClock;
    private final RelayObservabilitySink sink;

    // keyed by connection instance; ids are for logging only
    private final ConcurrentMap<StreamConnection, RelaySession> sessions = new ConcurrentHashMap<>();
    private volatile SocketAddress localAddress;

    public RelayNode(ConnectionRegistry registry,
                     ConnectionActivityTracker activity,
                     CapabilityStore capabilities,
                     ResponseCache cache,
                     SendOrchestrator orchestrator,
                     PresenceService presence,
                     RelayMessageDecoder messageDecoder,
                     RelayMessageEncoder messageEncoder,
                     FrameEncoder frameEncoder,
                     RelayTimingPolicy timing,
                     int maxPayloadSize,
                     IntSupplier nonces,
                     WallClock wallClock,
                     RelayObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.maxPayloadSize = maxPayloadSize;
        this.nonces = Objects.requireNonNull(nonces, "nonces");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp(SocketAddress localAddress) {
        this.localAddress = localAddress;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            sink.onError(new RelayErrorEvent(wallClock.now(), null, "Transport down", cause, true));
        }
        for (RelaySession session : sessions.values()) {
            session.close("relay shutting down");
        }
        sessions.clear();
    }

    @Override
    public void onConnectionOpened(StreamConnection connection) {
        RelaySession session = new RelaySession(this, connection, nonces.getAsInt(),
                new DefaultFrameDecoder(maxPayloadSize));
        sessions.put(connection, session);
        session.open();
    }

    @Override
    public void onBytes(StreamConnection connection, byte[] bytes) {
        RelaySession session = sessions.get(connection);
        if (session != null) {
            session.onBytes(bytes);
        }
    }

    @Override
    public void onConnectionClosed(StreamConnection connection, Throwable cause) {
        RelaySession session = sessions.remove(connection);
        if (session != null) {
            session.onTransportClosed(cause);
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    public Optional<SocketAddress> localAddress() {
        return Optional.ofNullable(localAddress);
    }

    // -------------------------------------------------------------------------
    // Services for sessions
    // -------------------------------------------------------------------------

    ConnectionRegistry registry() { return registry; }

    ConnectionActivityTracker activity() { return activity; }

    CapabilityStore capabilities() { return capabilities; }

    ResponseCache cache() { return cache; }

    SendOrchestrator orchestrator() { return orchestrator; }

    PresenceService presence() { return presence; }

    RelayMessageDecoder messageDecoder() { return messageDecoder; }

    RelayMessageEncoder messageEncoder() { return messageEncoder; }

    FrameEncoder frameEncoder() { return frameEncoder; }

    RelayTimingPolicy timing() { return timing; }

    int maxPayloadSize() { return maxPayloadSize; }

    WallClock wallClock() { return wallClock; }

    RelayObservabilitySink sink() { return sink; }
}
