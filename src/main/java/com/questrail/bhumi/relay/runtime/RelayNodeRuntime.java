package com.questrail.bhumi.relay.runtime;

import com.questrail.bhumi.relay.codec.impl.DefaultFrameEncoder;
import com.questrail.bhumi.relay.config.RelayRuntimeConfig;
import com.questrail.bhumi.relay.crypto.CommitHasher;
import com.questrail.bhumi.relay.crypto.Ed25519SignatureVerifier;
import com.questrail.bhumi.relay.crypto.Sha256CommitHasher;
import com.questrail.bhumi.relay.crypto.SignatureVerifier;
import com.questrail.bhumi.relay.internal.decode.RelayMessageDecoder;
import com.questrail.bhumi.relay.internal.encode.RelayMessageEncoder;
import com.questrail.bhumi.relay.internal.exec.RelayTimingPolicy;
import com.questrail.bhumi.relay.internal.exec.SendOrchestrator;
import com.questrail.bhumi.relay.internal.state.CapabilityStore;
import com.questrail.bhumi.relay.internal.state.ConnectionActivityTracker;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import com.questrail.bhumi.relay.internal.state.ResponseCache;
import com.questrail.bhumi.relay.internal.time.Cancellable;
import com.questrail.bhumi.relay.internal.time.MonotonicClock;
import com.questrail.bhumi.relay.internal.time.MonotonicScheduler;
import com.questrail.bhumi.relay.internal.time.PeriodicTask;
import com.questrail.bhumi.relay.internal.time.ScheduledExecutorScheduler;
import com.questrail.bhumi.relay.internal.time.SystemMonotonicClock;
import com.questrail.bhumi.relay.internal.time.SystemWallClock;
import com.questrail.bhumi.relay.internal.time.WallClock;
import com.questrail.bhumi.relay.observability.NullObservabilitySink;
import com.questrail.bhumi.relay.observability.RelayConnectionEvent;
import com.questrail.bhumi.relay.observability.RelayErrorEvent;
import com.questrail.bhumi.relay.observability.RelayObservabilitySink;
import com.questrail.bhumi.relay.presence.PresenceService;
import com.questrail.bhumi.relay.transport.StreamEndpoint;
import com.questrail.bhumi.relay.transport.tcp.netty.NettyTcpRelayEndpoint;

import java.net.SocketAddress;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * RelayNodeRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for a relay node: transport,
 * shared state, send orchestration, presence and the background sweeps.
 */
public final class RelayNodeRuntime {
    private final RelayNode node;
    private final StreamEndpoint endpoint;
    private final ConnectionRegistry registry;
    private final ResponseCache cache;
    private final PresenceService presence;
    private final RelayTimingPolicy timing;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ScheduledExecutorService schedulerExecutor;
    private final RelayObservabilitySink sink;

    private final List<Cancellable> periodic = new ArrayList<>();

    private RelayNodeRuntime(
            RelayNode node,
            StreamEndpoint endpoint,
            ConnectionRegistry registry,
            ResponseCache cache,
            PresenceService presence,
            RelayTimingPolicy timing,
            MonotonicScheduler scheduler,
            MonotonicClock clock,
            WallClock wallClock,
            ScheduledExecutorService schedulerExecutor,
            RelayObservabilitySink sink) {
        this.node = node;
        this.endpoint = endpoint;
        this.registry = registry;
        this.cache = cache;
        this.presence = presence;
        this.timing = timing;
        this.scheduler = scheduler;
        this.clock = clock;
        this.wallClock = wallClock;
        this.schedulerExecutor = schedulerExecutor;
        this.sink = sink;
    }

    /**
     * Binds the listening socket and starts the background sweeps.
     */
    public synchronized void start() {
        endpoint.start();

        Consumer<RuntimeException> report = e ->
            sink.onError(new RelayErrorEvent(wallClock.now(), null, "Background task failed", e, false));

        periodic.add(PeriodicTask.start(scheduler, clock, timing.cacheSweepInterval(), cache::sweep, report));
        periodic.add(PeriodicTask.start(scheduler, clock, timing.idleTimeout().dividedBy(3), this::evictIdle, report));
        periodic.add(PeriodicTask.start(scheduler, clock, timing.gossipInterval(), presence::gossipRound, report));
    }

    public synchronized void stop() {
        periodic.forEach(Cancellable::cancel);
        periodic.clear();

        endpoint.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Optional<SocketAddress> localAddress() {
        return endpoint.localAddress();
    }

    public int connectionCount() {
        return registry.connectionCount();
    }

    public int boundIdentityCount() {
        return registry.boundIdentityCount();
    }

    RelayNode node() {
        return node;
    }

    private void evictIdle() {
        for (ConnectionHandle h : registry.closeIdle(timing.idleTimeout())) {
            sink.onConnectionEvent(new RelayConnectionEvent(
                wallClock.now(), h, RelayConnectionEvent.Kind.IDLE_EVICTED, null,
                "no inbound traffic for " + timing.idleTimeout()));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayRuntimeConfig config = RelayRuntimeConfig.defaults();
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private SignatureVerifier verifier = new Ed25519SignatureVerifier();
        private CommitHasher hasher = Sha256CommitHasher.INSTANCE;
        private StreamEndpoint endpoint;

        public Builder withConfig(RelayRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withSignatureVerifier(SignatureVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder withCommitHasher(CommitHasher hasher) {
            this.hasher = hasher;
            return this;
        }

        /**
         * Replaces the Netty TCP endpoint that is otherwise built from the config.
         */
        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public RelayNodeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(verifier, "verifier");
            Objects.requireNonNull(hasher, "hasher");

            RelayTimingPolicy timing = config.timingPolicy();

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, r -> {
                Thread t = new Thread(r, "bhumi-relay-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Soft state; commit sets go away with the identity's connection
            CapabilityStore capabilities = new CapabilityStore(hasher);
            ResponseCache cache = new ResponseCache(clock, config.maxRecentResponsesPerIdentity());
            ConnectionActivityTracker activity = new ConnectionActivityTracker(clock);
            ConnectionRegistry registry = new ConnectionRegistry(verifier, activity, capabilities::remove);

            // 3. Send orchestration, notified when recipients go away
            SendOrchestrator orchestrator = new SendOrchestrator(
                registry, capabilities, cache, scheduler, clock, wallClock, timing, observabilitySink);
            registry.addDisconnectListener(orchestrator);

            // 4. Presence
            PresenceService presence = new PresenceService(
                verifier, registry, wallClock, new Random(), observabilitySink,
                config.gossipFanout(), config.gossipBatch());

            // 5. Node and transport
            SecureRandom nonces = new SecureRandom();
            RelayNode node = new RelayNode(
                registry,
                activity,
                capabilities,
                cache,
                orchestrator,
                presence,
                new RelayMessageDecoder(),
                new RelayMessageEncoder(),
                new DefaultFrameEncoder(config.maxPayloadSize()),
                timing,
                config.maxPayloadSize(),
                nonces::nextInt,
                wallClock,
                observabilitySink);

            StreamEndpoint ep = endpoint != null
                ? endpoint
                : new NettyTcpRelayEndpoint(config.bindAddress(), config.workerThreads());
            ep.setListener(node);

            return new RelayNodeRuntime(
                node, ep, registry, cache, presence, timing, scheduler, clock, wallClock, schedulerExec, observabilitySink);
        }
    }
}
