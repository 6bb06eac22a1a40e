package com.questrail.bhumi.relay.internal.exec;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.internal.state.CapabilityStore;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import com.questrail.bhumi.relay.internal.state.ResponseCache;
import com.questrail.bhumi.relay.internal.time.MonotonicClock;
import com.questrail.bhumi.relay.internal.time.MonotonicScheduler;
import com.questrail.bhumi.relay.internal.time.WallClock;
import com.questrail.bhumi.relay.model.Deliver;
import com.questrail.bhumi.relay.model.Send;
import com.questrail.bhumi.relay.observability.RelayErrorEvent;
import com.questrail.bhumi.relay.observability.RelayObservabilitySink;
import com.questrail.bhumi.relay.observability.RelaySendEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SendOrchestrator
 * =============================================================================
 * Resolves a SEND from one device to another.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>A cached response for the preimage answers the send immediately, without
 *       touching the recipient or its capabilities.</li>
 *   <li>An unbound recipient yields {@link SendStatus#RECIPIENT_OFFLINE}; no
 *       capability is consumed.</li>
 *   <li>A preimage whose commit is not registered for the recipient yields
 *       {@link SendStatus#INVALID_CAPABILITY}.</li>
 *   <li>Otherwise the payload is forwarded as DELIVER under a fresh correlation
 *       id, and the send waits for the first of: ACK from that same recipient
 *       connection, its disconnect, or the send timeout.</li>
 * </ol>
 *
 * <h2>Concurrency</h2>
 * <p>Every path that can finish a forwarded send claims it through
 * {@link PendingSendTable}, whose removal is atomic, so the returned future is
 * completed exactly once and the sink sees exactly one
 * {@link RelaySendEvent} per send. The orchestrator never blocks: callers chain
 * on the returned future.</p>
 */
public final class SendOrchestrator implements ConnectionRegistry.DisconnectListener {
    private final ConnectionRegistry registry;
    private final CapabilityStore capabilities;
    private final ResponseCache cache;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RelayTimingPolicy timing;
    private final RelayObservabilitySink sink;

    private final PendingSendTable pending = new PendingSendTable();

    public SendOrchestrator(ConnectionRegistry registry,
                            CapabilityStore capabilities,
                            ResponseCache cache,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            RelayTimingPolicy timing,
                            RelayObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Starts resolving {@code send}. The returned future always completes
     * normally with a {@link SendOutcome}.
     */
    public CompletableFuture<SendOutcome> send(Send send) {
        Objects.requireNonNull(send, "send");
        Id52 to = send.to();

        Optional<byte[]> cached = cache.take(send.preimage());
        if (cached.isPresent()) {
            return immediately(to, SendOutcome.cached(cached.get()));
        }

        Optional<ConnectionRegistry.BoundConnection> target = registry.lookup(to);
        if (target.isEmpty()) {
            return immediately(to, SendOutcome.failed(SendStatus.RECIPIENT_OFFLINE));
        }

        if (!capabilities.tryConsume(to, send.preimage())) {
            return immediately(to, SendOutcome.failed(SendStatus.INVALID_CAPABILITY));
        }

        ConnectionRegistry.BoundConnection bound = target.get();
        PendingSend p;
        do {
            p = new PendingSend(pending.nextCorrelationId(), to, bound.handle(), send.preimage());
        } while (!pending.add(p));

        final long correlationId = p.correlationId;
        p.armDeadline(scheduler.scheduleAfter(timing.sendTimeout(), clock,
                () -> resolve(correlationId, SendOutcome.failed(SendStatus.RECIPIENT_TIMEOUT))));

        // The recipient may have gone between lookup and registration in the
        // pending table; its disconnect drain would then have missed this send.
        if (!registry.isLive(bound.handle())) {
            resolve(correlationId, SendOutcome.failed(SendStatus.RECIPIENT_DISCONNECTED));
            return p.result;
        }

        try {
            bound.connection().send(new Deliver(correlationId, send.payload()));
        } catch (RuntimeException e) {
            sink.onError(new RelayErrorEvent(wallClock.now(), bound.handle(),
                    "DELIVER write failed", e, false));
            resolve(correlationId, SendOutcome.failed(SendStatus.RECIPIENT_DISCONNECTED));
        }
        return p.result;
    }

    /**
     * An ACK arrived on connection {@code from}. Only the connection the send
     * was delivered to can acknowledge it; any other ACK, including one for an
     * already resolved send, is ignored.
     *
     * @return whether the ACK resolved a pending send
     */
    public boolean acknowledge(ConnectionHandle from, long correlationId, byte[] payload) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(payload, "payload");

        Optional<PendingSend> candidate = pending.peek(correlationId);
        if (candidate.isEmpty() || !candidate.get().recipientHandle.equals(from)) {
            return false;
        }
        PendingSend p = candidate.get();
        if (!pending.remove(p)) {
            return false;
        }
        cache.store(p.preimage, payload, timing.responseCacheTtl());
        complete(p, SendOutcome.acknowledged(payload));
        return true;
    }

    @Override
    public void onDisconnected(ConnectionHandle handle) {
        recipientGone(handle);
    }

    /**
     * Fails every send still waiting on {@code handle}.
     */
    public void recipientGone(ConnectionHandle handle) {
        for (Long correlationId : pending.drainRecipient(handle)) {
            resolve(correlationId, SendOutcome.failed(SendStatus.RECIPIENT_DISCONNECTED));
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private void resolve(long correlationId, SendOutcome outcome) {
        pending.remove(correlationId).ifPresent(p -> complete(p, outcome));
    }

    private void complete(PendingSend p, SendOutcome outcome) {
        p.disarmDeadline();
        p.result.complete(outcome);
        sink.onSendResolved(new RelaySendEvent(
                wallClock.now(), p.recipient, outcome.status(), false, p.correlationId));
    }

    private CompletableFuture<SendOutcome> immediately(Id52 to, SendOutcome outcome) {
        sink.onSendResolved(new RelaySendEvent(
                wallClock.now(), to, outcome.status(), outcome.fromCache(), -1));
        return CompletableFuture.completedFuture(outcome);
    }
}
