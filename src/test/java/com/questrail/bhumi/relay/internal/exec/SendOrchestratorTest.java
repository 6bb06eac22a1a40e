package com.questrail.bhumi.relay.internal.exec;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.crypto.Ed25519SignatureVerifier;
import com.questrail.bhumi.relay.crypto.Sha256CommitHasher;
import com.questrail.bhumi.relay.internal.state.CapabilityStore;
import com.questrail.bhumi.relay.internal.state.ConnectionActivityTracker;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import com.questrail.bhumi.relay.internal.state.ResponseCache;
import com.questrail.bhumi.relay.model.Deliver;
import com.questrail.bhumi.relay.model.Send;
import com.questrail.bhumi.relay.observability.RecordingObservabilitySink;
import com.questrail.bhumi.relay.observability.RelaySendEvent;
import com.questrail.bhumi.relay.testing.FakeRelayConnection;
import com.questrail.bhumi.relay.testing.Preimages;
import com.questrail.bhumi.relay.testing.TestIdentity;
import com.questrail.bhumi.relay.time.DeterministicScheduler;
import com.questrail.bhumi.relay.time.ManualMonotonicClock;
import com.questrail.bhumi.relay.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SendOrchestratorTest
 * -----------------------------------------------------------------------------
 * End-to-end resolution of SEND against in-memory state, a deterministic
 * scheduler and recording connections.
 */
final class SendOrchestratorTest {
    private static final byte[] X = { 'x' };
    private static final byte[] Y = { 'y', 'y' };

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RelayTimingPolicy timing = RelayTimingPolicy.defaults();

    private final CapabilityStore capabilities = new CapabilityStore(Sha256CommitHasher.INSTANCE);
    private final ResponseCache cache = new ResponseCache(clock, 64);
    private final ConnectionRegistry registry = new ConnectionRegistry(
            new Ed25519SignatureVerifier(), new ConnectionActivityTracker(clock), capabilities::remove);
    private final SendOrchestrator orchestrator = new SendOrchestrator(
            registry, capabilities, cache, scheduler, clock,
            new ManualWallClock(Instant.parse("2025-01-01T00:00:00Z")), timing, sink);

    private final TestIdentity alice = TestIdentity.generate();
    private final AtomicInteger nonces = new AtomicInteger(1000);

    {
        registry.addDisconnectListener(orchestrator);
    }

    // -------------------------------------------------------------------------
    // Protocol scenarios
    // -------------------------------------------------------------------------

    @Test
    void ackResolvesSenderAndRetryIsServedFromCache() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));

        CompletableFuture<SendOutcome> first = orchestrator.send(new Send(alice.id52(), p1, X));
        Deliver deliver = a.onlyDeliver();
        assertArrayEquals(X, deliver.payload());
        assertFalse(first.isDone());

        assertTrue(orchestrator.acknowledge(a.handle, deliver.correlationId(), Y));

        SendOutcome outcome = first.join();
        assertEquals(SendStatus.OK, outcome.status());
        assertArrayEquals(Y, outcome.payload());
        assertFalse(outcome.fromCache());

        SendOutcome retry = orchestrator.send(new Send(alice.id52(), p1, X)).join();
        assertEquals(SendStatus.OK, retry.status());
        assertArrayEquals(Y, retry.payload());
        assertTrue(retry.fromCache());
        assertEquals(1, a.conn.sent(Deliver.class).size(), "recipient contacted once");
    }

    @Test
    void offlineRecipientResolvesImmediatelyWithoutConsuming() {
        Preimage p1 = Preimages.random();
        capabilities.install(alice.id52(), List.of(Preimages.commitOf(p1)));

        SendOutcome outcome = orchestrator.send(new Send(alice.id52(), p1, X)).join();

        assertEquals(SendStatus.RECIPIENT_OFFLINE, outcome.status());
        assertEquals(0, outcome.payload().length);
        assertEquals(1, capabilities.remaining(alice.id52()));
    }

    @Test
    void unknownPreimageIsRejectedWithoutContactingRecipient() {
        Device a = connect(alice, Preimages.commitOf(Preimages.random()));

        SendOutcome outcome = orchestrator.send(new Send(alice.id52(), Preimages.random(), X)).join();

        assertEquals(SendStatus.INVALID_CAPABILITY, outcome.status());
        assertTrue(a.conn.sent(Deliver.class).isEmpty());
    }

    @Test
    void secondSendWithConsumedPreimageIsRejected() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));

        CompletableFuture<SendOutcome> first = orchestrator.send(new Send(alice.id52(), p1, X));
        SendOutcome second = orchestrator.send(new Send(alice.id52(), p1, X)).join();

        assertFalse(first.isDone());
        assertEquals(SendStatus.INVALID_CAPABILITY, second.status());
        assertEquals(1, a.conn.sent(Deliver.class).size());
    }

    @Test
    void rebindReplacesCommitSet() {
        Preimage p1 = Preimages.random();
        Preimage p2 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));

        registry.bind(a.handle, alice.id52(), alice.prove(a.conn.challengeNonce()),
                () -> capabilities.install(alice.id52(), List.of(Preimages.commitOf(p2))));

        assertEquals(SendStatus.INVALID_CAPABILITY,
                orchestrator.send(new Send(alice.id52(), p1, X)).join().status());
        assertFalse(orchestrator.send(new Send(alice.id52(), p2, X)).isDone());
    }

    @Test
    void silentRecipientTimesOutOnceAndLateAckIsIgnored() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));

        CompletableFuture<SendOutcome> f = orchestrator.send(new Send(alice.id52(), p1, X));
        long corr = a.onlyDeliver().correlationId();

        scheduler.advanceAndRun(timing.sendTimeout().minusMillis(1));
        assertFalse(f.isDone());

        scheduler.advanceAndRun(Duration.ofMillis(1));
        assertEquals(SendStatus.RECIPIENT_TIMEOUT, f.join().status());

        assertFalse(orchestrator.acknowledge(a.handle, corr, Y));
        assertTrue(cache.lookup(p1).isEmpty());
        assertEquals(1, sendEventsFor(corr).size());
        assertEquals(0, orchestrator.pendingCount());
    }

    @Test
    void recipientDisconnectMidFlightResolvesAndCachesNothing() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        CompletableFuture<SendOutcome> f = orchestrator.send(new Send(alice.id52(), p1, X));

        a.conn.close("gone");
        registry.unbind(a.handle);

        assertEquals(SendStatus.RECIPIENT_DISCONNECTED, f.join().status());
        assertTrue(cache.lookup(p1).isEmpty());
        assertEquals(0, scheduler.pendingTasks(), "deadline cancelled");

        // the device comes back and re-registers the commit; the retry is delivered again
        Device back = connect(alice, Preimages.commitOf(p1));
        CompletableFuture<SendOutcome> retry = orchestrator.send(new Send(alice.id52(), p1, X));
        assertFalse(retry.isDone());
        assertEquals(1, back.conn.sent(Deliver.class).size());
    }

    @Test
    void displacedRecipientFailsItsPendingSends() {
        Preimage p1 = Preimages.random();
        Device old = connect(alice, Preimages.commitOf(p1));
        CompletableFuture<SendOutcome> f = orchestrator.send(new Send(alice.id52(), p1, X));
        long corr = old.onlyDeliver().correlationId();

        Device fresh = connect(alice);

        assertEquals(SendStatus.RECIPIENT_DISCONNECTED, f.join().status());
        assertFalse(orchestrator.acknowledge(old.handle, corr, Y));
        assertFalse(orchestrator.acknowledge(fresh.handle, corr, Y));
    }

    @Test
    void ackFromAnotherConnectionIsIgnored() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        Device bob = connect(TestIdentity.generate());
        CompletableFuture<SendOutcome> f = orchestrator.send(new Send(alice.id52(), p1, X));
        long corr = a.onlyDeliver().correlationId();

        assertFalse(orchestrator.acknowledge(bob.handle, corr, Y));
        assertFalse(f.isDone());

        assertTrue(orchestrator.acknowledge(a.handle, corr, Y));
        assertTrue(f.isDone());
    }

    @Test
    void duplicateAckIsIgnored() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        CompletableFuture<SendOutcome> f = orchestrator.send(new Send(alice.id52(), p1, X));
        long corr = a.onlyDeliver().correlationId();

        assertTrue(orchestrator.acknowledge(a.handle, corr, Y));
        assertFalse(orchestrator.acknowledge(a.handle, corr, new byte[] { 0 }));

        assertArrayEquals(Y, f.join().payload());
        assertArrayEquals(Y, cache.lookup(p1).orElseThrow());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void failedDeliverWriteResolvesAsDisconnected() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        a.conn.failSendsWith(new IllegalStateException("socket gone"));

        SendOutcome outcome = orchestrator.send(new Send(alice.id52(), p1, X)).join();

        assertEquals(SendStatus.RECIPIENT_DISCONNECTED, outcome.status());
        assertEquals(0, orchestrator.pendingCount());
    }

    @Test
    void uploadedResponseAnswersWithoutDelivery() {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        cache.store(p1, Y, timing.responseCacheTtl());

        SendOutcome outcome = orchestrator.send(new Send(alice.id52(), p1, X)).join();

        assertTrue(outcome.fromCache());
        assertTrue(a.conn.sent(Deliver.class).isEmpty());
        assertEquals(1, capabilities.remaining(alice.id52()), "cache hit consumes nothing");
    }

    @Test
    void correlationIdsAreDistinctAndNonZero() {
        List<Preimage> preimages = new ArrayList<>();
        List<Commit> commits = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Preimage p = Preimages.random();
            preimages.add(p);
            commits.add(Preimages.commitOf(p));
        }
        Device a = connect(alice, commits.toArray(new Commit[0]));

        for (Preimage p : preimages) {
            orchestrator.send(new Send(alice.id52(), p, X));
        }

        Set<Long> ids = new HashSet<>();
        for (Deliver d : a.conn.sent(Deliver.class)) {
            assertNotEquals(0L, d.correlationId());
            assertTrue(ids.add(d.correlationId()));
        }
        assertEquals(20, ids.size());
        assertEquals(20, orchestrator.pendingCount());
    }

    @Test
    void everySendProducesExactlyOneResolutionEvent() {
        Preimage ok = Preimages.random();
        Preimage late = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(ok), Preimages.commitOf(late));

        orchestrator.send(new Send(alice.id52(), ok, X));
        orchestrator.send(new Send(alice.id52(), late, X));
        orchestrator.send(new Send(alice.id52(), Preimages.random(), X));
        orchestrator.send(new Send(TestIdentity.generate().id52(), Preimages.random(), X));
        orchestrator.acknowledge(a.handle, a.conn.sent(Deliver.class).get(0).correlationId(), Y);
        scheduler.advanceAndRun(timing.sendTimeout());

        List<RelaySendEvent> events = sink.sendEvents();
        assertEquals(4, events.size());
        assertEquals(Set.of(SendStatus.OK, SendStatus.RECIPIENT_TIMEOUT, SendStatus.INVALID_CAPABILITY,
                SendStatus.RECIPIENT_OFFLINE),
                events.stream().map(RelaySendEvent::status).collect(java.util.stream.Collectors.toSet()));
    }

    @Test
    void concurrentSendsWithSamePreimageDeliverOnce() throws Exception {
        Preimage p1 = Preimages.random();
        Device a = connect(alice, Preimages.commitOf(p1));
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<CompletableFuture<SendOutcome>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.send(new Send(alice.id52(), p1, X));
                }));
            }
            start.countDown();

            int pending = 0;
            int rejected = 0;
            for (Future<CompletableFuture<SendOutcome>> r : results) {
                CompletableFuture<SendOutcome> f = r.get(5, TimeUnit.SECONDS);
                if (!f.isDone()) {
                    pending++;
                } else if (f.join().status() == SendStatus.INVALID_CAPABILITY) {
                    rejected++;
                }
            }
            assertEquals(1, pending);
            assertEquals(threads - 1, rejected);
            assertEquals(1, a.conn.sent(Deliver.class).size());
        } finally {
            pool.shutdownNow();
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private Device connect(TestIdentity who, Commit... commits) {
        FakeRelayConnection conn = new FakeRelayConnection(nonces.incrementAndGet());
        ConnectionHandle h = registry.register(conn);
        registry.bind(h, who.id52(), who.prove(conn.challengeNonce()),
                () -> capabilities.install(who.id52(), List.of(commits)));
        return new Device(conn, h);
    }

    private List<RelaySendEvent> sendEventsFor(long corr) {
        List<RelaySendEvent> out = new ArrayList<>();
        for (RelaySendEvent e : sink.sendEvents()) {
            if (e.correlationId() == corr) {
                out.add(e);
            }
        }
        return out;
    }

    private static final class Device {
        final FakeRelayConnection conn;
        final ConnectionHandle handle;

        Device(FakeRelayConnection conn, ConnectionHandle handle) {
            this.conn = conn;
            this.handle = handle;
        }

        Deliver onlyDeliver() {
            List<Deliver> d = conn.sent(Deliver.class);
            assertEquals(1, d.size());
            return d.get(0);
        }
    }
}
