package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.crypto.Sha256CommitHasher;
import com.questrail.bhumi.relay.testing.Preimages;
import com.questrail.bhumi.relay.testing.TestIdentity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class CapabilityStoreTest {
    private final CapabilityStore store = new CapabilityStore(Sha256CommitHasher.INSTANCE);
    private final Id52 alice = TestIdentity.generate().id52();

    @Test
    void installedCommitIsConsumedExactlyOnce() {
        Preimage p = Preimages.random();
        store.install(alice, List.of(Preimages.commitOf(p)));

        assertTrue(store.tryConsume(alice, p));
        assertFalse(store.tryConsume(alice, p));
        assertEquals(0, store.remaining(alice));
    }

    @Test
    void preimageWithoutCommitIsRejected() {
        store.install(alice, List.of(Preimages.commitOf(Preimages.random())));

        assertFalse(store.tryConsume(alice, Preimages.random()));
        assertEquals(1, store.remaining(alice));
    }

    @Test
    void commitsAreScopedToTheirIdentity() {
        Id52 bob = TestIdentity.generate().id52();
        Preimage p = Preimages.random();
        store.install(alice, List.of(Preimages.commitOf(p)));

        assertFalse(store.tryConsume(bob, p));
        assertTrue(store.tryConsume(alice, p));
    }

    @Test
    void installReplacesRatherThanMerges() {
        Preimage old = Preimages.random();
        Preimage fresh = Preimages.random();
        store.install(alice, List.of(Preimages.commitOf(old)));

        store.install(alice, List.of(Preimages.commitOf(fresh)));

        assertFalse(store.tryConsume(alice, old));
        assertTrue(store.tryConsume(alice, fresh));
    }

    @Test
    void removeDropsIdentity() {
        Preimage p = Preimages.random();
        store.install(alice, List.of(Preimages.commitOf(p)));

        store.remove(alice);

        assertFalse(store.tryConsume(alice, p));
        assertEquals(0, store.remaining(alice));
    }

    @Test
    void concurrentConsumersOfSamePreimageHaveExactlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < 50; round++) {
                Preimage p = Preimages.random();
                store.install(alice, List.of(Preimages.commitOf(p), Preimages.commitOf(Preimages.random())));

                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return store.tryConsume(alice, p);
                    }));
                }
                start.countDown();

                int winners = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(5, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners, "round " + round);
                assertEquals(1, store.remaining(alice));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
