package com.questrail.bhumi.relay.presence;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.PresenceRecord;
import com.questrail.bhumi.relay.crypto.SignatureVerifier;
import com.questrail.bhumi.relay.internal.state.ConnectionRegistry;
import com.questrail.bhumi.relay.internal.time.WallClock;
import com.questrail.bhumi.relay.model.Presence;
import com.questrail.bhumi.relay.observability.RelayErrorEvent;
import com.questrail.bhumi.relay.observability.RelayObservabilitySink;
import com.questrail.bhumi.relay.observability.RelayPresenceEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PresenceService
 * =============================================================================
 * Best-effort store of signed presence hints, gossiped to a few random peers.
 *
 * <p>Records are kept exactly as signed. Their lifetime is the issuer's
 * {@code issuedAt + ttl}, measured on the wall clock, and is never extended
 * here. Nothing else in the relay depends on presence being fresh.</p>
 */
public final class PresenceService {
    /**
     * Outcome of {@link #accept(PresenceRecord)}.
     */
    public enum Verdict {
        ACCEPTED,
        BAD_SIGNATURE,
        EXPIRED,
        STALE
    }

    private final SignatureVerifier verifier;
    private final ConnectionRegistry registry;
    private final WallClock wallClock;
    private final Random random;
    private final RelayObservabilitySink sink;
    private final int fanout;
    private final int batch;

    private final ConcurrentMap<Id52, PresenceRecord> records = new ConcurrentHashMap<>();

    public PresenceService(SignatureVerifier verifier,
                           ConnectionRegistry registry,
                           WallClock wallClock,
                           Random random,
                           RelayObservabilitySink sink,
                           int fanout,
                           int batch) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.random = Objects.requireNonNull(random, "random");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (fanout < 1 || batch < 1) {
            throw new IllegalArgumentException("fanout and batch must be >= 1");
        }
        this.fanout = fanout;
        this.batch = batch;
    }

    public Verdict accept(PresenceRecord record) {
        Objects.requireNonNull(record, "record");
        Instant now = wallClock.now();

        if (!verifier.verify(record.id52(), record.signedBytes(), record.signature())) {
            return report(Verdict.BAD_SIGNATURE, RelayPresenceEvent.Kind.REJECTED_SIGNATURE, record.id52(), now);
        }
        if (record.isExpiredAt(now)) {
            return report(Verdict.EXPIRED, RelayPresenceEvent.Kind.REJECTED_EXPIRED, record.id52(), now);
        }

        boolean[] stored = new boolean[1];
        records.compute(record.id52(), (id, current) -> {
            if (current != null
                    && !current.isExpiredAt(now)
                    && current.issuedAt().isAfter(record.issuedAt())) {
                return current;
            }
            stored[0] = true;
            return record;
        });

        return stored[0]
                ? report(Verdict.ACCEPTED, RelayPresenceEvent.Kind.ACCEPTED, record.id52(), now)
                : report(Verdict.STALE, RelayPresenceEvent.Kind.REJECTED_STALE, record.id52(), now);
    }

    public Optional<PresenceRecord> lookup(Id52 id52) {
        PresenceRecord r = records.get(id52);
        if (r == null || r.isExpiredAt(wallClock.now())) {
            return Optional.empty();
        }
        return Optional.of(r);
    }

    /**
     * Snapshot of every record that has not yet expired.
     */
    public List<PresenceRecord> live() {
        Instant now = wallClock.now();
        List<PresenceRecord> out = new ArrayList<>();
        for (PresenceRecord r : records.values()) {
            if (!r.isExpiredAt(now)) {
                out.add(r);
            }
        }
        return out;
    }

    /**
     * Drops expired records.
     *
     * @return number of records removed
     */
    public int purgeExpired() {
        Instant now = wallClock.now();
        int removed = 0;
        for (PresenceRecord r : records.values()) {
            if (r.isExpiredAt(now) && records.remove(r.id52(), r)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Purges expired records, then forwards a random sample of live records to
     * a random sample of bound connections.
     *
     * @return number of PRESENCE frames sent
     */
    public int gossipRound() {
        purgeExpired();

        List<PresenceRecord> pool = live();
        List<ConnectionRegistry.BoundConnection> peers = registry.boundConnections();
        int sent = 0;
        if (!pool.isEmpty() && !peers.isEmpty()) {
            Collections.shuffle(peers, random);
            for (ConnectionRegistry.BoundConnection peer : peers.subList(0, Math.min(fanout, peers.size()))) {
                Collections.shuffle(pool, random);
                for (PresenceRecord r : pool.subList(0, Math.min(batch, pool.size()))) {
                    try {
                        peer.connection().send(new Presence(r));
                        sent++;
                    } catch (RuntimeException e) {
                        sink.onError(new RelayErrorEvent(wallClock.now(), peer.handle(),
                                "PRESENCE gossip write failed", e, false));
                        break;
                    }
                }
            }
        }

        sink.onPresenceEvent(new RelayPresenceEvent(wallClock.now(), RelayPresenceEvent.Kind.GOSSIP_ROUND, null, sent));
        return sent;
    }

    public int size() {
        return records.size();
    }

    private Verdict report(Verdict verdict, RelayPresenceEvent.Kind kind, Id52 id52, Instant now) {
        sink.onPresenceEvent(new RelayPresenceEvent(now, kind, id52, 0));
        return verdict;
    }
}
