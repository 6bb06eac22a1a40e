package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.internal.time.MonotonicClock;
import com.questrail.bhumi.relay.model.IAm;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ResponseCache
 * =============================================================================
 * Global, preimage-keyed store of recently produced responses.
 *
 * <p>A sender that retries with the same preimage after the recipient already
 * answered gets the stored answer without the recipient being contacted again.
 * Keys are preimages, not recipient identities: a preimage is unguessable and
 * single-use, so it names one exchange globally.</p>
 *
 * <h2>Expiry</h2>
 * <p>Entries carry a monotonic deadline. Reads never return an expired entry
 * (they evict it instead) and {@link #sweep()} removes the rest periodically.</p>
 *
 * <h2>Bulk uploads</h2>
 * <p>A device re-registering with a relay uploads responses it produced
 * recently. Uploads are capped per call, and each uploader keeps only its most
 * recent upload generation: a new upload evicts whatever is left of the
 * previous one.</p>
 */
public final class ResponseCache {
    private record Entry(byte[] response, long expiresAtNanos, Id52 uploader) {}

    private final MonotonicClock clock;
    private final int maxUploadPerIdentity;

    private final ConcurrentMap<Preimage, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<Id52, Set<Preimage>> uploads = new ConcurrentHashMap<>();

    public ResponseCache(MonotonicClock clock, int maxUploadPerIdentity) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxUploadPerIdentity < 0) {
            throw new IllegalArgumentException("maxUploadPerIdentity must be >= 0");
        }
        this.maxUploadPerIdentity = maxUploadPerIdentity;
    }

    /**
     * Returns the cached response for {@code preimage} without evicting it.
     */
    public Optional<byte[]> lookup(Preimage preimage) {
        Entry e = entries.get(preimage);
        if (e == null) {
            return Optional.empty();
        }
        if (isExpired(e)) {
            entries.remove(preimage, e);
            return Optional.empty();
        }
        return Optional.of(e.response().clone());
    }

    /**
     * Removes and returns the cached response for {@code preimage}. Used when
     * the response is about to be handed to the sender.
     */
    public Optional<byte[]> take(Preimage preimage) {
        Entry e = entries.remove(preimage);
        if (e == null || isExpired(e)) {
            return Optional.empty();
        }
        return Optional.of(e.response());
    }

    /**
     * Stores a response produced by a recipient acknowledgment.
     */
    public void store(Preimage preimage, byte[] response, Duration ttl) {
        Objects.requireNonNull(preimage, "preimage");
        Objects.requireNonNull(response, "response");
        entries.put(preimage, new Entry(response.clone(), deadline(ttl), null));
    }

    /**
     * Stores the responses an identity uploaded with its identity claim,
     * replacing whatever remains of that identity's previous upload.
     *
     * @return number of entries accepted
     */
    public int storeRecent(Id52 uploader, List<IAm.RecentResponse> recent, Duration ttl) {
        Objects.requireNonNull(uploader, "uploader");
        Objects.requireNonNull(recent, "recent");
        long expiresAt = deadline(ttl);
        int[] accepted = new int[1];

        uploads.compute(uploader, (key, previous) -> {
            if (previous != null) {
                for (Preimage p : previous) {
                    entries.computeIfPresent(p, (k, e) -> uploader.equals(e.uploader()) ? null : e);
                }
            }
            Set<Preimage> generation = new HashSet<>();
            for (IAm.RecentResponse r : recent) {
                if (generation.size() >= maxUploadPerIdentity) {
                    break;
                }
                if (generation.add(r.preimage())) {
                    entries.put(r.preimage(), new Entry(r.response().clone(), expiresAt, uploader));
                }
            }
            accepted[0] = generation.size();
            return generation.isEmpty() ? null : generation;
        });
        return accepted[0];
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        int before = entries.size();
        entries.values().removeIf(this::isExpired);
        for (Id52 uploader : uploads.keySet()) {
            uploads.computeIfPresent(uploader, (key, generation) -> {
                generation.removeIf(p -> !entries.containsKey(p));
                return generation.isEmpty() ? null : generation;
            });
        }
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    private long deadline(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative");
        }
        return clock.nowNanos() + ttl.toNanos();
    }

    private boolean isExpired(Entry e) {
        return clock.nowNanos() - e.expiresAtNanos() >= 0;
    }
}
