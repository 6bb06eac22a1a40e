package com.questrail.bhumi.relay.internal.exec;

import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.model.CorrelationIds;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PendingSendTable
 * -----------------------------------------------------------------------------
 * Correlation table of in-flight sends, indexed by correlation id and by
 * recipient connection.
 *
 * <p>{@link #remove(long)} is the single point where a pending send is claimed
 * for resolution. Because it is a single atomic map removal, exactly one
 * resolver ever obtains a given entry; every later attempt sees nothing.</p>
 */
final class PendingSendTable {
    private final AtomicLong counter = new AtomicLong();
    private final ConcurrentMap<Long, PendingSend> byCorrelation = new ConcurrentHashMap<>();
    private final ConcurrentMap<ConnectionHandle, Set<Long>> byRecipient = new ConcurrentHashMap<>();

    /**
     * Allocates a non-zero u32 correlation id not currently in use.
     */
    long nextCorrelationId() {
        while (true) {
            long id = counter.incrementAndGet() & CorrelationIds.MAX;
            if (id != 0 && !byCorrelation.containsKey(id)) {
                return id;
            }
        }
    }

    /**
     * @return {@code false} if the id is already taken
     */
    boolean add(PendingSend pending) {
        if (byCorrelation.putIfAbsent(pending.correlationId, pending) != null) {
            return false;
        }
        byRecipient.compute(pending.recipientHandle, (h, ids) -> {
            Set<Long> set = ids != null ? ids : new HashSet<>();
            set.add(pending.correlationId);
            return set;
        });
        return true;
    }

    Optional<PendingSend> peek(long correlationId) {
        return Optional.ofNullable(byCorrelation.get(correlationId));
    }

    /**
     * Claims the entry for resolution.
     */
    Optional<PendingSend> remove(long correlationId) {
        PendingSend pending = byCorrelation.remove(correlationId);
        if (pending == null) {
            return Optional.empty();
        }
        unindex(pending);
        return Optional.of(pending);
    }

    /**
     * Claims the entry only if it is still {@code expected}.
     */
    boolean remove(PendingSend expected) {
        if (!byCorrelation.remove(expected.correlationId, expected)) {
            return false;
        }
        unindex(expected);
        return true;
    }

    /**
     * Correlation ids of every send pending on {@code handle}, removing the
     * recipient index entry. The sends themselves still have to be claimed
     * through {@link #remove(long)}.
     */
    List<Long> drainRecipient(ConnectionHandle handle) {
        Set<Long> ids = byRecipient.remove(handle);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    int size() {
        return byCorrelation.size();
    }

    private void unindex(PendingSend pending) {
        byRecipient.computeIfPresent(pending.recipientHandle, (h, ids) -> {
            ids.remove(pending.correlationId);
            return ids.isEmpty() ? null : ids;
        });
    }
}
