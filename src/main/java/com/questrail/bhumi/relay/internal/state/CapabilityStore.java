package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.crypto.CommitHasher;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * CapabilityStore
 * =============================================================================
 * Per-identity set of unconsumed admission commits.
 *
 * <h2>Invariant</h2>
 * A commit present in a set has never been consumed, and consumption removes
 * it in the same indivisible step that checks for it.
 *
 * <h2>Locking</h2>
 * Every read and write of an identity's set happens inside a
 * {@link ConcurrentHashMap} per-key atomic operation ({@code put},
 * {@code computeIfPresent}), so consumption and wholesale replacement for the
 * same identity are linearized while different identities never contend. The
 * sets themselves are plain {@link HashSet}s that never escape those sections.
 */
public final class CapabilityStore {
    private final CommitHasher hasher;
    private final ConcurrentMap<Id52, Set<Commit>> commits = new ConcurrentHashMap<>();

    public CapabilityStore(CommitHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    /**
     * Replaces the identity's commit set wholesale. Commits not in
     * {@code newCommits} are no longer admissible afterwards.
     */
    public void install(Id52 id52, Collection<Commit> newCommits) {
        Objects.requireNonNull(id52, "id52");
        commits.put(id52, new HashSet<>(newCommits));
    }

    /**
     * Atomically checks that {@code H(preimage)} is an unconsumed commit of
     * {@code id52} and consumes it.
     *
     * @return {@code true} if exactly this call consumed the commit
     */
    public boolean tryConsume(Id52 id52, Preimage preimage) {
        Objects.requireNonNull(id52, "id52");
        Commit commit = hasher.commitOf(preimage);

        boolean[] consumed = new boolean[1];
        commits.computeIfPresent(id52, (key, set) -> {
            consumed[0] = set.remove(commit);
            return set;
        });
        return consumed[0];
    }

    /**
     * Drops everything stored for the identity.
     */
    public void remove(Id52 id52) {
        commits.remove(id52);
    }

    /**
     * Number of unconsumed commits currently installed for the identity.
     */
    public int remaining(Id52 id52) {
        int[] size = new int[1];
        commits.computeIfPresent(id52, (key, set) -> {
            size[0] = set.size();
            return set;
        });
        return size[0];
    }
}
