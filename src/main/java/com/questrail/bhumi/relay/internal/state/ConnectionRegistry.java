package com.questrail.bhumi.relay.internal.state;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.crypto.SignatureVerifier;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * ConnectionRegistry
 * =============================================================================
 * Maps live connections to claimed identities and back.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one connection is routable for an identity at a time. A newer
 *       verified claim displaces the older connection, which is closed.</li>
 *   <li>Bindings are ephemeral: {@link #unbind(ConnectionHandle)} removes
 *       them, and nothing survives a disconnect.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * <p>There is no registry-wide lock. Identity transitions run inside
 * {@link ConcurrentHashMap#compute} on the identity's own key, so binding,
 * displacement and release of one identity are serialized while unrelated
 * identities proceed in parallel. The hooks invoked inside those sections
 * ({@code onVerified}, {@code identityReleased}) must not call back into this
 * registry.</p>
 *
 * <h2>Disconnect notification</h2>
 * <p>{@link DisconnectListener}s are told synchronously when a connection stops
 * being a valid delivery target, either because it closed or because a newer
 * claim displaced it. The send orchestrator uses this to fail in-flight sends.</p>
 */
public final class ConnectionRegistry {
    /**
     * Notified when a connection can no longer receive deliveries.
     */
    @FunctionalInterface
    public interface DisconnectListener {
        void onDisconnected(ConnectionHandle handle);
    }

    /**
     * A routable connection together with its handle.
     */
    public record BoundConnection(ConnectionHandle handle, RelayConnection connection) {}

    private static final class Entry {
        final RelayConnection connection;
        volatile Id52 identity;

        Entry(RelayConnection connection) {
            this.connection = connection;
        }
    }

    private final SignatureVerifier verifier;
    private final ConnectionActivityTracker activity;
    private final Consumer<Id52> identityReleased;

    private final AtomicLong nextHandle = new AtomicLong();
    private final ConcurrentMap<ConnectionHandle, Entry> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<Id52, ConnectionHandle> identities = new ConcurrentHashMap<>();
    private final List<DisconnectListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param identityReleased invoked (under the identity's lock) when an identity
     *                         stops being routable without being replaced, so
     *                         identity-scoped soft state can be dropped
     */
    public ConnectionRegistry(SignatureVerifier verifier,
                              ConnectionActivityTracker activity,
                              Consumer<Id52> identityReleased) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.identityReleased = Objects.requireNonNull(identityReleased, "identityReleased");
    }

    public void addDisconnectListener(DisconnectListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a freshly opened connection. It is not routable until bound.
     */
    public ConnectionHandle register(RelayConnection connection) {
        Objects.requireNonNull(connection, "connection");
        ConnectionHandle handle = new ConnectionHandle(nextHandle.incrementAndGet());
        connections.put(handle, new Entry(connection));
        activity.track(handle);
        return handle;
    }

    /**
     * Verifies an identity claim and makes {@code id52} routable to {@code handle}.
     *
     * <p>{@code onVerified} runs after the signature checks out and before the
     * identity becomes visible to {@link #lookup(Id52)}, so state installed there
     * (commit set, re-uploaded responses) is in place before the first SEND can
     * be routed to the new binding.</p>
     *
     * @return the handle that was displaced, if a different connection held the identity
     * @throws IdentityVerificationException if the signature does not verify
     * @throws IllegalStateException if the connection is unknown or closed
     */
    public Optional<ConnectionHandle> bind(ConnectionHandle handle, Id52 id52, byte[] signature, Runnable onVerified) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(id52, "id52");
        Objects.requireNonNull(onVerified, "onVerified");

        Entry entry = connections.get(handle);
        if (entry == null || !entry.connection.isOpen()) {
            throw new IllegalStateException("Connection " + handle + " is not registered");
        }

        byte[] challenge = challenge(entry.connection.challengeNonce(), id52);
        if (!verifier.verify(id52, challenge, signature)) {
            throw new IdentityVerificationException(id52, "Signature over nonce||id52 did not verify for " + id52);
        }

        ConnectionHandle displaced;
        synchronized (entry) {
            // A connection switching identities gives up the old one first.
            Id52 previous = entry.identity;
            if (previous != null && !previous.equals(id52)) {
                releaseIfOwnedBy(previous, handle);
            }

            ConnectionHandle[] current = new ConnectionHandle[1];
            identities.compute(id52, (key, owner) -> {
                // unbound by the idle sweep since the lookup above
                if (connections.get(handle) != entry) {
                    throw new IllegalStateException("Connection " + handle + " was closed during bind");
                }
                onVerified.run();
                current[0] = owner;
                return handle;
            });
            entry.identity = id52;
            displaced = current[0];
        }

        if (displaced != null && !displaced.equals(handle)) {
            displace(displaced, id52);
            return Optional.of(displaced);
        }
        return Optional.empty();
    }

    /**
     * Removes a connection and, if it still owns one, its identity binding.
     * Idempotent; safe to call from both the session and the transport close path.
     */
    public void unbind(ConnectionHandle handle) {
        Entry entry = connections.remove(handle);
        if (entry == null) {
            return;
        }
        activity.forget(handle);

        Id52 identity;
        synchronized (entry) {
            identity = entry.identity;
        }
        if (identity != null) {
            releaseIfOwnedBy(identity, handle);
        }
        notifyDisconnected(handle);
    }

    /**
     * Resolves an identity to its live connection.
     */
    public Optional<BoundConnection> lookup(Id52 id52) {
        ConnectionHandle handle = identities.get(id52);
        if (handle == null) {
            return Optional.empty();
        }
        Entry entry = connections.get(handle);
        if (entry == null || !entry.connection.isOpen()) {
            return Optional.empty();
        }
        return Optional.of(new BoundConnection(handle, entry.connection));
    }

    public Optional<Id52> identityOf(ConnectionHandle handle) {
        Entry entry = connections.get(handle);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.identity);
    }

    /**
     * Whether {@code handle} is registered and its connection is still open.
     */
    public boolean isLive(ConnectionHandle handle) {
        Entry entry = connections.get(handle);
        return entry != null && entry.connection.isOpen();
    }

    /**
     * Snapshot of every open connection that currently owns an identity.
     */
    public List<BoundConnection> boundConnections() {
        List<BoundConnection> out = new ArrayList<>();
        identities.forEach((id, handle) -> {
            Entry entry = connections.get(handle);
            if (entry != null && entry.connection.isOpen()) {
                out.add(new BoundConnection(handle, entry.connection));
            }
        });
        return out;
    }

    /**
     * Closes every connection with no inbound activity for at least {@code idleTimeout}.
     *
     * @return handles of the connections that were closed
     */
    public List<ConnectionHandle> closeIdle(Duration idleTimeout) {
        long idleNanos = idleTimeout.toNanos();
        List<ConnectionHandle> closed = new ArrayList<>();
        connections.forEach((handle, entry) -> {
            if (activity.isIdle(handle, idleNanos)) {
                closed.add(handle);
            }
        });
        for (ConnectionHandle handle : closed) {
            Entry entry = connections.get(handle);
            if (entry != null) {
                entry.connection.close("idle for " + idleTimeout);
                unbind(handle);
            }
        }
        return closed;
    }

    public int connectionCount() {
        return connections.size();
    }

    public int boundIdentityCount() {
        return identities.size();
    }

    /**
     * The exact byte string an identity claim must sign: the connection's
     * nonce as big-endian {@code u32} followed by the claimed id52.
     */
    public static byte[] challenge(int nonce, Id52 id52) {
        return ByteBuffer.allocate(4 + Id52.LENGTH)
                .putInt(nonce)
                .put(id52.bytes())
                .array();
    }

    private void releaseIfOwnedBy(Id52 identity, ConnectionHandle handle) {
        identities.computeIfPresent(identity, (key, current) -> {
            if (current.equals(handle)) {
                identityReleased.accept(identity);
                return null;
            }
            return current;
        });
    }

    private void displace(ConnectionHandle displacedHandle, Id52 id52) {
        Entry old = connections.get(displacedHandle);
        if (old != null) {
            synchronized (old) {
                if (id52.equals(old.identity)) {
                    old.identity = null;
                }
            }
        }
        notifyDisconnected(displacedHandle);
        if (old != null) {
            old.connection.close("displaced by newer claim for " + id52);
        }
    }

    private void notifyDisconnected(ConnectionHandle handle) {
        for (DisconnectListener l : listeners) {
            l.onDisconnected(handle);
        }
    }
}
