package com.questrail.bhumi.relay.runtime;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.SendStatus;
import com.questrail.bhumi.relay.codec.FrameDecoder;
import com.questrail.bhumi.relay.codec.FramingException;
import com.questrail.bhumi.relay.internal.decode.RelayDecodeException;
import com.questrail.bhumi.relay.internal.exec.SendOutcome;
import com.questrail.bhumi.relay.internal.frame.RelayFrame;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.internal.state.IdentityVerificationException;
import com.questrail.bhumi.relay.internal.state.RelayConnection;
import com.questrail.bhumi.relay.model.*;
import com.questrail.bhumi.relay.observability.RelayConnectionEvent;
import com.questrail.bhumi.relay.observability.RelayErrorEvent;
import com.questrail.bhumi.relay.transport.StreamConnection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RelaySession
 * =============================================================================
 * The relay's side of one device connection.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   StreamConnection bytes
 *        → FrameDecoder (per session, streaming)
 *            → RelayMessageDecoder
 *                → dispatch: I_AM / SEND / ACK / KEEPALIVE / PRESENCE
 * </pre>
 *
 * <h2>Error classes</h2>
 * <ul>
 *   <li>Framing errors, undecodable payloads and failed identity proofs close
 *       the connection.</li>
 *   <li>Unknown frame types and relay-to-client types sent by a client are
 *       reported and ignored.</li>
 *   <li>Admission and delivery failures of a SEND are answered with a
 *       SEND_RESULT status; they never affect the connection.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Inbound callbacks arrive serially from the transport. Outbound messages
 * ({@link #send(RelayMessage)}) may come from any thread: deliveries routed
 * from other sessions, timeouts from the scheduler, gossip.
 */
public final class RelaySession implements RelayConnection {
    private final RelayNode node;
    private final StreamConnection stream;
    private final int nonce;
    private final FrameDecoder frameDecoder;
    private final OrderedReplies<SendOutcome> replies;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile ConnectionHandle handle;

    RelaySession(RelayNode node, StreamConnection stream, int nonce, FrameDecoder frameDecoder) {
        this.node = Objects.requireNonNull(node, "node");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.nonce = nonce;
        this.replies = new OrderedReplies<>(outcome -> send(outcome.toResult()));
    }

    /**
     * Registers the connection and sends HELLO.
     */
    void open() {
        handle = node.registry().register(this);
        node.sink().onConnectionEvent(new RelayConnectionEvent(
                node.wallClock().now(), handle, RelayConnectionEvent.Kind.OPENED, null,
                String.valueOf(stream.remoteAddress())));
        send(new Hello(Hello.CURRENT_VERSION, nonce, node.maxPayloadSize()));
    }

    void onBytes(byte[] bytes) {
        if (closed.get()) {
            return;
        }
        node.activity().recordActivity(handle);

        final List<RelayFrame> frames;
        try {
            frames = frameDecoder.feed(bytes);
        } catch (FramingException e) {
            fail("Framing error", e);
            return;
        }

        for (RelayFrame frame : frames) {
            if (closed.get()) {
                return;
            }
            try {
                dispatch(frame);
            } catch (RelayDecodeException e) {
                fail("Undecodable " + frame, e);
            } catch (IdentityVerificationException e) {
                fail("Identity proof rejected for " + e.claimed().shortHex(), e);
            }
        }
    }

    /**
     * The transport reports the connection gone.
     */
    void onTransportClosed(Throwable cause) {
        if (cause != null && !closed.get()) {
            node.sink().onError(new RelayErrorEvent(node.wallClock().now(), handle,
                    "Transport error", cause, true));
        }
        close(cause == null ? "closed by peer" : "transport error");
    }

    public ConnectionHandle handle() {
        return handle;
    }

    // -------------------------------------------------------------------------
    // RelayConnection
    // -------------------------------------------------------------------------

    @Override
    public int challengeNonce() {
        return nonce;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && stream.isOpen();
    }

    @Override
    public void send(RelayMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            return;
        }
        final byte[] bytes;
        try {
            bytes = node.frameEncoder().encode(node.messageEncoder().encode(message));
        } catch (IllegalArgumentException e) {
            node.sink().onError(new RelayErrorEvent(node.wallClock().now(), handle,
                    "Cannot encode outbound " + message.type(), e, false));
            return;
        }
        stream.write(bytes);
    }

    @Override
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stream.close();
        if (handle == null) {
            return;
        }
        Id52 identity = node.registry().identityOf(handle).orElse(null);
        node.registry().unbind(handle);
        node.sink().onConnectionEvent(new RelayConnectionEvent(
                node.wallClock().now(), handle, RelayConnectionEvent.Kind.CLOSED, identity, reason));
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    private void dispatch(RelayFrame frame) {
        Optional<RelayMessageType> type = RelayMessageType.fromCode(frame.type());
        if (type.isEmpty()) {
            anomaly("Ignoring unknown frame type 0x" + Integer.toHexString(frame.type()));
            return;
        }

        RelayMessage message = node.messageDecoder().decode(frame);
        switch (type.get()) {
            case I_AM -> onIAm((IAm) message);
            case SEND -> onSend((Send) message);
            case ACK -> onAck((Ack) message);
            case KEEPALIVE -> { }
            case PRESENCE -> node.presence().accept(((Presence) message).record());
            default -> anomaly("Ignoring " + type.get() + " sent by client");
        }
    }

    private void onIAm(IAm iam) {
        final Optional<ConnectionHandle> displaced;
        try {
            displaced = node.registry().bind(handle, iam.id52(), iam.signature(), () -> {
                node.capabilities().install(iam.id52(), iam.commits());
                node.cache().storeRecent(iam.id52(), iam.recentResponses(),
                        node.timing().responseCacheTtl());
            });
        } catch (IllegalStateException e) {
            // closed concurrently, e.g. displaced by another claim
            anomaly("I_AM on a connection that is no longer registered");
            return;
        }

        displaced.ifPresent(old -> node.sink().onConnectionEvent(new RelayConnectionEvent(
                node.wallClock().now(), old, RelayConnectionEvent.Kind.DISPLACED, iam.id52(),
                "replaced by " + handle)));
        node.sink().onConnectionEvent(new RelayConnectionEvent(
                node.wallClock().now(), handle, RelayConnectionEvent.Kind.BOUND, iam.id52(),
                iam.commits().size() + " commits, " + iam.recentResponses().size() + " cached responses"));
    }

    private void onSend(Send send) {
        CompletableFuture<SendOutcome> outcome = node.orchestrator().send(send)
                .exceptionally(e -> {
                    node.sink().onError(new RelayErrorEvent(node.wallClock().now(), handle,
                            "SEND resolution failed", e, false));
                    return SendOutcome.failed(SendStatus.RECIPIENT_DISCONNECTED);
                });
        replies.enqueue(outcome);
    }

    private void onAck(Ack ack) {
        if (!node.orchestrator().acknowledge(handle, ack.correlationId(), ack.payload())) {
            anomaly("Ignoring ACK for correlation id " + ack.correlationId() + " not pending on this connection");
        }
    }

    private void anomaly(String message) {
        node.sink().onError(new RelayErrorEvent(node.wallClock().now(), handle, message, null, false));
    }

    private void fail(String message, Throwable cause) {
        node.sink().onError(new RelayErrorEvent(node.wallClock().now(), handle, message, cause, true));
        close(message);
    }

    @Override
    public String toString() {
        return "RelaySession[" + handle + " " + stream + "]";
    }
}
