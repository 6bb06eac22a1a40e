package com.questrail.bhumi.relay.internal.exec;

import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;
import com.questrail.bhumi.relay.internal.state.ConnectionHandle;
import com.questrail.bhumi.relay.internal.time.Cancellable;

import java.util.concurrent.CompletableFuture;

/**
 * A forwarded SEND waiting for its recipient.
 *
 * <p>The future is completed exactly once, by whichever of ACK, recipient
 * disconnect or deadline reaches the pending table first.</p>
 */
final class PendingSend {
    final long correlationId;
    final Id52 recipient;
    final ConnectionHandle recipientHandle;
    final Preimage preimage;
    final CompletableFuture<SendOutcome> result = new CompletableFuture<>();

    private volatile Cancellable deadline;

    PendingSend(long correlationId, Id52 recipient, ConnectionHandle recipientHandle, Preimage preimage) {
        this.correlationId = correlationId;
        this.recipient = recipient;
        this.recipientHandle = recipientHandle;
        this.preimage = preimage;
    }

    void armDeadline(Cancellable deadline) {
        this.deadline = deadline;
        // resolved while the timer was being armed
        if (result.isDone()) {
            deadline.cancel();
        }
    }

    void disarmDeadline() {
        Cancellable d = deadline;
        if (d != null) {
            d.cancel();
        }
    }
}
