package com.questrail.bhumi.relay.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * OrderedReplies
 * =============================================================================
 * Emits the results of concurrently completing futures in the order the
 * futures were enqueued.
 *
 * <p>A SEND_RESULT frame does not name the SEND it answers, so replies to one
 * connection must follow the order of that connection's SENDs even though the
 * sends themselves resolve independently. A completed result waits behind any
 * earlier, still pending one.</p>
 *
 * <p>The writer is invoked under this object's lock, one result at a time; it
 * must not block.</p>
 */
final class OrderedReplies<T> {
    private final Deque<CompletableFuture<T>> queue = new ArrayDeque<>();
    private final Consumer<T> writer;

    OrderedReplies(Consumer<T> writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * @param result must complete normally
     */
    void enqueue(CompletableFuture<T> result) {
        Objects.requireNonNull(result, "result");
        synchronized (this) {
            queue.addLast(result);
        }
        result.whenComplete((value, error) -> drain());
    }

    synchronized int pending() {
        return queue.size();
    }

    private synchronized void drain() {
        while (!queue.isEmpty() && queue.peekFirst().isDone()) {
            writer.accept(queue.pollFirst().join());
        }
    }
}
