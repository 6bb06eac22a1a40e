package com.questrail.bhumi.relay.testing;

import com.questrail.bhumi.relay.internal.state.RelayConnection;
import com.questrail.bhumi.relay.model.RelayMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recording {@link RelayConnection} for tests. Closing it only flips a flag;
 * wiring close to the registry is up to the test.
 */
public final class FakeRelayConnection implements RelayConnection {
    private final int nonce;
    private final List<RelayMessage> sent = new ArrayList<>();
    private volatile boolean open = true;
    private volatile String closeReason;
    private volatile RuntimeException sendFailure;

    public FakeRelayConnection(int nonce) {
        this.nonce = nonce;
    }

    @Override
    public int challengeNonce() {
        return nonce;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void send(RelayMessage message) {
        if (sendFailure != null) {
            throw sendFailure;
        }
        if (open) {
            sent.add(message);
        }
    }

    @Override
    public void close(String reason) {
        if (open) {
            open = false;
            closeReason = reason;
        }
    }

    public void failSendsWith(RuntimeException e) {
        this.sendFailure = e;
    }

    public synchronized List<RelayMessage> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized <T extends RelayMessage> List<T> sent(Class<T> type) {
        return sent.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public String closeReason() {
        return closeReason;
    }
}
