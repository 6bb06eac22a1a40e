package com.questrail.bhumi.relay.config;

import com.questrail.bhumi.relay.codec.impl.RelayFraming;
import com.questrail.bhumi.relay.internal.exec.RelayTimingPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for the relay node runtime.
 *
 * @param bindAddress                    listening address; port {@code 0} picks an ephemeral port
 * @param workerThreads                  transport event loop threads, {@code 0} for the Netty default
 * @param maxPayloadSize                 largest frame payload accepted, advertised in HELLO
 * @param maxRecentResponsesPerIdentity  cap on responses accepted from one I_AM upload
 * @param gossipFanout                   peers contacted per gossip round
 * @param gossipBatch                    presence records sent to each peer per round
 */
public record RelayRuntimeConfig(
    InetSocketAddress bindAddress,
    int workerThreads,
    int maxPayloadSize,
    RelayTimingPolicy timingPolicy,
    int maxRecentResponsesPerIdentity,
    int gossipFanout,
    int gossipBatch
) {
    public static final int DEFAULT_PORT = 8443;

    public RelayRuntimeConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0");
        }
        RelayFraming.checkMaxPayload(maxPayloadSize);
        if (maxRecentResponsesPerIdentity < 0) {
            throw new IllegalArgumentException("maxRecentResponsesPerIdentity must be >= 0");
        }
        if (gossipFanout < 1 || gossipBatch < 1) {
            throw new IllegalArgumentException("gossipFanout and gossipBatch must be >= 1");
        }
    }

    public static RelayRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private int workerThreads = 0;
        private int maxPayloadSize = RelayFraming.DEFAULT_MAX_PAYLOAD;
        private RelayTimingPolicy timingPolicy = RelayTimingPolicy.defaults();
        private int maxRecentResponsesPerIdentity = 64;
        private int gossipFanout = 3;
        private int gossipBatch = 16;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.bindAddress = new InetSocketAddress(port);
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withMaxPayloadSize(int maxPayloadSize) {
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        public Builder withTimingPolicy(RelayTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxRecentResponsesPerIdentity(int max) {
            this.maxRecentResponsesPerIdentity = max;
            return this;
        }

        public Builder withGossipFanout(int fanout) {
            this.gossipFanout = fanout;
            return this;
        }

        public Builder withGossipBatch(int batch) {
            this.gossipBatch = batch;
            return this;
        }

        public RelayRuntimeConfig build() {
            return new RelayRuntimeConfig(
                bindAddress,
                workerThreads,
                maxPayloadSize,
                timingPolicy,
                maxRecentResponsesPerIdentity,
                gossipFanout,
                gossipBatch);
        }
    }
}
