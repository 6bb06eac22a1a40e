package com.questrail.bhumi.relay.cli;

import com.questrail.bhumi.relay.codec.impl.RelayFraming;
import com.questrail.bhumi.relay.config.RelayRuntimeConfig;
import com.questrail.bhumi.relay.internal.exec.RelayTimingPolicy;
import com.questrail.bhumi.relay.observability.Slf4jRelayObservabilitySink;
import com.questrail.bhumi.relay.runtime.RelayNodeRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point: runs one relay node until the process is stopped.
 */
@Command(
        name = "bhumi-relay",
        mixinStandardHelpOptions = true,
        description = "Runs a bhumi relay node"
)
public final class RelayMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RelayMain.class);

    @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind host")
    String bind;

    @Option(names = {"--port"}, defaultValue = "8443", description = "Bind port")
    int port;

    @Option(names = {"--worker-threads"}, defaultValue = "0", description = "Transport event loop threads; 0 uses the Netty default")
    int workerThreads;

    @Option(names = {"--max-payload"}, defaultValue = "65536", description = "Largest accepted frame payload in bytes")
    int maxPayload;

    @Option(names = {"--send-timeout-ms"}, defaultValue = "30000", description = "How long a SEND waits for the recipient's ACK")
    long sendTimeoutMs;

    @Option(names = {"--cache-ttl-seconds"}, defaultValue = "300", description = "Lifetime of cached responses")
    long cacheTtlSeconds;

    @Option(names = {"--cache-sweep-seconds"}, defaultValue = "30", description = "Interval of the expired-response sweep")
    long cacheSweepSeconds;

    @Option(names = {"--idle-timeout-seconds"}, defaultValue = "90", description = "Close connections silent for this long")
    long idleTimeoutSeconds;

    @Option(names = {"--gossip-interval-seconds"}, defaultValue = "15", description = "Interval between presence gossip rounds")
    long gossipIntervalSeconds;

    @Option(names = {"--gossip-fanout"}, defaultValue = "3", description = "Peers contacted per gossip round")
    int gossipFanout;

    @Option(names = {"--gossip-batch"}, defaultValue = "16", description = "Presence records sent to each peer per round")
    int gossipBatch;

    @Option(names = {"--max-recent-responses"}, defaultValue = "64", description = "Responses accepted from one I_AM upload")
    int maxRecentResponses;

    @Override
    public Integer call() throws Exception {
        RelayNodeRuntime runtime = RelayNodeRuntime.builder()
                .withConfig(toConfig())
                .withObservabilitySink(new Slf4jRelayObservabilitySink())
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Stopping relay");
            runtime.stop();
            stopped.countDown();
        }, "bhumi-relay-shutdown"));

        runtime.start();
        log.info("Relay listening on {}", runtime.localAddress().map(String::valueOf).orElse("?"));
        stopped.await();
        return 0;
    }

    RelayRuntimeConfig toConfig() {
        if (maxPayload > RelayFraming.ABSOLUTE_MAX_PAYLOAD) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "--max-payload must not exceed " + RelayFraming.ABSOLUTE_MAX_PAYLOAD);
        }
        RelayTimingPolicy timing = new RelayTimingPolicy(
                Duration.ofMillis(sendTimeoutMs),
                Duration.ofSeconds(cacheTtlSeconds),
                Duration.ofSeconds(cacheSweepSeconds),
                Duration.ofSeconds(idleTimeoutSeconds),
                Duration.ofSeconds(gossipIntervalSeconds));

        return RelayRuntimeConfig.builder()
                .withBindAddress(new InetSocketAddress(bind, port))
                .withWorkerThreads(workerThreads)
                .withMaxPayloadSize(maxPayload)
                .withTimingPolicy(timing)
                .withMaxRecentResponsesPerIdentity(maxRecentResponses)
                .withGossipFanout(gossipFanout)
                .withGossipBatch(gossipBatch)
                .build();
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RelayMain()).execute(args);
        System.exit(code);
    }
}
