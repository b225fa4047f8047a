package com.example.chainstream;

import com.example.chainstream.log.DurableLog;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.poll.BlocksJob;
import com.example.chainstream.poll.GasPriceJob;
import com.example.chainstream.poll.LogsJob;
import com.example.chainstream.poll.NetworkStatsJob;
import com.example.chainstream.poll.PendingTransactionsJob;
import com.example.chainstream.poll.PollJob;
import com.example.chainstream.poll.PollScheduler;
import com.example.chainstream.rpc.JsonRpcUpstreamClient;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.StreamBridge;
import com.example.chainstream.stream.StreamDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Poll jobs, the stream directory and the fan-out bridge, wired from configuration.
 */
@Configuration
public class ChainStreamConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ChainStreamConfiguration.class);

    @Value("${chainstream.rpc.endpoint:https://dream-rpc.somnia.network}")
    private String rpcEndpoint;

    @Value("${chainstream.rpc.connect-timeout:10s}")
    private Duration rpcConnectTimeout;

    @Value("${chainstream.rpc.request-timeout:10s}")
    private Duration rpcRequestTimeout;

    @Value("${chainstream.startup.verify-upstream:true}")
    private boolean verifyUpstream;

    @Value("${chainstream.poll.enabled:true}")
    private boolean pollEnabled;

    @Value("${chainstream.poll.blocks:2s}")
    private Duration blocksInterval;

    @Value("${chainstream.poll.pending:3s}")
    private Duration pendingInterval;

    @Value("${chainstream.poll.logs:5s}")
    private Duration logsInterval;

    @Value("${chainstream.poll.network:10s}")
    private Duration networkInterval;

    @Value("${chainstream.poll.gas-price:15s}")
    private Duration gasPriceInterval;

    @Value("${chainstream.streams.reject-unknown:false}")
    private boolean rejectUnknownStreams;

    @Value("${chainstream.sse.poll-timeout:500ms}")
    private Duration ssePollTimeout;

    @Value("${chainstream.sse.heartbeat:15s}")
    private Duration sseHeartbeat;

    @Value("${chainstream.shutdown.grace:5s}")
    private Duration shutdownGrace;

    @Bean
    public UpstreamClient upstreamClient(ObjectMapper objectMapper) {
        return new JsonRpcUpstreamClient(rpcEndpoint, rpcConnectTimeout, rpcRequestTimeout, objectMapper);
    }

    @Bean
    public EnvelopePublisher envelopePublisher(DurableLog durableLog, ObjectMapper objectMapper) {
        return new EnvelopePublisher(durableLog, objectMapper);
    }

    @Bean
    public StreamDirectory streamDirectory() {
        return new StreamDirectory(rejectUnknownStreams);
    }

    @Bean(destroyMethod = "shutdown")
    public StreamBridge streamBridge(DurableLog durableLog, StreamDirectory streamDirectory) {
        return new StreamBridge(durableLog, streamDirectory, ssePollTimeout, sseHeartbeat, shutdownGrace);
    }

    @Bean(destroyMethod = "shutdown")
    public PollScheduler pollScheduler(UpstreamClient upstreamClient, EnvelopePublisher envelopePublisher) {
        Clock clock = Clock.systemUTC();
        List<PollJob> jobs = List.of(
                new BlocksJob(blocksInterval, upstreamClient, envelopePublisher, clock),
                new PendingTransactionsJob(pendingInterval, upstreamClient, envelopePublisher, clock),
                new LogsJob(logsInterval, upstreamClient, envelopePublisher, clock),
                new NetworkStatsJob(networkInterval, upstreamClient, envelopePublisher, clock),
                new GasPriceJob(gasPriceInterval, upstreamClient, envelopePublisher, clock));
        return new PollScheduler(jobs, shutdownGrace);
    }

    @Bean
    public CommandLineRunner startPollJobs(PollScheduler pollScheduler, UpstreamClient upstreamClient) {
        return args -> {
            if (verifyUpstream) {
                try {
                    BigInteger chainId = upstreamClient.chainId();
                    log.info("Connected to {} (chain id {})", rpcEndpoint, chainId);
                } catch (UpstreamException e) {
                    throw new IllegalStateException("Failed to connect to RPC endpoint " + rpcEndpoint, e);
                }
            }
            if (!pollEnabled) {
                log.info("Polling disabled, {} jobs not started", StreamKind.values().length);
                return;
            }
            pollScheduler.start();
        };
    }
}
