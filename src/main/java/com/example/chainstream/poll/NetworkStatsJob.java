package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.NetworkStatsPayload;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Publishes network metadata every tick. Each read is best-effort: a failed read leaves its field out
 * instead of failing the tick.
 */
public class NetworkStatsJob extends PollJob {

    public NetworkStatsJob(Duration interval, UpstreamClient upstream, EnvelopePublisher publisher, Clock clock) {
        super(StreamKind.NETWORK_STATS, interval, upstream, publisher, clock);
    }

    @Override
    protected void pollOnce() throws PublishException {
        BigInteger chainId = read("chainId", upstream::chainId);
        BigInteger blockNumber = read("blockNumber", () -> BigInteger.valueOf(upstream.blockNumber()));
        BigInteger gasPrice = read("gasPrice", upstream::suggestedGasPrice);
        BigInteger peerCount = read("peerCount", upstream::peerCount);
        JsonNode syncing = read("syncing", upstream::syncStatus);

        publish(Subjects.NETWORK, new NetworkStatsPayload(hex(chainId), hex(blockNumber), hex(gasPrice),
                hex(peerCount), syncing, epochSeconds()));
    }

    private <T> T read(String field, Read<T> read) {
        try {
            return read.get();
        } catch (UpstreamException e) {
            log.warn("[NETWORK] Leaving {} out: {}", field, e.getMessage());
            return null;
        }
    }

    private static String hex(BigInteger quantity) {
        return quantity == null ? null : "0x" + quantity.toString(16);
    }

    @FunctionalInterface
    private interface Read<T> {
        T get() throws UpstreamException;
    }
}
