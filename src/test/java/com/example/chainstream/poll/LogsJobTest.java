package com.example.chainstream.poll;

import com.example.chainstream.log.InMemoryDurableLog;
import com.example.chainstream.log.RetentionPolicy;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LogsJobTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-09-16T12:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper json = new ObjectMapper();

    private UpstreamClient upstream;
    private InMemoryDurableLog durableLog;
    private LogsJob job;

    @BeforeEach
    void setUp() {
        upstream = mock(UpstreamClient.class);
        durableLog = new InMemoryDurableLog(RetentionPolicy.defaults(), clock);
        job = new LogsJob(Duration.ofSeconds(5), upstream, new EnvelopePublisher(durableLog, json), clock);
    }

    @Test
    void queriesFiveBlocksBackToHead() throws Exception {
        when(upstream.blockNumber()).thenReturn(100L);
        when(upstream.logsInRange(95, 100)).thenReturn(logs(2));

        job.run();

        JsonNode payload = json.readTree(durableLog.retained(Subjects.LOGS).get(0));
        assertThat(payload.get("fromBlock").asLong()).isEqualTo(95);
        assertThat(payload.get("toBlock").asLong()).isEqualTo(100);
        assertThat(payload.get("count").asInt()).isEqualTo(2);
        assertThat(payload.get("logs")).hasSize(2);
    }

    @Test
    void nearGenesis_fromBlockClampedToZero() throws Exception {
        when(upstream.blockNumber()).thenReturn(3L);
        when(upstream.logsInRange(0, 3)).thenReturn(logs(1));

        job.run();

        JsonNode payload = json.readTree(durableLog.retained(Subjects.LOGS).get(0));
        assertThat(payload.get("fromBlock").asLong()).isZero();
        assertThat(payload.get("toBlock").asLong()).isEqualTo(3);
    }

    @Test
    void manyLogs_truncatedToHundredButCountsAll() throws Exception {
        when(upstream.blockNumber()).thenReturn(500L);
        when(upstream.logsInRange(495, 500)).thenReturn(logs(250));

        job.run();

        JsonNode payload = json.readTree(durableLog.retained(Subjects.LOGS).get(0));
        assertThat(payload.get("count").asInt()).isEqualTo(250);
        assertThat(payload.get("logs")).hasSize(LogsJob.MAX_LOGS);
    }

    @Test
    void noMatches_publishesNothing() throws Exception {
        when(upstream.blockNumber()).thenReturn(100L);
        when(upstream.logsInRange(95, 100)).thenReturn(List.of());

        job.run();

        assertThat(durableLog.retained(Subjects.LOGS)).isEmpty();
    }

    @Test
    void headReadFails_logsNotQueried() throws Exception {
        when(upstream.blockNumber()).thenThrow(new UpstreamException("eth_blockNumber", "timeout"));

        job.run();

        verify(upstream, never()).logsInRange(anyLong(), anyLong());
        assertThat(durableLog.retained(Subjects.LOGS)).isEmpty();
    }

    private List<JsonNode> logs(int size) {
        List<JsonNode> logs = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            logs.add(json.createObjectNode().put("address", "0xcontract").put("logIndex", "0x" + Integer.toHexString(i)));
        }
        return logs;
    }
}
