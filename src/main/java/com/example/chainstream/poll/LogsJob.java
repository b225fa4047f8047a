package com.example.chainstream.poll;

import com.example.chainstream.log.PublishException;
import com.example.chainstream.message.EnvelopePublisher;
import com.example.chainstream.message.LogsPayload;
import com.example.chainstream.message.StreamKind;
import com.example.chainstream.rpc.UpstreamClient;
import com.example.chainstream.rpc.UpstreamException;
import com.example.chainstream.stream.Subjects;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Publishes the event logs of the last {@value #LOOKBACK_BLOCKS} blocks up to the head, truncated to
 * {@value #MAX_LOGS} entries. Windows overlap between ticks; logs are not deduplicated.
 */
public class LogsJob extends PollJob {

    static final long LOOKBACK_BLOCKS = 5;
    static final int MAX_LOGS = 100;

    public LogsJob(Duration interval, UpstreamClient upstream, EnvelopePublisher publisher, Clock clock) {
        super(StreamKind.LOGS, interval, upstream, publisher, clock);
    }

    @Override
    protected void pollOnce() throws UpstreamException, PublishException {
        long head = upstream.blockNumber();
        long fromBlock = Math.max(0, head - LOOKBACK_BLOCKS);

        log.debug("[LOGS] Fetching logs for blocks {}..{}", fromBlock, head);
        List<JsonNode> logs = upstream.logsInRange(fromBlock, head);
        if (logs.isEmpty()) {
            log.debug("[LOGS] No logs in blocks {}..{}", fromBlock, head);
            return;
        }

        List<JsonNode> limited = logs.subList(0, Math.min(logs.size(), MAX_LOGS));
        publish(Subjects.LOGS, new LogsPayload(logs.size(), limited, fromBlock, head, epochSeconds()));
    }
}
