package com.example.chainstream.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Recent event logs on {@code eth.logs}. {@code count} is the full match count.
 */
@JsonPropertyOrder({"count", "logs", "fromBlock", "toBlock", "timestamp"})
public class LogsPayload {

    private final int count;
    private final List<JsonNode> logs;
    private final long fromBlock;
    private final long toBlock;
    private final long timestamp;

    public LogsPayload(int count, List<JsonNode> logs, long fromBlock, long toBlock, long timestamp) {
        this.count = count;
        this.logs = List.copyOf(logs);
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
        this.timestamp = timestamp;
    }

    public int getCount() {
        return count;
    }

    public List<JsonNode> getLogs() {
        return logs;
    }

    public long getFromBlock() {
        return fromBlock;
    }

    public long getToBlock() {
        return toBlock;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
