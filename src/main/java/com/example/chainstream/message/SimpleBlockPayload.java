package com.example.chainstream.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Reduced block payload on {@code eth.blocks}, without transaction bodies.
 */
@JsonPropertyOrder({"number", "hash", "parentHash", "timestamp", "txCount"})
public class SimpleBlockPayload {

    private final String number;
    private final String hash;
    private final String parentHash;
    private final long timestamp;
    private final int txCount;

    public SimpleBlockPayload(String number, String hash, String parentHash, long timestamp, int txCount) {
        this.number = number;
        this.hash = hash;
        this.parentHash = parentHash;
        this.timestamp = timestamp;
        this.txCount = txCount;
    }

    public static SimpleBlockPayload from(BlockPayload block) {
        return new SimpleBlockPayload(block.getNumber(), block.getHash(), block.getParentHash(), block.getTimestamp(),
                block.getTxCount());
    }

    public String getNumber() {
        return number;
    }

    public String getHash() {
        return hash;
    }

    public String getParentHash() {
        return parentHash;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getTxCount() {
        return txCount;
    }
}
