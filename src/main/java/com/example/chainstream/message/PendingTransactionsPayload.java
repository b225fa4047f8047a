package com.example.chainstream.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Pending pool snapshot on {@code eth.pending}. {@code count} is the size of the whole pool,
 * {@code transactions} only its head.
 */
@JsonPropertyOrder({"count", "transactions", "timestamp"})
public class PendingTransactionsPayload {

    private final int count;
    private final List<JsonNode> transactions;
    private final long timestamp;

    public PendingTransactionsPayload(int count, List<JsonNode> transactions, long timestamp) {
        this.count = count;
        this.transactions = List.copyOf(transactions);
        this.timestamp = timestamp;
    }

    public int getCount() {
        return count;
    }

    public List<JsonNode> getTransactions() {
        return transactions;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
