package com.example.chainstream.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Network metadata on {@code eth.network}. Quantities are hex strings as the node reports them; a
 * field whose read failed is left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"chainId", "blockNumber", "gasPrice", "peerCount", "syncing", "timestamp"})
public class NetworkStatsPayload {

    private final String chainId;
    private final String blockNumber;
    private final String gasPrice;
    private final String peerCount;
    private final JsonNode syncing;
    private final long timestamp;

    public NetworkStatsPayload(String chainId, String blockNumber, String gasPrice, String peerCount,
                               JsonNode syncing, long timestamp) {
        this.chainId = chainId;
        this.blockNumber = blockNumber;
        this.gasPrice = gasPrice;
        this.peerCount = peerCount;
        this.syncing = syncing;
        this.timestamp = timestamp;
    }

    public String getChainId() {
        return chainId;
    }

    public String getBlockNumber() {
        return blockNumber;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public String getPeerCount() {
        return peerCount;
    }

    public JsonNode getSyncing() {
        return syncing;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
