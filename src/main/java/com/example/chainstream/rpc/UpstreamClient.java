package com.example.chainstream.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only access to the chain state of an upstream node. Every call may fail transiently;
 * callers treat an {@link UpstreamException} as "try again on the next tick".
 */
public interface UpstreamClient {

    /**
     * The current chain head, without transaction bodies
     */
    BlockSummary latestHead() throws UpstreamException;

    /**
     * Block {@code number} together with its full transaction bodies
     */
    FullBlock blockWithTransactions(long number) throws UpstreamException;

    /**
     * Current head height
     */
    long blockNumber() throws UpstreamException;

    /**
     * The whole pending pool as raw transaction objects
     */
    List<JsonNode> pendingTransactions() throws UpstreamException;

    /**
     * Event logs emitted in blocks {@code from}..{@code to}, both inclusive, as raw log objects
     */
    List<JsonNode> logsInRange(long from, long to) throws UpstreamException;

    BigInteger chainId() throws UpstreamException;

    BigInteger peerCount() throws UpstreamException;

    /**
     * {@code false} when the node is in sync, otherwise the node's sync progress object
     */
    JsonNode syncStatus() throws UpstreamException;

    BigInteger suggestedGasPrice() throws UpstreamException;
}
