package com.example.chainstream.rpc;

import java.math.BigInteger;
import java.util.List;

/**
 * A block fetched together with its full transaction bodies.
 */
public class FullBlock {

    private final long number;
    private final String hash;
    private final String parentHash;
    private final long timestamp;
    private final long gasUsed;
    private final long gasLimit;
    private final BigInteger difficulty;
    private final long size;
    private final List<ChainTransaction> transactions;

    public FullBlock(long number, String hash, String parentHash, long timestamp, long gasUsed, long gasLimit,
                     BigInteger difficulty, long size, List<ChainTransaction> transactions) {
        this.number = number;
        this.hash = hash;
        this.parentHash = parentHash;
        this.timestamp = timestamp;
        this.gasUsed = gasUsed;
        this.gasLimit = gasLimit;
        this.difficulty = difficulty;
        this.size = size;
        this.transactions = List.copyOf(transactions);
    }

    public long getNumber() {
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

    public long getGasUsed() {
        return gasUsed;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public BigInteger getDifficulty() {
        return difficulty;
    }

    public long getSize() {
        return size;
    }

    public List<ChainTransaction> getTransactions() {
        return transactions;
    }
}
