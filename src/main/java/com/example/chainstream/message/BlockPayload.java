package com.example.chainstream.message;

import com.example.chainstream.rpc.ChainTransaction;
import com.example.chainstream.rpc.FullBlock;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Full block payload on {@code eth.blocks.full}: block metadata plus every transaction in the block.
 */
@JsonPropertyOrder({"number", "hash", "parentHash", "timestamp", "gasUsed", "gasLimit", "difficulty", "size",
        "txCount", "transactions"})
public class BlockPayload {

    private final String number;
    private final String hash;
    private final String parentHash;
    private final long timestamp;
    private final long gasUsed;
    private final long gasLimit;
    private final String difficulty;
    private final long size;
    private final List<BlockTransaction> transactions;

    public BlockPayload(String number, String hash, String parentHash, long timestamp, long gasUsed, long gasLimit,
                        String difficulty, long size, List<BlockTransaction> transactions) {
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

    public static BlockPayload from(FullBlock block) {
        List<BlockTransaction> transactions = new ArrayList<>(block.getTransactions().size());
        for (ChainTransaction tx : block.getTransactions()) {
            transactions.add(BlockTransaction.from(tx));
        }
        return new BlockPayload(Long.toString(block.getNumber()), block.getHash(), block.getParentHash(),
                block.getTimestamp(), block.getGasUsed(), block.getGasLimit(), block.getDifficulty().toString(),
                block.getSize(), transactions);
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

    public long getGasUsed() {
        return gasUsed;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public String getDifficulty() {
        return difficulty;
    }

    public long getSize() {
        return size;
    }

    public int getTxCount() {
        return transactions.size();
    }

    public List<BlockTransaction> getTransactions() {
        return transactions;
    }
}
