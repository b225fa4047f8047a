package com.example.chainstream.rpc;

/**
 * The chain head as returned without transaction bodies.
 */
public class BlockSummary {

    private final long number;
    private final String hash;

    public BlockSummary(long number, String hash) {
        this.number = number;
        this.hash = hash;
    }

    public long getNumber() {
        return number;
    }

    public String getHash() {
        return hash;
    }
}
