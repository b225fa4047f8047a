package com.example.chainstream.rpc;

import java.math.BigInteger;

/**
 * A transaction body inside a fetched block.
 */
public class ChainTransaction {

    private final String hash;
    private final String to;
    private final BigInteger value;
    private final BigInteger gasPrice;
    private final long gas;
    private final long nonce;

    public ChainTransaction(String hash, String to, BigInteger value, BigInteger gasPrice, long gas, long nonce) {
        this.hash = hash;
        this.to = to;
        this.value = value;
        this.gasPrice = gasPrice;
        this.gas = gas;
        this.nonce = nonce;
    }

    public String getHash() {
        return hash;
    }

    /**
     * Recipient address, or null for a contract creation
     */
    public String getTo() {
        return to;
    }

    public BigInteger getValue() {
        return value;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public long getGas() {
        return gas;
    }

    public long getNonce() {
        return nonce;
    }
}
