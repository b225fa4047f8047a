package com.example.chainstream.message;

import com.example.chainstream.rpc.ChainTransaction;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"hash", "to", "value", "gasPrice", "gas", "nonce"})
public class BlockTransaction {

    private final String hash;
    private final String to;
    private final String value;
    private final String gasPrice;
    private final long gas;
    private final long nonce;

    public BlockTransaction(String hash, String to, String value, String gasPrice, long gas, long nonce) {
        this.hash = hash;
        this.to = to;
        this.value = value;
        this.gasPrice = gasPrice;
        this.gas = gas;
        this.nonce = nonce;
    }

    public static BlockTransaction from(ChainTransaction tx) {
        return new BlockTransaction(tx.getHash(), tx.getTo(), tx.getValue().toString(), tx.getGasPrice().toString(),
                tx.getGas(), tx.getNonce());
    }

    public String getHash() {
        return hash;
    }

    public String getTo() {
        return to;
    }

    public String getValue() {
        return value;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public long getGas() {
        return gas;
    }

    public long getNonce() {
        return nonce;
    }
}
