package com.example.chainstream.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Suggested gas price on {@code eth.gasPrice}, raw in wei and converted to gwei.
 */
@JsonPropertyOrder({"gasPrice", "gwei", "timestamp"})
public class GasPricePayload {

    private static final int GWEI_DECIMALS = 9;

    private final String gasPrice;
    private final double gwei;
    private final long timestamp;

    public GasPricePayload(BigInteger weiPrice, long timestamp) {
        this.gasPrice = weiPrice.toString();
        this.gwei = new BigDecimal(weiPrice).movePointLeft(GWEI_DECIMALS).doubleValue();
        this.timestamp = timestamp;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public double getGwei() {
        return gwei;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
