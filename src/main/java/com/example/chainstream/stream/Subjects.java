package com.example.chainstream.stream;

import java.util.List;

/**
 * Durable log subjects the poll jobs publish to.
 */
public final class Subjects {

    public static final String BLOCKS_FULL = "eth.blocks.full";
    public static final String BLOCKS_SIMPLE = "eth.blocks";
    public static final String PENDING = "eth.pending";
    public static final String LOGS = "eth.logs";
    public static final String NETWORK = "eth.network";
    public static final String GAS_PRICE = "eth.gasPrice";

    public static final List<String> ALL = List.of(BLOCKS_FULL, BLOCKS_SIMPLE, PENDING, LOGS, NETWORK, GAS_PRICE);

    private Subjects() {
    }
}
