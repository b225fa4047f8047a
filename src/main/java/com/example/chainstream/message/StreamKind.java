package com.example.chainstream.message;

/**
 * The fixed set of data kinds polled from the upstream node.
 */
public enum StreamKind {

    BLOCKS("BLOCKS"),
    PENDING_TRANSACTIONS("PENDING"),
    LOGS("LOGS"),
    NETWORK_STATS("NETWORK"),
    GAS_PRICE("GAS");

    private final String tag;

    StreamKind(String tag) {
        this.tag = tag;
    }

    /**
     * Short label used to prefix log lines, e.g. {@code [BLOCKS]}
     */
    public String getTag() {
        return tag;
    }
}
