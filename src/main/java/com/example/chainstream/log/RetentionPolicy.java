package com.example.chainstream.log;

import java.time.Duration;

/**
 * Per-subject retention bounds. Whichever bound is exceeded first evicts the oldest messages.
 */
public class RetentionPolicy {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);
    public static final int DEFAULT_MAX_MESSAGES = 10_000;

    private final Duration maxAge;
    private final int maxMessages;

    public RetentionPolicy(Duration maxAge, int maxMessages) {
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive: " + maxAge);
        }
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.maxAge = maxAge;
        this.maxMessages = maxMessages;
    }

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(DEFAULT_MAX_AGE, DEFAULT_MAX_MESSAGES);
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    @Override
    public String toString() {
        return "RetentionPolicy{maxAge=" + maxAge + ", maxMessages=" + maxMessages + "}";
    }
}
