package com.example.chainstream.log;

import java.time.Duration;
import java.util.List;

/**
 * A tailing subscription on one subject, positioned at the end of the subject when it was opened.
 *
 * A subscription is driven by a single thread: {@link #poll} and {@link DeliveredMessage#ack} must be
 * called from the thread that owns it. {@link #wakeup} is the only method safe to call from elsewhere.
 */
public interface LogSubscription extends AutoCloseable {

    String getSubject();

    /**
     * Wait up to {@code timeout} for new messages, in publish order. Returns an empty list on timeout
     * or when woken up.
     */
    List<DeliveredMessage> poll(Duration timeout);

    /**
     * Make a blocked or the next {@link #poll} return promptly.
     */
    void wakeup();

    @Override
    void close();
}
