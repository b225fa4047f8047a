package com.example.chainstream.log;

/**
 * Append-only, subject-partitioned message log with publish acknowledgements and tailing
 * subscriptions. Ordering is per subject.
 */
public interface DurableLog {

    /**
     * Append {@code payload} to {@code subject}, blocking until the log has acknowledged it.
     *
     * @param subject the subject to append to
     * @param key     a routing key carried with the message (the stream kind)
     * @param payload JSON text
     */
    void publish(String subject, String key, String payload) throws PublishException;

    /**
     * Open a subscription that sees only messages published to {@code subject} after this call returns.
     */
    LogSubscription subscribeNew(String subject);
}
