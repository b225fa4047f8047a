package com.example.chainstream.log;

/**
 * One message handed to a subscription, with its acknowledgement handle.
 */
public interface DeliveredMessage {

    String getSubject();

    String getPayload();

    /**
     * Tell the log this message has been handed on. Unacknowledged messages may be redelivered
     * after a restart.
     */
    void ack();
}
