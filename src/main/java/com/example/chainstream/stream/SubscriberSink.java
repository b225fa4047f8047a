package com.example.chainstream.stream;

import java.io.IOException;

/**
 * The transport side of one subscriber connection. An {@link IOException} from any send means the
 * subscriber is gone.
 */
public interface SubscriberSink {

    /**
     * Deliver one message payload as one event
     */
    void send(String data) throws IOException;

    /**
     * Send something that carries no message, to find out whether the connection is still alive
     */
    void heartbeat() throws IOException;

    /**
     * End the connection from the server side. Called once, when the relay exits.
     */
    void complete();
}
