package com.example.chainstream.stream;

/**
 * A subscription could not be opened: the durable log refused it or the bridge is shutting down.
 */
public class StreamUnavailableException extends RuntimeException {

    public StreamUnavailableException(String message) {
        super(message);
    }

    public StreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
