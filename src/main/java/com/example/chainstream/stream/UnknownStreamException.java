package com.example.chainstream.stream;

/**
 * A subscriber asked for a logical stream the directory does not know, and unknown names are rejected.
 */
public class UnknownStreamException extends RuntimeException {

    private final String streamName;

    public UnknownStreamException(String streamName) {
        super("Unknown stream: " + streamName);
        this.streamName = streamName;
    }

    public String getStreamName() {
        return streamName;
    }
}
