package com.example.chainstream.log;

/**
 * The durable log did not acknowledge a publish: broker unreachable, write rejected or timed out.
 */
public class PublishException extends Exception {

    private final String subject;

    public PublishException(String subject, String message, Throwable cause) {
        super("publish to " + subject + " failed: " + message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
