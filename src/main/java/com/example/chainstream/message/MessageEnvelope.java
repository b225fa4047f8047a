package com.example.chainstream.message;

import java.time.Instant;
import java.util.Objects;

/**
 * A normalized message produced by a poll job: its kind, the subject it is published to, the
 * kind-specific payload and when it was built.
 */
public final class MessageEnvelope {

    private final StreamKind kind;
    private final String subject;
    private final Object payload;
    private final Instant timestamp;

    public MessageEnvelope(StreamKind kind, String subject, Object payload, Instant timestamp) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public StreamKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MessageEnvelope{kind=" + kind + ", subject=" + subject + ", timestamp=" + timestamp + "}";
    }
}
