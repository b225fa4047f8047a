package com.example.chainstream.message;

import com.example.chainstream.log.DurableLog;
import com.example.chainstream.log.PublishException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;

/**
 * Serializes envelope payloads to JSON and appends them to the durable log, keyed by stream kind.
 */
public class EnvelopePublisher {

    private final DurableLog durableLog;
    private final ObjectMapper objectMapper;

    public EnvelopePublisher(DurableLog durableLog, ObjectMapper objectMapper) {
        this.durableLog = durableLog;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the number of bytes of JSON published
     */
    public int publish(MessageEnvelope envelope) throws PublishException {
        String data;
        try {
            data = objectMapper.writeValueAsString(envelope.getPayload());
        } catch (JsonProcessingException e) {
            throw new PublishException(envelope.getSubject(), "payload not serializable: " + e.getOriginalMessage(), e);
        }
        durableLog.publish(envelope.getSubject(), envelope.getKind().name(), data);
        return data.getBytes(StandardCharsets.UTF_8).length;
    }
}
