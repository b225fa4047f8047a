package com.example.chainstream;

import com.example.chainstream.stream.SubscriberSink;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes relayed messages to an SSE response, one {@code data:} event per message.
 */
class SseEmitterSink implements SubscriberSink {

    private final SseEmitter emitter;

    SseEmitterSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String data) throws IOException {
        emitter.send(SseEmitter.event().data(data));
    }

    @Override
    public void heartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("keepalive"));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
