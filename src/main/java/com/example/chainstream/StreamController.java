package com.example.chainstream;

import com.example.chainstream.stream.StreamBridge;
import com.example.chainstream.stream.StreamDirectory;
import com.example.chainstream.stream.StreamUnavailableException;
import com.example.chainstream.stream.SubscriberRelay;
import com.example.chainstream.stream.UnknownStreamException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StreamController {

    private final StreamBridge streamBridge;
    private final StreamDirectory streamDirectory;
    private final Duration sseTimeout;

    public StreamController(StreamBridge streamBridge, StreamDirectory streamDirectory,
                            @Value("${chainstream.sse.timeout:0}") Duration sseTimeout) {
        this.streamBridge = streamBridge;
        this.streamDirectory = streamDirectory;
        this.sseTimeout = sseTimeout;
    }

    /** Live tail of one logical stream, e.g. /sse/pending */
    @GetMapping(path = "/sse/{stream}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("stream") String stream) {
        return subscribe(stream);
    }

    /** Live tail of the default stream */
    @GetMapping(path = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamDefault() {
        return subscribe(StreamDirectory.DEFAULT_STREAM);
    }

    @GetMapping("/streams")
    public ResponseEntity<Map<String, Object>> listStreams() {
        Map<String, String> usage = new LinkedHashMap<>();
        usage.put("sse", "/sse/{stream} (e.g., /sse/pending)");
        usage.put("all_sse", "/sse (subscribes to " + StreamDirectory.DEFAULT_SUBJECT + ")");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("streams", streamDirectory.describe());
        body.put("usage", usage);
        body.put("log", "All streams are retained in the durable log for replay");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @ExceptionHandler(UnknownStreamException.class)
    public ResponseEntity<String> unknownStream(UnknownStreamException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler(StreamUnavailableException.class)
    public ResponseEntity<String> streamUnavailable(StreamUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
    }

    private SseEmitter subscribe(String stream) {
        SseEmitter emitter = new SseEmitter(sseTimeout.toMillis());
        SubscriberRelay relay = streamBridge.open(stream, new SseEmitterSink(emitter));
        emitter.onCompletion(relay::cancel);
        emitter.onTimeout(relay::cancel);
        emitter.onError(error -> relay.cancel());
        return emitter;
    }
}
