package com.example.chainstream.stream;

import com.example.chainstream.log.DeliveredMessage;
import com.example.chainstream.log.LogSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Relays one tailing subscription to one subscriber, acknowledging each message once the transport has
 * taken it. Runs on its own thread until cancelled or until the subscriber goes away, then releases the
 * subscription.
 */
public class SubscriberRelay implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SubscriberRelay.class);

    private final String streamName;
    private final LogSubscription subscription;
    private final SubscriberSink sink;
    private final Duration pollTimeout;
    private final Duration heartbeatInterval;
    private final Consumer<SubscriberRelay> onExit;
    private volatile boolean running = true;

    SubscriberRelay(String streamName, LogSubscription subscription, SubscriberSink sink, Duration pollTimeout,
                    Duration heartbeatInterval, Consumer<SubscriberRelay> onExit) {
        this.streamName = streamName;
        this.subscription = subscription;
        this.sink = sink;
        this.pollTimeout = pollTimeout;
        this.heartbeatInterval = heartbeatInterval;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        long delivered = 0;
        long lastActivity = System.nanoTime();
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                List<DeliveredMessage> batch = subscription.poll(pollTimeout);
                for (DeliveredMessage message : batch) {
                    if (!running) {
                        // left unacknowledged for redelivery
                        break;
                    }
                    sink.send(message.getPayload());
                    message.ack();
                    delivered++;
                }

                long now = System.nanoTime();
                if (!batch.isEmpty()) {
                    lastActivity = now;
                } else if (running && now - lastActivity >= heartbeatInterval.toNanos()) {
                    sink.heartbeat();
                    lastActivity = now;
                }
            }
        } catch (IOException e) {
            log.info("Subscriber on {} disconnected: {}", streamName, e.getMessage());
        } catch (RuntimeException e) {
            if (running) {
                log.error("Relay for {} on {} failed", streamName, subscription.getSubject(), e);
            } else {
                log.debug("Relay for {} stopped: {}", streamName, e.toString());
            }
        } finally {
            running = false;
            subscription.close();
            sink.complete();
            onExit.accept(this);
            log.info("Subscription to {} on {} closed after {} messages", streamName, subscription.getSubject(),
                    delivered);
        }
    }

    /**
     * Stop relaying. Safe to call from any thread, any number of times.
     */
    public void cancel() {
        if (running) {
            running = false;
            subscription.wakeup();
        }
    }

    public String getStreamName() {
        return streamName;
    }

    public String getSubject() {
        return subscription.getSubject();
    }

    public boolean isRunning() {
        return running;
    }
}
