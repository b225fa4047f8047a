package com.example.chainstream.stream;

import com.example.chainstream.log.DurableLog;
import com.example.chainstream.log.LogSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fans the durable log out to subscribers.
 *
 * Every subscriber gets its own new-only subscription and its own relay thread, so subscribers on the same
 * stream never wait on each other and never hold up the poll jobs.
 */
public class StreamBridge {

    private static final Logger log = LoggerFactory.getLogger(StreamBridge.class);

    private final DurableLog durableLog;
    private final StreamDirectory directory;
    private final Duration pollTimeout;
    private final Duration heartbeatInterval;
    private final Duration shutdownGrace;
    private final ExecutorService executorService;
    private final Set<SubscriberRelay> activeRelays = ConcurrentHashMap.newKeySet();
    private volatile boolean shuttingDown;

    public StreamBridge(DurableLog durableLog, StreamDirectory directory, Duration pollTimeout,
                        Duration heartbeatInterval, Duration shutdownGrace) {
        this.durableLog = durableLog;
        this.directory = directory;
        this.pollTimeout = pollTimeout;
        this.heartbeatInterval = heartbeatInterval;
        this.shutdownGrace = shutdownGrace;
        this.executorService = Executors.newCachedThreadPool(new CustomizableThreadFactory("relay-"));
    }

    /**
     * Subscribe {@code sink} to the logical stream {@code streamName}. The subscription is positioned
     * before this method returns: everything published afterwards is relayed, nothing published before.
     *
     * @return the running relay, to be cancelled when the connection closes
     * @throws UnknownStreamException     if the name is unknown and the directory rejects unknown names
     * @throws StreamUnavailableException if the log cannot open a subscription or the bridge is stopping
     */
    public SubscriberRelay open(String streamName, SubscriberSink sink) {
        if (shuttingDown) {
            throw new StreamUnavailableException("Server is shutting down");
        }
        String subject = directory.resolve(streamName);

        LogSubscription subscription;
        try {
            subscription = durableLog.subscribeNew(subject);
        } catch (RuntimeException e) {
            log.error("Could not subscribe to {}: {}", subject, e.getMessage());
            throw new StreamUnavailableException("Could not subscribe to " + subject, e);
        }

        SubscriberRelay relay = new SubscriberRelay(streamName, subscription, sink, pollTimeout, heartbeatInterval,
                activeRelays::remove);
        activeRelays.add(relay);
        try {
            executorService.execute(relay);
        } catch (RejectedExecutionException e) {
            activeRelays.remove(relay);
            subscription.close();
            throw new StreamUnavailableException("Server is shutting down", e);
        }
        log.info("Subscriber connected to {} ({}), {} active", streamName, subject, activeRelays.size());
        return relay;
    }

    public int activeSubscriptions() {
        return activeRelays.size();
    }

    /**
     * Cancel every relay and wait up to the grace period for them to release their subscriptions.
     */
    public void shutdown() {
        shuttingDown = true;
        log.info("Closing {} subscriber relays", activeRelays.size());
        for (SubscriberRelay relay : activeRelays) {
            relay.cancel();
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Relays still running after {}, interrupting", shutdownGrace);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
