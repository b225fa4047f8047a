package com.example.chainstream.log;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link DurableLog}. Retains messages per subject within the retention bounds and feeds
 * each subscription from its own unbounded queue, so a slow reader never holds up a publisher.
 */
public final class InMemoryDurableLog implements DurableLog {

    private static final Object WAKEUP = new Object();

    private final Map<String, Deque<Retained>> retained = new HashMap<>();
    private final Map<String, Set<Subscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong acknowledged = new AtomicLong();
    private final RetentionPolicy retention;
    private final Clock clock;

    public InMemoryDurableLog(RetentionPolicy retention) {
        this(retention, Clock.systemUTC());
    }

    public InMemoryDurableLog(RetentionPolicy retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public synchronized void publish(String subject, String key, String payload) {
        Instant now = clock.instant();
        Deque<Retained> messages = retained.computeIfAbsent(subject, k -> new ArrayDeque<>());
        messages.addLast(new Retained(payload, now));
        evict(messages, now);

        for (Subscription subscription : subscriptions.getOrDefault(subject, Collections.emptySet())) {
            subscription.queue.offer(payload);
        }
    }

    @Override
    public synchronized LogSubscription subscribeNew(String subject) {
        Subscription subscription = new Subscription(subject);
        subscriptions.computeIfAbsent(subject, k -> ConcurrentHashMap.newKeySet()).add(subscription);
        return subscription;
    }

    /**
     * Payloads currently retained for {@code subject}, oldest first
     */
    public synchronized List<String> retained(String subject) {
        Deque<Retained> messages = retained.getOrDefault(subject, new ArrayDeque<>());
        evict(messages, clock.instant());
        List<String> payloads = new ArrayList<>(messages.size());
        for (Retained message : messages) {
            payloads.add(message.payload);
        }
        return payloads;
    }

    public int subscriberCount(String subject) {
        return subscriptions.getOrDefault(subject, Collections.emptySet()).size();
    }

    public long acknowledgedCount() {
        return acknowledged.get();
    }

    private void evict(Deque<Retained> messages, Instant now) {
        Instant cutoff = now.minus(retention.getMaxAge());
        while (!messages.isEmpty()
                && (messages.size() > retention.getMaxMessages() || messages.peekFirst().publishedAt.isBefore(cutoff))) {
            messages.removeFirst();
        }
    }

    private static final class Retained {
        private final String payload;
        private final Instant publishedAt;

        private Retained(String payload, Instant publishedAt) {
            this.payload = payload;
            this.publishedAt = publishedAt;
        }
    }

    private final class Subscription implements LogSubscription {
        private final String subject;
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        private Subscription(String subject) {
            this.subject = subject;
        }

        @Override
        public String getSubject() {
            return subject;
        }

        @Override
        public List<DeliveredMessage> poll(Duration timeout) {
            List<DeliveredMessage> batch = new ArrayList<>();
            if (closed) {
                return batch;
            }
            Object first;
            try {
                first = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return batch;
            }
            if (first == null || first == WAKEUP) {
                return batch;
            }
            List<Object> drained = new ArrayList<>();
            drained.add(first);
            queue.drainTo(drained);
            for (Object item : drained) {
                if (item != WAKEUP) {
                    batch.add(new Delivered(subject, (String) item));
                }
            }
            return batch;
        }

        @Override
        public void wakeup() {
            queue.offer(WAKEUP);
        }

        @Override
        public void close() {
            closed = true;
            Set<Subscription> subscribers = subscriptions.get(subject);
            if (subscribers != null) {
                subscribers.remove(this);
            }
            queue.clear();
        }
    }

    private final class Delivered implements DeliveredMessage {
        private final String subject;
        private final String payload;

        private Delivered(String subject, String payload) {
            this.subject = subject;
            this.payload = payload;
        }

        @Override
        public String getSubject() {
            return subject;
        }

        @Override
        public String getPayload() {
            return payload;
        }

        @Override
        public void ack() {
            acknowledged.incrementAndGet();
        }
    }
}
