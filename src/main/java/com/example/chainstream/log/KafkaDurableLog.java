package com.example.chainstream.log;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link DurableLog} on Kafka: one single-partition topic per subject.
 *
 * Every subscription gets its own consumer in its own group, assigned to the topic's partitions and
 * positioned at their end offsets before {@link #subscribeNew} returns. Offsets are committed when a
 * message is acknowledged. Group ids are the configured prefix plus a random UUID; a group is left empty
 * when its subscriber disconnects and the broker drops it after {@code offsets.retention.minutes}.
 */
public class KafkaDurableLog implements DurableLog {

    private static final Logger log = LoggerFactory.getLogger(KafkaDurableLog.class);

    private final Producer<String, String> producer;
    private final ConsumerFactory<String, String> consumerFactory;
    private final Duration publishTimeout;
    private final String groupPrefix;

    public KafkaDurableLog(Producer<String, String> producer, ConsumerFactory<String, String> consumerFactory,
                           Duration publishTimeout, String groupPrefix) {
        this.producer = producer;
        this.consumerFactory = consumerFactory;
        this.publishTimeout = publishTimeout;
        this.groupPrefix = groupPrefix;
    }

    @Override
    public void publish(String subject, String key, String payload) throws PublishException {
        ProducerRecord<String, String> record = new ProducerRecord<>(subject, key, payload);
        try {
            producer.send(record).get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new PublishException(subject, e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new PublishException(subject, "no acknowledgement within " + publishTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(subject, "interrupted", e);
        } catch (KafkaException e) {
            throw new PublishException(subject, e.getMessage(), e);
        }
    }

    @Override
    public LogSubscription subscribeNew(String subject) {
        Consumer<String, String> consumer = consumerFactory.createConsumer(groupPrefix + UUID.randomUUID(), null);
        try {
            List<PartitionInfo> infos = consumer.partitionsFor(subject, publishTimeout);
            if (infos == null || infos.isEmpty()) {
                throw new IllegalStateException("Topic " + subject + " has no partitions");
            }
            List<TopicPartition> partitions = new ArrayList<>();
            for (PartitionInfo info : infos) {
                partitions.add(new TopicPartition(info.topic(), info.partition()));
            }
            consumer.assign(partitions);
            consumer.seekToEnd(partitions);
            // seekToEnd is lazy; resolve the positions now so later publishes are not skipped
            for (TopicPartition partition : partitions) {
                consumer.position(partition, publishTimeout);
            }
        } catch (RuntimeException e) {
            consumer.close(Duration.ZERO);
            throw e;
        }
        return new KafkaSubscription(subject, consumer);
    }

    /**
     * Close the shared producer, waiting for in-flight sends.
     */
    public void close() {
        producer.close(publishTimeout);
    }

    private static final class KafkaSubscription implements LogSubscription {
        private final String subject;
        private final Consumer<String, String> consumer;

        private KafkaSubscription(String subject, Consumer<String, String> consumer) {
            this.subject = subject;
            this.consumer = consumer;
        }

        @Override
        public String getSubject() {
            return subject;
        }

        @Override
        public List<DeliveredMessage> poll(Duration timeout) {
            List<DeliveredMessage> batch = new ArrayList<>();
            ConsumerRecords<String, String> records;
            try {
                records = consumer.poll(timeout);
            } catch (WakeupException e) {
                return batch;
            }
            for (ConsumerRecord<String, String> record : records) {
                batch.add(new KafkaDelivered(consumer, record));
            }
            return batch;
        }

        @Override
        public void wakeup() {
            consumer.wakeup();
        }

        @Override
        public void close() {
            try {
                consumer.close(Duration.ofSeconds(1));
            } catch (KafkaException e) {
                log.warn("Error closing consumer for {}: {}", subject, e.getMessage());
            }
        }
    }

    private static final class KafkaDelivered implements DeliveredMessage {
        private final Consumer<String, String> consumer;
        private final ConsumerRecord<String, String> record;

        private KafkaDelivered(Consumer<String, String> consumer, ConsumerRecord<String, String> record) {
            this.consumer = consumer;
            this.record = record;
        }

        @Override
        public String getSubject() {
            return record.topic();
        }

        @Override
        public String getPayload() {
            return record.value();
        }

        @Override
        public void ack() {
            TopicPartition partition = new TopicPartition(record.topic(), record.partition());
            consumer.commitAsync(Collections.singletonMap(partition, new OffsetAndMetadata(record.offset() + 1)),
                    (offsets, exception) -> {
                        if (exception != null) {
                            log.warn("Error committing offset {} on {}: {}", record.offset(), partition,
                                    exception.getMessage());
                        }
                    });
        }
    }
}
