package com.example.chainstream.log;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KafkaDurableLogTest {

    private static final String SUBJECT = "eth.gasPrice";
    private static final TopicPartition PARTITION = new TopicPartition(SUBJECT, 0);

    private MockConsumer<String, String> consumer;
    private ConsumerFactory<String, String> consumerFactory;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.LATEST);
        consumer.updatePartitions(SUBJECT, List.of(new PartitionInfo(SUBJECT, 0, null, null, null)));
        consumerFactory = mock(ConsumerFactory.class);
        when(consumerFactory.createConsumer(anyString(), any())).thenReturn(consumer);
    }

    @Test
    void publish_sendsRecordKeyedByKind() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDurableLog log = new KafkaDurableLog(producer, consumerFactory, Duration.ofSeconds(1), "test-");

        log.publish(SUBJECT, "GAS_PRICE", "{\"gwei\":20.0}");

        assertThat(producer.history()).hasSize(1);
        ProducerRecord<String, String> record = producer.history().get(0);
        assertThat(record.topic()).isEqualTo(SUBJECT);
        assertThat(record.key()).isEqualTo("GAS_PRICE");
        assertThat(record.value()).isEqualTo("{\"gwei\":20.0}");
    }

    @Test
    void publish_withoutAckInTime_throwsPublishException() {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaDurableLog log = new KafkaDurableLog(producer, consumerFactory, Duration.ofMillis(50), "test-");

        assertThatThrownBy(() -> log.publish(SUBJECT, "GAS_PRICE", "{}"))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining(SUBJECT);
    }

    @Test
    void publish_brokerError_throwsPublishException() {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaDurableLog log = new KafkaDurableLog(producer, consumerFactory, Duration.ofSeconds(5), "test-");
        Thread failer = new Thread(() -> {
            while (producer.history().isEmpty()) {
                Thread.onSpinWait();
            }
            producer.errorNext(new RuntimeException("not leader"));
        });
        failer.start();

        assertThatThrownBy(() -> log.publish(SUBJECT, "GAS_PRICE", "{}"))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("not leader");
    }

    @Test
    void subscribeNew_startsAtEndOffset() {
        consumer.updateEndOffsets(Map.of(PARTITION, 5L));
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1), "test-");

        LogSubscription subscription = log.subscribeNew(SUBJECT);

        assertThat(consumer.assignment()).containsExactly(PARTITION);
        assertThat(consumer.position(PARTITION)).isEqualTo(5L);

        consumer.addRecord(new ConsumerRecord<>(SUBJECT, 0, 5L, "GAS_PRICE", "g6"));
        List<DeliveredMessage> batch = subscription.poll(Duration.ofMillis(10));

        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).getPayload()).isEqualTo("g6");
        assertThat(batch.get(0).getSubject()).isEqualTo(SUBJECT);
    }

    @Test
    void subscribeNew_usesOneDistinctPrefixedGroupPerSubscription() {
        MockConsumer<String, String> second = new MockConsumer<>(OffsetResetStrategy.LATEST);
        second.updatePartitions(SUBJECT, List.of(new PartitionInfo(SUBJECT, 0, null, null, null)));
        second.updateEndOffsets(Map.of(PARTITION, 0L));
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        when(consumerFactory.createConsumer(anyString(), any())).thenReturn(consumer, second);
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1),
                "chainstream-relay-");

        log.subscribeNew(SUBJECT).close();
        log.subscribeNew(SUBJECT).close();

        ArgumentCaptor<String> groupIds = ArgumentCaptor.forClass(String.class);
        verify(consumerFactory, times(2)).createConsumer(groupIds.capture(), any());
        assertThat(groupIds.getAllValues()).allMatch(groupId -> groupId.startsWith("chainstream-relay-"));
        assertThat(groupIds.getAllValues().get(0)).isNotEqualTo(groupIds.getAllValues().get(1));
        assertThat(consumer.closed()).isTrue();
        assertThat(second.closed()).isTrue();
    }

    @Test
    void ack_commitsNextOffset() {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1), "test-");
        LogSubscription subscription = log.subscribeNew(SUBJECT);
        consumer.addRecord(new ConsumerRecord<>(SUBJECT, 0, 0L, "GAS_PRICE", "g1"));

        subscription.poll(Duration.ofMillis(10)).get(0).ack();

        assertThat(consumer.committed(Set.of(PARTITION)).get(PARTITION).offset()).isEqualTo(1L);
    }

    @Test
    void wakeup_makesPollReturnEmpty() {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1), "test-");
        LogSubscription subscription = log.subscribeNew(SUBJECT);

        subscription.wakeup();

        assertThat(subscription.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void subscribeNew_unknownTopic_closesConsumer() {
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1), "test-");

        assertThatThrownBy(() -> log.subscribeNew("eth.missing")).isInstanceOf(RuntimeException.class);
        assertThat(consumer.closed()).isTrue();
    }

    @Test
    void close_releasesConsumer() {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        KafkaDurableLog log = new KafkaDurableLog(mock(MockProducer.class), consumerFactory, Duration.ofSeconds(1), "test-");
        LogSubscription subscription = log.subscribeNew(SUBJECT);

        subscription.close();

        assertThat(consumer.closed()).isTrue();
    }
}
