package com.example.chainstream;

import com.example.chainstream.log.DurableLog;
import com.example.chainstream.log.InMemoryDurableLog;
import com.example.chainstream.log.KafkaDurableLog;
import com.example.chainstream.log.RetentionPolicy;
import com.example.chainstream.stream.Subjects;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Durable log wiring. Kafka by default; the {@code inmem} profile keeps everything in process.
 */
@Configuration
public class DurableLogConfiguration {

    @Value("${kafka.bootstrap.servers:localhost:9092}")
    private String kafkaBootstrapServers;

    @Value("${kafka.topic.replicas:1}")
    private int topicReplicas;

    @Value("${chainstream.log.publish-timeout:10s}")
    private Duration publishTimeout;

    @Value("${chainstream.log.retention.max-age:24h}")
    private Duration retentionMaxAge;

    @Value("${chainstream.log.retention.max-messages:10000}")
    private int retentionMaxMessages;

    @Bean
    public RetentionPolicy retentionPolicy() {
        return new RetentionPolicy(retentionMaxAge, retentionMaxMessages);
    }

    @Bean
    @Profile("inmem")
    public DurableLog inMemoryDurableLog(RetentionPolicy retentionPolicy) {
        return new InMemoryDurableLog(retentionPolicy);
    }

    @Bean(destroyMethod = "close")
    @Profile("!inmem")
    public KafkaDurableLog kafkaDurableLog(ConsumerFactory<String, String> consumerFactory) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "5");
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, "16384");
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");
        // bound every stage of a send so a stalled broker cannot wedge a poll job
        long timeoutMs = publishTimeout.toMillis();
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(timeoutMs));
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(timeoutMs / 2));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, String.valueOf(timeoutMs));

        return new KafkaDurableLog(new KafkaProducer<>(props), consumerFactory, publishTimeout, "chainstream-relay-");
    }

    @Bean
    @Profile("!inmem")
    public ConsumerFactory<String, String> consumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    @Profile("!inmem")
    public KafkaAdmin kafkaAdmin() {
        Map<String, Object> props = new HashMap<>();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        KafkaAdmin admin = new KafkaAdmin(props);
        // an unreachable broker at startup is fatal
        admin.setFatalIfBrokerNotAvailable(true);
        return admin;
    }

    /**
     * One single-partition topic per subject, so each subject keeps a total publish order
     */
    @Bean
    @Profile("!inmem")
    public KafkaAdmin.NewTopics subjectTopics(RetentionPolicy retentionPolicy) {
        List<NewTopic> topics = new ArrayList<>();
        for (String subject : Subjects.ALL) {
            topics.add(TopicBuilder.name(subject)
                    .partitions(1)
                    .replicas(topicReplicas)
                    .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retentionPolicy.getMaxAge().toMillis()))
                    .config(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE)
                    .build());
        }
        return new KafkaAdmin.NewTopics(topics.toArray(new NewTopic[0]));
    }
}
