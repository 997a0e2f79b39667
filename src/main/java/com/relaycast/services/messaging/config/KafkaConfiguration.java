package com.relaycast.services.messaging.config;

import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import com.relaycast.services.messaging.broadcast.kafka.event.BroadcastBatchEvent;
import com.relaycast.services.messaging.message.kafka.event.MessageStatusEvent;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaConfiguration {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;

    @Value("${kafka.consumers.broadcast-batches.concurrency:4}")
    private int batchConsumerConcurrency;

    @Value("${kafka.consumers.msg-status.concurrency:8}")
    private int statusConsumerConcurrency;

    // ==================== PRODUCER CONFIGURATION ====================

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        config.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");
        config.put(ProducerConfig.LINGER_MS_CONFIG, "20");
        config.put(ProducerConfig.BATCH_SIZE_CONFIG, "65536");
        config.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, "2097152");

        // a batch event that is published twice would create its messages twice
        config.put(ProducerConfig.ACKS_CONFIG, "all");
        config.put(ProducerConfig.RETRIES_CONFIG, "3");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        config.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");

        log.info("Kafka producer factory initialized. bootstrapServers={}", bootstrapServers);

        return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate() {
        return new KafkaTemplate<>(producerFactory());
    }

    // ==================== BROADCAST BATCH CONSUMER ====================

    @Bean
    public ConsumerFactory<String, BroadcastBatchEvent> broadcastBatchConsumerFactory() {
        // one batch is up to 500 recipients of work, so poll few at a time
        Map<String, Object> config = consumerConfig(BroadcastBatchEvent.class, 5);
        return new DefaultKafkaConsumerFactory<>(
                config,
                new StringDeserializer(),
                new JsonDeserializer<>(BroadcastBatchEvent.class, false));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, BroadcastBatchEvent> broadcastBatchListenerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, BroadcastBatchEvent> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(broadcastBatchConsumerFactory());
        factory.setConcurrency(batchConsumerConcurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);

        log.info("Broadcast batch listener factory initialized. concurrency={} ackMode=MANUAL",
                batchConsumerConcurrency);

        return factory;
    }

    // ==================== MESSAGE STATUS CONSUMER ====================

    @Bean
    public ConsumerFactory<String, MessageStatusEvent> messageStatusConsumerFactory() {
        Map<String, Object> config = consumerConfig(MessageStatusEvent.class, 200);
        return new DefaultKafkaConsumerFactory<>(
                config,
                new StringDeserializer(),
                new JsonDeserializer<>(MessageStatusEvent.class, false));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, MessageStatusEvent> messageStatusListenerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, MessageStatusEvent> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(messageStatusConsumerFactory());
        factory.setConcurrency(statusConsumerConcurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);

        log.info("Message status listener factory initialized. concurrency={} ackMode=MANUAL",
                statusConsumerConcurrency);

        return factory;
    }

    private Map<String, Object> consumerConfig(Class<?> valueType, int maxPollRecords) {
        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);

        config.put(JsonDeserializer.TRUSTED_PACKAGES, "com.relaycast.services.messaging.*");
        config.put(JsonDeserializer.VALUE_DEFAULT_TYPE, valueType.getName());

        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(maxPollRecords));
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return config;
    }
}
