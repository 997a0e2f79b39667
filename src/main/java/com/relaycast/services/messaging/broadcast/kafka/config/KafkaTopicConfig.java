package com.relaycast.services.messaging.broadcast.kafka.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaTopicConfig {

    @Value("${kafka.topics.broadcast-batches.name:broadcast-batches}")
    private String broadcastBatchesTopicName;

    @Value("${kafka.topics.broadcast-batches.partitions:12}")
    private int broadcastBatchesPartitions;

    @Value("${kafka.topics.courier-msgs.name:courier-msgs}")
    private String courierTopicName;

    @Value("${kafka.topics.courier-msgs.partitions:24}")
    private int courierPartitions;

    @Value("${kafka.topics.legacy-msgs.name:legacy-msgs}")
    private String legacyTopicName;

    @Value("${kafka.topics.legacy-msgs.partitions:6}")
    private int legacyPartitions;

    @Value("${kafka.topics.msg-status.name:msg-status}")
    private String statusTopicName;

    @Value("${kafka.topics.msg-status.partitions:12}")
    private int statusPartitions;

    @Value("${kafka.topics.replicas:1}")
    private int replicas;

    /**
     * Recipient chunks of large broadcasts, keyed by broadcast id
     */
    @Bean
    public NewTopic broadcastBatchesTopic() {
        return topic(broadcastBatchesTopicName, broadcastBatchesPartitions, "86400000"); // 1 day
    }

    /**
     * Messages for push-style channels, keyed by channel uuid so a channel's messages stay in order
     */
    @Bean
    public NewTopic courierMsgsTopic() {
        return topic(courierTopicName, courierPartitions, "86400000");
    }

    /**
     * Messages for polling channels, keyed by org
     */
    @Bean
    public NewTopic legacyMsgsTopic() {
        return topic(legacyTopicName, legacyPartitions, "86400000");
    }

    /**
     * Status reports written by the delivery worker
     */
    @Bean
    public NewTopic msgStatusTopic() {
        return topic(statusTopicName, statusPartitions, "604800000"); // 7 days
    }

    private NewTopic topic(String name, int partitions, String retentionMs) {
        NewTopic topic = TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(replicas)
                .config("retention.ms", retentionMs)
                .config("compression.type", "snappy")
                .config("max.message.bytes", "2097152") // 2MB
                .build();

        log.info("Topic configured. name={} partitions={} replicas={} retentionMs={}",
                name, partitions, replicas, retentionMs);

        return topic;
    }
}
