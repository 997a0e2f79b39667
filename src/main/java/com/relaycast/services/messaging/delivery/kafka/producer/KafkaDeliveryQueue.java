package com.relaycast.services.messaging.delivery.kafka.producer;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.delivery.dto.DeliveryBatch;
import com.relaycast.services.messaging.delivery.queue.DeliveryQueue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes delivery batches to Kafka. Courier batches are keyed by channel so one channel's
 * messages stay in order on one partition, legacy batches are keyed by org.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaDeliveryQueue implements DeliveryQueue {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.courier-msgs.name:courier-msgs}")
    private String courierTopic;

    @Value("${kafka.topics.legacy-msgs.name:legacy-msgs}")
    private String legacyTopic;

    @Override
    public void push(DeliveryBatch batch) {
        publish(batch);
    }

    CompletableFuture<SendResult<String, Object>> publish(DeliveryBatch batch) {
        String topic = batch.isCourier() ? courierTopic : legacyTopic;
        String partitionKey = batch.isCourier() ? batch.getChannelUuid() : String.valueOf(batch.getOrgId());

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, partitionKey, batch);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to push delivery batch. topic={} orgId={} contactId={} msgs={}",
                        topic, batch.getOrgId(), batch.getContactId(), batch.getMsgs().size(), ex);
            } else {
                log.debug("Delivery batch pushed. topic={} contactId={} msgs={} priority={} partition={} offset={}",
                        topic,
                        batch.getContactId(),
                        batch.getMsgs().size(),
                        batch.getPriority(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
