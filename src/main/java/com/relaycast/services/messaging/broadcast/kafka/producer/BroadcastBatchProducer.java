package com.relaycast.services.messaging.broadcast.kafka.producer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.relaycast.services.messaging.broadcast.event.BroadcastQueuedEvent;
import com.relaycast.services.messaging.broadcast.kafka.event.BroadcastBatchEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastBatchProducer {
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.broadcast-batches.name:broadcast-batches}")
    private String topicName;

    /**
     * Publishes the chunks of a queued broadcast after the transaction that queued it has committed,
     * so consumers always see the broadcast as queued.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBroadcastQueued(BroadcastQueuedEvent event) {
        List<BroadcastBatchEvent> events = new ArrayList<>(event.chunks().size());
        for (int i = 0; i < event.chunks().size(); i++) {
            events.add(BroadcastBatchEvent.createForBatch(
                    event.broadcastId(), event.orgId(), i, event.chunks().size(), event.chunks().get(i), false));
        }
        publishBatch(events);
    }

    /**
     * Publishes a single batch event.
     *
     * @param event The batch to publish
     * @return CompletableFuture with send result
     */
    public CompletableFuture<SendResult<String, Object>> publishMessage(BroadcastBatchEvent event) {
        String partitionKey = event.getBroadcastId() + ":" + event.getBatchIndex();

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(
                topicName,
                partitionKey,
                event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish broadcast batch. broadcastId={} eventId={} batch={}/{}",
                        event.getBroadcastId(), event.getEventId(), event.getBatchIndex() + 1,
                        event.getTotalBatches(), ex);
            } else {
                log.debug("Broadcast batch published. broadcastId={} eventId={} partition={} offset={}",
                        event.getBroadcastId(),
                        event.getEventId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }

    /**
     * Publishes all batches of a broadcast.
     *
     * @return CompletableFuture that completes when all batches are sent
     */
    public CompletableFuture<Void> publishBatch(List<BroadcastBatchEvent> events) {
        long startTime = System.currentTimeMillis();

        log.info("Publishing {} broadcast batches", events.size());

        CompletableFuture<?>[] futures = events.stream()
                .map(this::publishMessage)
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(futures)
                .whenComplete((result, ex) -> {
                    long duration = System.currentTimeMillis() - startTime;
                    if (ex != null) {
                        log.error("Batch publish failed after {}ms. Batches={}", duration, events.size(), ex);
                    } else {
                        log.info("Batches published successfully in {}ms. Batches={}", duration, events.size());
                    }
                });
    }
}
