package com.relaycast.services.messaging.broadcast.kafka.consumer;

import java.util.List;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.broadcast.kafka.event.BroadcastBatchEvent;
import com.relaycast.services.messaging.message.dto.BatchSendRequest;
import com.relaycast.services.messaging.message.service.impl.MessageMaterializer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Materializes one chunk of a large broadcast per event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastBatchConsumer {

    private final MessageMaterializer messageMaterializer;

    @KafkaListener(
        topics = "${kafka.topics.broadcast-batches.name:broadcast-batches}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "broadcastBatchListenerFactory"
    )
    public void consumeBatch(
            @Payload BroadcastBatchEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Received batch: broadcastId={} batch={}/{} urns={} partition={} offset={}",
            event.getBroadcastId(), event.getBatchIndex() + 1, event.getTotalBatches(),
            event.getUrnIds().size(), partition, offset);

        try {
            List<Long> msgIds = messageMaterializer.sendBatch(BatchSendRequest.builder()
                    .broadcastId(event.getBroadcastId())
                    .urnIds(event.getUrnIds())
                    .triggerSend(true)
                    .highPriority(Boolean.TRUE.equals(event.getHighPriority()))
                    .build());

            log.info("Batch materialized. broadcastId={} batch={}/{} created={}",
                event.getBroadcastId(), event.getBatchIndex() + 1, event.getTotalBatches(), msgIds.size());

        } catch (Exception e) {
            log.error("Failed to materialize batch. broadcastId={} batch={}/{} partition={} offset={}",
                event.getBroadcastId(), event.getBatchIndex() + 1, event.getTotalBatches(), partition, offset, e);
        } finally {
            // Acknowledge to prevent infinite retry
            acknowledgment.acknowledge();
        }
    }
}
