package com.relaycast.services.messaging.message.kafka.consumer;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.message.kafka.event.MessageStatusEvent;
import com.relaycast.services.messaging.message.service.impl.MessageStatusService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Consumes delivery outcomes written by the delivery worker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageStatusConsumer {

    private final MessageStatusService messageStatusService;

    @KafkaListener(
        topics = "${kafka.topics.msg-status.name:msg-status}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "messageStatusListenerFactory"
    )
    public void consumeStatus(
            @Payload MessageStatusEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Received status: msgId={} status={} partition={} offset={}",
            event.getMsgId(), event.getStatus(), partition, offset);

        try {
            messageStatusService.apply(event);
        } catch (Exception e) {
            log.error("Failed to apply status. msgId={} status={} partition={} offset={}",
                event.getMsgId(), event.getStatus(), partition, offset, e);
        } finally {
            // acknowledge either way so a bad report can't block the partition
            acknowledgment.acknowledge();
        }
    }
}
