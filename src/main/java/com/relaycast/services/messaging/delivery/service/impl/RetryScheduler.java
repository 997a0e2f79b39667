package com.relaycast.services.messaging.delivery.service.impl;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-dispatches errored messages once their next attempt is due
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryScheduler {

    private final MsgRepository msgRepository;
    private final DeliveryDispatcher deliveryDispatcher;
    private final MessageProperties messageProperties;

    @Scheduled(fixedDelayString = "${message.retry.interval-ms:60000}")
    public int retryErrored() {
        try {
            List<Long> ids = msgRepository.findRetryableIds(Direction.OUTGOING, MessageStatus.ERRORED,
                    LocalDateTime.now(), PageRequest.of(0, messageProperties.getRetry().getPollSize()));
            if (ids.isEmpty()) {
                return 0;
            }

            List<Msg> msgs = msgRepository.findByIdInOrderByIdAsc(ids);
            int pushed = deliveryDispatcher.sendMessages(msgs);
            log.info("Retried errored messages. due={} pushed={}", ids.size(), pushed);
            return pushed;
        } catch (Exception e) {
            log.error("Retry of errored messages failed", e);
            return 0;
        }
    }
}
