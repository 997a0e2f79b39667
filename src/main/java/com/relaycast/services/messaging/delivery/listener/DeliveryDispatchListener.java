package com.relaycast.services.messaging.delivery.listener;

import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.relaycast.services.messaging.delivery.event.MessagesCreatedEvent;
import com.relaycast.services.messaging.delivery.service.impl.DeliveryDispatcher;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands newly created messages to the dispatcher once the transaction that created them has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryDispatchListener {

    private final MsgRepository msgRepository;
    private final DeliveryDispatcher deliveryDispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMessagesCreated(MessagesCreatedEvent event) {
        if (event.msgIds().isEmpty()) {
            return;
        }
        try {
            List<Msg> msgs = msgRepository.findByIdInOrderByIdAsc(event.msgIds());
            int pushed = deliveryDispatcher.sendMessages(msgs);
            log.info("Messages handed to delivery. broadcastId={} created={} pushed={}",
                    event.broadcastId(), event.msgIds().size(), pushed);
        } catch (Exception e) {
            // messages stay pending and are failed by the stale message sweep if never sent
            log.error("Failed to dispatch created messages. broadcastId={} msgs={}",
                    event.broadcastId(), event.msgIds().size(), e);
        }
    }
}
