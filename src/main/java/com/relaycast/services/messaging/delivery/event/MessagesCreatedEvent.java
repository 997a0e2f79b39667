package com.relaycast.services.messaging.delivery.event;

import java.util.List;

/**
 * Published when outgoing messages have been inserted and should be handed to delivery once committed.
 */
public record MessagesCreatedEvent(Long broadcastId, List<Long> msgIds) {
}
