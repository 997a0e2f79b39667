package com.relaycast.services.messaging.message.kafka.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery outcome reported by the delivery worker for one message
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageStatusEvent {
    private String eventId;

    private Long msgId;

    private String status; // wired, sent, delivered, errored, failed

    private String externalId;

    private boolean fatal;

    private String errorMessage;

    private Long timestamp;
}
