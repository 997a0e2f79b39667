package com.relaycast.services.messaging.delivery.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Consecutive messages to one contact, pushed to the delivery worker as a unit
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryBatch {
    private Long orgId;
    private Long contactId;
    private String channelUuid; // null for legacy batches
    private boolean courier;
    private DeliveryPriority priority;
    private List<MsgTaskPayload> msgs;
}
