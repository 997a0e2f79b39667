package com.relaycast.services.messaging.delivery.queue;

import com.relaycast.services.messaging.delivery.dto.DeliveryBatch;

/**
 * Where queued messages are handed to the delivery worker
 */
public interface DeliveryQueue {

    void push(DeliveryBatch batch);
}
