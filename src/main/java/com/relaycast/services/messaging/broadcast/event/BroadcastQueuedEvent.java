package com.relaycast.services.messaging.broadcast.event;

import java.util.List;

/**
 * A large broadcast has been queued and its chunks can be published once the queueing commits.
 */
public record BroadcastQueuedEvent(Long broadcastId, Long orgId, List<List<Long>> chunks) {
}
