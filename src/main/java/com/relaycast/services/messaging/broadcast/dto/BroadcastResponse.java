package com.relaycast.services.messaging.broadcast.dto;

import java.time.LocalDateTime;

import com.relaycast.services.messaging.broadcast.model.Broadcast;

public record BroadcastResponse(
        Long id,
        Long orgId,
        String status,
        int recipientCount,
        long messageCount,
        Long parentId,
        boolean scheduled,
        boolean active,
        LocalDateTime createdOn) {

    public static BroadcastResponse from(Broadcast broadcast, long messageCount) {
        return new BroadcastResponse(
                broadcast.getId(),
                broadcast.getOrgId(),
                broadcast.getStatus().getValue(),
                broadcast.getRecipientCount() == null ? 0 : broadcast.getRecipientCount(),
                messageCount,
                broadcast.getParentId(),
                broadcast.isScheduled(),
                broadcast.isActive(),
                broadcast.getCreatedOn());
    }
}
