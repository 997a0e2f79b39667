package com.relaycast.services.messaging.exception;

import lombok.Getter;

/**
 * Thrown when the same text was already sent to a large group within the guard window.
 */
@Getter
public class DuplicateBroadcastException extends RuntimeException {

    private final Long broadcastId;
    private final Long groupId;

    public DuplicateBroadcastException(Long broadcastId, Long groupId) {
        super("Broadcast " + broadcastId + " repeats a recent send to group " + groupId);
        this.broadcastId = broadcastId;
        this.groupId = groupId;
    }
}
