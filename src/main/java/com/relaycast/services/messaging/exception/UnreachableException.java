package com.relaycast.services.messaging.exception;

/**
 * Thrown when a message is being sent to a contact that we don't have a sendable URN or channel for.
 * Scoped to one recipient, callers skip that recipient and carry on.
 */
public class UnreachableException extends RuntimeException {

    public UnreachableException(String message) {
        super(message);
    }
}
