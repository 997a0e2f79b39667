package com.relaycast.services.messaging.exception;

/**
 * Thrown when a broadcast or batch is requested with no recipients or with contradictory arguments.
 * Raised before any message is created.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
