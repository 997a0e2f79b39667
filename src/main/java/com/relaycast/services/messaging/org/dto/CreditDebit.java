package com.relaycast.services.messaging.org.dto;

/**
 * Result of taking credit from an org: which top-up paid and how much.
 */
public record CreditDebit(Long topUpId, int amount) {
}
