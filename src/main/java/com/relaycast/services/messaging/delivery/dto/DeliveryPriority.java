package com.relaycast.services.messaging.delivery.dto;

/**
 * Queue priority of a delivery batch. Lower scores are delivered first.
 */
public enum DeliveryPriority {
    LOW(10_000_000),
    DEFAULT(0),
    HIGH(-10_000_000);

    private final int score;

    DeliveryPriority(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }
}
