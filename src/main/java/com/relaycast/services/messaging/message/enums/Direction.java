package com.relaycast.services.messaging.message.enums;

public enum Direction {
    INCOMING,
    OUTGOING
}
