package com.relaycast.services.messaging.message.enums;

public enum Visibility {
    VISIBLE,
    ARCHIVED,
    DELETED
}
