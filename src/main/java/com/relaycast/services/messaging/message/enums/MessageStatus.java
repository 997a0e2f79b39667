package com.relaycast.services.messaging.message.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status codes shared by messages and broadcasts.
 * Stored as a single character, exposed to the API by name.
 *
 * Outgoing messages normally move INITIALIZING > PENDING > QUEUED > WIRED > SENT > DELIVERED.
 * Delivery problems put them into ERRORED, from where they are retried until they are FAILED.
 */
public enum MessageStatus {
    INITIALIZING('I', "initializing"),
    PENDING('P', "pending"),
    QUEUED('Q', "queued"),
    WIRED('W', "wired"),
    SENT('S', "sent"),
    DELIVERED('D', "delivered"),
    HANDLED('H', "handled"),
    ERRORED('E', "errored"),
    FAILED('F', "failed"),
    RESENT('R', "resent");

    private final char code;
    private final String value;

    MessageStatus(char code, String value) {
        this.code = code;
        this.value = value;
    }

    public char getCode() {
        return code;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether an outgoing message in this status may move to the given status.
     * FAILED and RESENT only change through an explicit resend, which clones the message.
     */
    public boolean canTransitionTo(MessageStatus next) {
        return allowedNext().contains(next);
    }

    private Set<MessageStatus> allowedNext() {
        switch (this) {
            case INITIALIZING:
                return EnumSet.of(PENDING, QUEUED, FAILED);
            case PENDING:
                return EnumSet.of(QUEUED, WIRED, SENT, DELIVERED, ERRORED, FAILED);
            case QUEUED:
                return EnumSet.of(WIRED, SENT, DELIVERED, ERRORED, FAILED);
            case WIRED:
                return EnumSet.of(SENT, DELIVERED, ERRORED, FAILED);
            case SENT:
                return EnumSet.of(DELIVERED);
            case ERRORED:
                return EnumSet.of(QUEUED, WIRED, SENT, DELIVERED, ERRORED, FAILED);
            default:
                return EnumSet.noneOf(MessageStatus.class);
        }
    }

    public boolean isTerminal() {
        return this == FAILED || this == RESENT || this == DELIVERED || this == HANDLED;
    }

    public static MessageStatus fromCode(char code) {
        for (MessageStatus s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown MessageStatus code: " + code);
    }

    /**
     * Convert API value to enum, case-insensitive.
     */
    public static MessageStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }

        String lowerValue = value.toLowerCase();

        for (MessageStatus status : MessageStatus.values()) {
            if (status.value.equals(lowerValue)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown MessageStatus: " + value);
    }
}
