package com.relaycast.services.messaging.counts.enums;

import java.util.Optional;

import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.enums.Visibility;

/**
 * Folders every org has. A message belongs to at most one of them.
 */
public enum SystemLabelType {
    INBOX('I'),
    FLOWS('W'),
    ARCHIVED('A'),
    OUTBOX('O'),
    SENT('S'),
    FAILED('X'),
    SCHEDULED('E');

    private final char code;

    SystemLabelType(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public static SystemLabelType fromCode(char code) {
        for (SystemLabelType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown SystemLabelType code: " + code);
    }

    public static Optional<SystemLabelType> classify(Direction direction, Visibility visibility, MsgType msgType,
            MessageStatus status) {
        if (direction == Direction.INCOMING) {
            if (visibility == Visibility.ARCHIVED) {
                return Optional.of(ARCHIVED);
            }
            if (visibility == Visibility.VISIBLE) {
                if (msgType == MsgType.INBOX) {
                    return Optional.of(INBOX);
                }
                if (msgType == MsgType.FLOW) {
                    return Optional.of(FLOWS);
                }
            }
            return Optional.empty();
        }

        if (visibility != Visibility.VISIBLE) {
            return Optional.empty();
        }
        switch (status) {
            case PENDING:
            case QUEUED:
                return Optional.of(OUTBOX);
            case WIRED:
            case SENT:
            case DELIVERED:
                return Optional.of(SENT);
            case FAILED:
                return Optional.of(FAILED);
            default:
                return Optional.empty();
        }
    }
}
