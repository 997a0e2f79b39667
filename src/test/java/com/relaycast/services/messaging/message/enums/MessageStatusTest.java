package com.relaycast.services.messaging.message.enums;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MessageStatus unit tests")
class MessageStatusTest {

    @Test
    @DisplayName("Normal delivery moves forward")
    void forwardTransitions() {
        assertTrue(MessageStatus.PENDING.canTransitionTo(MessageStatus.QUEUED));
        assertTrue(MessageStatus.QUEUED.canTransitionTo(MessageStatus.WIRED));
        assertTrue(MessageStatus.WIRED.canTransitionTo(MessageStatus.SENT));
        assertTrue(MessageStatus.SENT.canTransitionTo(MessageStatus.DELIVERED));
        assertTrue(MessageStatus.ERRORED.canTransitionTo(MessageStatus.QUEUED));
    }

    @Test
    @DisplayName("Messages never move backwards")
    void backwardTransitions() {
        assertFalse(MessageStatus.SENT.canTransitionTo(MessageStatus.QUEUED));
        assertFalse(MessageStatus.SENT.canTransitionTo(MessageStatus.ERRORED));
        assertFalse(MessageStatus.DELIVERED.canTransitionTo(MessageStatus.SENT));
    }

    @Test
    @DisplayName("Failed and resent only change through a resend")
    void failedAndResentAreFinal() {
        for (MessageStatus next : MessageStatus.values()) {
            assertFalse(MessageStatus.FAILED.canTransitionTo(next));
            assertFalse(MessageStatus.RESENT.canTransitionTo(next));
        }
        assertTrue(MessageStatus.FAILED.isTerminal());
        assertFalse(MessageStatus.ERRORED.isTerminal());
    }

    @Test
    @DisplayName("Codes and API values map back to statuses")
    void lookups() {
        assertEquals(MessageStatus.WIRED, MessageStatus.fromCode('W'));
        assertEquals(MessageStatus.ERRORED, MessageStatus.fromValue("Errored"));
        assertEquals(MessageStatus.PENDING, MessageStatus.fromValue(null));
        assertThrows(IllegalArgumentException.class, () -> MessageStatus.fromValue("bounced"));
        assertThrows(IllegalArgumentException.class, () -> MessageStatus.fromCode('X'));
    }
}
