package com.relaycast.services.messaging.message.handler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageHandlerChain unit tests")
class MessageHandlerChainTest {

    @Mock private MessageHandler flowHandler;
    @Mock private MsgRepository msgRepository;
    @Mock private SystemLabelCounter systemLabelCounter;

    private MessageHandlerChain chain;
    private Msg msg;

    @BeforeEach
    void setUp() {
        chain = new MessageHandlerChain(List.of(flowHandler, new InboxMessageHandler()), msgRepository,
                systemLabelCounter);
        msg = Msg.builder()
                .id(100L)
                .orgId(1L)
                .contactId(3L)
                .text("Join")
                .direction(Direction.INCOMING)
                .status(MessageStatus.PENDING)
                .msgType(null)
                .build();
    }

    @Test
    @DisplayName("Unclaimed messages land in the inbox")
    void process_fallsThroughToInbox() {
        Contact contact = Contact.builder().id(3L).build();
        when(flowHandler.handle(msg, contact)).thenReturn(false);

        chain.process(msg, contact);

        assertEquals(MessageStatus.HANDLED, msg.getStatus());
        assertEquals(MsgType.INBOX, msg.getMsgType());
        assertEquals(Visibility.VISIBLE, msg.getVisibility());
        verify(systemLabelCounter).recordChange(
                argThat(before -> before.getStatus() == MessageStatus.PENDING && before.getMsgType() == null),
                same(msg));
        verify(msgRepository).save(msg);
    }

    @Test
    @DisplayName("A claiming handler stops the chain")
    void process_claimedByFlow() {
        Contact contact = Contact.builder().id(3L).build();
        when(flowHandler.handle(msg, contact)).thenAnswer(inv -> {
            msg.setMsgType(MsgType.FLOW);
            return true;
        });

        chain.process(msg, contact);

        assertEquals(MsgType.FLOW, msg.getMsgType());
        assertEquals(MessageStatus.HANDLED, msg.getStatus());
    }

    @Test
    @DisplayName("A failing handler doesn't stop the message from being handled")
    void process_handlerFails() {
        Contact contact = Contact.builder().id(3L).build();
        when(flowHandler.handle(msg, contact)).thenThrow(new IllegalStateException("flow engine down"));

        chain.process(msg, contact);

        assertEquals(MsgType.INBOX, msg.getMsgType());
        assertEquals(MessageStatus.HANDLED, msg.getStatus());
        verify(msgRepository).save(msg);
    }

    @Test
    @DisplayName("Messages from blocked contacts are archived unhandled")
    void process_blockedContact() {
        Contact contact = Contact.builder().id(3L).blocked(true).build();

        chain.process(msg, contact);

        assertEquals(Visibility.ARCHIVED, msg.getVisibility());
        assertEquals(MessageStatus.HANDLED, msg.getStatus());
        verifyNoInteractions(flowHandler);
        verify(systemLabelCounter).recordChange(any(Msg.class), same(msg));
    }
}
