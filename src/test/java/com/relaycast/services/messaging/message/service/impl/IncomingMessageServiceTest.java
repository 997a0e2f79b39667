package com.relaycast.services.messaging.message.service.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.contact.service.impl.ContactService;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.handler.MessageHandlerChain;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.org.dto.CreditDebit;
import com.relaycast.services.messaging.org.service.impl.CreditService;

@ExtendWith(MockitoExtension.class)
@DisplayName("IncomingMessageService unit tests")
class IncomingMessageServiceTest {

    private static final Long ORG_ID = 1L;
    private static final Long CHANNEL_ID = 8L;

    @Mock private ContactService contactService;
    @Mock private ContactRepository contactRepository;
    @Mock private ContactUrnRepository contactUrnRepository;
    @Mock private MsgRepository msgRepository;
    @Mock private CreditService creditService;
    @Mock private SystemLabelCounter systemLabelCounter;
    @Mock private MessageHandlerChain messageHandlerChain;

    @Spy
    private MessageProperties messageProperties = new MessageProperties();

    @InjectMocks
    private IncomingMessageService incomingMessageService;

    private final Channel channel = Channel.builder().id(CHANNEL_ID).uuid("ch-8").orgId(ORG_ID).build();
    private final Urn urn = new Urn("tel", "+250788000001", null);

    private ContactUrn givenContact(Contact contact, Long urnChannelId) {
        ContactUrn contactUrn = ContactUrn.builder().id(30L).orgId(ORG_ID).contactId(contact.getId())
                .scheme("tel").path("+250788000001").channelId(urnChannelId).build();
        when(contactService.getOrCreateByUrn(eq(ORG_ID), isNull(), any(Urn.class), eq(CHANNEL_ID)))
                .thenReturn(new ResolvedRecipient(contact, contactUrn));
        return contactUrn;
    }

    private void givenNoDuplicate() {
        when(msgRepository.findFirstByOrgIdAndContactIdAndDirectionAndTextAndSentOn(
                eq(ORG_ID), any(), eq(Direction.INCOMING), anyString(), any(LocalDateTime.class)))
                .thenReturn(Optional.empty());
        when(msgRepository.save(any(Msg.class))).thenAnswer(inv -> {
            Msg saved = inv.getArgument(0);
            saved.setId(100L);
            return saved;
        });
    }

    @Test
    @DisplayName("A new message is charged, counted and handed to the handlers")
    void createIncoming_newMessage() {
        // Given
        Contact contact = Contact.builder().id(3L).orgId(ORG_ID).build();
        givenContact(contact, CHANNEL_ID);
        givenNoDuplicate();
        when(creditService.decrementCredit(ORG_ID)).thenReturn(new CreditDebit(5L, 1));

        // When
        Msg msg = incomingMessageService.createIncoming(channel, urn, "Join", null, "ext-1", null);

        // Then
        assertEquals(100L, msg.getId());
        assertEquals(Direction.INCOMING, msg.getDirection());
        assertEquals(MessageStatus.PENDING, msg.getStatus());
        assertNull(msg.getMsgType());
        assertEquals(5L, msg.getTopUpId());
        assertEquals(30L, msg.getContactUrnId());
        assertEquals("ext-1", msg.getExternalId());
        assertNotNull(msg.getSentOn());
        verify(systemLabelCounter).recordCreated(List.of(msg));
        verify(messageHandlerChain).process(msg, contact);
        verifyNoInteractions(contactUrnRepository, contactRepository);
    }

    @Test
    @DisplayName("A redelivered message returns the existing one")
    void createIncoming_duplicate() {
        Contact contact = Contact.builder().id(3L).orgId(ORG_ID).build();
        givenContact(contact, CHANNEL_ID);
        LocalDateTime sentOn = LocalDateTime.of(2024, 5, 1, 10, 0);
        Msg existing = Msg.builder().id(99L).orgId(ORG_ID).direction(Direction.INCOMING).text("Join").build();
        when(msgRepository.findFirstByOrgIdAndContactIdAndDirectionAndTextAndSentOn(
                ORG_ID, 3L, Direction.INCOMING, "Join", sentOn)).thenReturn(Optional.of(existing));

        assertSame(existing, incomingMessageService.createIncoming(channel, urn, "Join", sentOn, null, null));

        verify(msgRepository, never()).save(any());
        verifyNoInteractions(creditService, systemLabelCounter, messageHandlerChain);
    }

    @Test
    @DisplayName("Test contacts are not charged and stopped contacts are unstopped")
    void createIncoming_testContactUnstopped() {
        Contact contact = Contact.builder().id(3L).orgId(ORG_ID).test(true).stopped(true).build();
        givenContact(contact, CHANNEL_ID);
        givenNoDuplicate();

        Msg msg = incomingMessageService.createIncoming(channel, urn, "Hi again", null, null, null);

        assertNull(msg.getTopUpId());
        assertFalse(contact.isStopped());
        verify(contactRepository).save(contact);
        verifyNoInteractions(creditService);
    }

    @Test
    @DisplayName("The URN follows the channel it was last heard on")
    void createIncoming_updatesUrnAffinity() {
        Contact contact = Contact.builder().id(3L).orgId(ORG_ID).test(true).build();
        ContactUrn contactUrn = givenContact(contact, 2L);
        givenNoDuplicate();

        incomingMessageService.createIncoming(channel, urn, "Hi", null, null, null);

        assertEquals(CHANNEL_ID, contactUrn.getChannelId());
        verify(contactUrnRepository).save(contactUrn);
    }

    @Test
    @DisplayName("Long text is truncated and IVR messages skip the handlers")
    void createIncoming_ivrTruncated() {
        Contact contact = Contact.builder().id(3L).orgId(ORG_ID).test(true).build();
        givenContact(contact, CHANNEL_ID);
        givenNoDuplicate();
        messageProperties.setMaxTextLength(5);

        Msg msg = incomingMessageService.createIncoming(channel, urn, "1234567890", null, null, null,
                MessageStatus.PENDING, MsgType.IVR);

        assertEquals("12345", msg.getText());
        assertEquals(MsgType.IVR, msg.getMsgType());
        verifyNoInteractions(messageHandlerChain);
    }
}
