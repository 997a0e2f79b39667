package com.relaycast.services.messaging.message.service.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.relaycast.services.messaging.broadcast.service.impl.BroadcastStatusAggregator;
import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.delivery.event.MessagesCreatedEvent;
import com.relaycast.services.messaging.exception.InvalidRequestException;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.kafka.event.MessageStatusEvent;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.org.dto.CreditDebit;
import com.relaycast.services.messaging.org.service.impl.CreditService;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageStatusService unit tests")
class MessageStatusServiceTest {

    private static final Long ORG_ID = 1L;
    private static final Long MSG_ID = 10L;

    @Mock private MsgRepository msgRepository;
    @Mock private ContactUrnRepository contactUrnRepository;
    @Mock private ChannelRegistryService channelRegistryService;
    @Mock private CreditService creditService;
    @Mock private SystemLabelCounter systemLabelCounter;
    @Mock private BroadcastStatusAggregator broadcastStatusAggregator;
    @Mock private ApplicationEventPublisher eventPublisher;

    @Spy
    private MessageProperties messageProperties = new MessageProperties();

    @InjectMocks
    private MessageStatusService messageStatusService;

    private Msg givenMsg(MessageStatus status, int errorCount) {
        Msg msg = Msg.builder()
                .id(MSG_ID)
                .uuid("m-10")
                .orgId(ORG_ID)
                .channelId(8L)
                .contactId(3L)
                .contactUrnId(30L)
                .broadcastId(50L)
                .text("Hello")
                .direction(Direction.OUTGOING)
                .status(status)
                .errorCount(errorCount)
                .topUpId(5L)
                .metadata(Map.of("quick_replies", List.of("Yes")))
                .build();
        when(msgRepository.findById(MSG_ID)).thenReturn(Optional.of(msg));
        return msg;
    }

    @Test
    @DisplayName("First error schedules a retry five minutes out")
    void markError_first_retriesAfterBackoff() {
        Msg msg = givenMsg(MessageStatus.WIRED, 0);
        LocalDateTime before = LocalDateTime.now();

        MessageStatus status = messageStatusService.markError(MSG_ID, false);

        assertEquals(MessageStatus.ERRORED, status);
        assertEquals(1, msg.getErrorCount().intValue());
        assertFalse(msg.getNextAttempt().isBefore(before.plusMinutes(5)));
        assertTrue(msg.getNextAttempt().isBefore(before.plusMinutes(6)));
        verify(systemLabelCounter).recordStatusChange(List.of(msg), MessageStatus.ERRORED);
        verify(msgRepository).save(msg);
    }

    @Test
    @DisplayName("Backoff grows with the error count")
    void markError_second_doublesBackoff() {
        Msg msg = givenMsg(MessageStatus.QUEUED, 1);
        LocalDateTime before = LocalDateTime.now();

        messageStatusService.markError(MSG_ID, false);

        assertEquals(MessageStatus.ERRORED, msg.getStatus());
        assertFalse(msg.getNextAttempt().isBefore(before.plus(Duration.ofMinutes(10))));
    }

    @Test
    @DisplayName("Third error fails the message")
    void markError_third_fails() {
        Msg msg = givenMsg(MessageStatus.QUEUED, 2);

        assertEquals(MessageStatus.FAILED, messageStatusService.markError(MSG_ID, false));
        assertEquals(3, msg.getErrorCount().intValue());
        assertNull(msg.getNextAttempt());
    }

    @Test
    @DisplayName("Fatal error fails the message at once")
    void markError_fatal_fails() {
        Msg msg = givenMsg(MessageStatus.WIRED, 0);

        assertEquals(MessageStatus.FAILED, messageStatusService.markError(MSG_ID, true));
        assertEquals(MessageStatus.FAILED, msg.getStatus());
    }

    @Test
    @DisplayName("Errors reported after the message was sent are ignored")
    void markError_afterSent_ignored() {
        Msg msg = givenMsg(MessageStatus.SENT, 0);

        assertEquals(MessageStatus.SENT, messageStatusService.markError(MSG_ID, false));
        assertEquals(0, msg.getErrorCount().intValue());
        verify(msgRepository, never()).save(any());
    }

    @Test
    @DisplayName("Failed is terminal for status reports")
    void failed_isTerminal() {
        Msg msg = givenMsg(MessageStatus.FAILED, 3);

        assertFalse(messageStatusService.markSent(MSG_ID, "ext-1"));
        assertFalse(messageStatusService.markDelivered(MSG_ID));
        assertEquals(MessageStatus.FAILED, msg.getStatus());
        verifyNoInteractions(systemLabelCounter);
    }

    @Test
    @DisplayName("Sent records the external id and sent time")
    void markSent_setsExternalIdAndSentOn() {
        Msg msg = givenMsg(MessageStatus.QUEUED, 0);

        assertTrue(messageStatusService.markSent(MSG_ID, "ext-1"));

        assertEquals(MessageStatus.SENT, msg.getStatus());
        assertEquals("ext-1", msg.getExternalId());
        assertNotNull(msg.getSentOn());
    }

    @Test
    @DisplayName("Status events are routed by status name")
    void apply_routesDelivered() {
        Msg msg = givenMsg(MessageStatus.SENT, 0);

        messageStatusService.apply(MessageStatusEvent.builder().msgId(MSG_ID).status("delivered").build());

        assertEquals(MessageStatus.DELIVERED, msg.getStatus());
    }

    @Test
    @DisplayName("Queueing marks label changes before the bulk update")
    void markQueued_bulkUpdates() {
        Msg a = Msg.builder().id(1L).orgId(ORG_ID).direction(Direction.OUTGOING).build();
        Msg b = Msg.builder().id(2L).orgId(ORG_ID).direction(Direction.OUTGOING).build();
        when(msgRepository.updateStatusQueued(eq(List.of(1L, 2L)), eq(MessageStatus.QUEUED),
                any(LocalDateTime.class))).thenReturn(2);

        assertEquals(2, messageStatusService.markQueued(List.of(a, b)));

        InOrder order = inOrder(systemLabelCounter, msgRepository);
        order.verify(systemLabelCounter).recordStatusChange(List.of(a, b), MessageStatus.QUEUED);
        order.verify(msgRepository).updateStatusQueued(eq(List.of(1L, 2L)), eq(MessageStatus.QUEUED),
                any(LocalDateTime.class));
    }

    @Test
    @DisplayName("Resend clones a failed message and retires the original")
    void resend_clonesFailedMessage() {
        // Given
        Msg original = givenMsg(MessageStatus.FAILED, 3);
        ContactUrn urn = ContactUrn.builder().id(30L).orgId(ORG_ID).scheme("tel").path("+250788000001").build();
        Channel newer = Channel.builder().id(9L).uuid("ch-9").orgId(ORG_ID).build();
        when(creditService.decrementCredit(ORG_ID)).thenReturn(new CreditDebit(6L, 1));
        when(contactUrnRepository.findById(30L)).thenReturn(Optional.of(urn));
        when(channelRegistryService.getSendChannel(ORG_ID, ChannelRole.SEND, urn)).thenReturn(Optional.of(newer));
        when(msgRepository.save(any(Msg.class))).thenAnswer(inv -> {
            Msg saved = inv.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(11L);
            }
            return saved;
        });

        // When
        Msg clone = messageStatusService.resend(MSG_ID);

        // Then
        assertEquals(11L, clone.getId());
        assertEquals(MessageStatus.PENDING, clone.getStatus());
        assertEquals("Hello", clone.getText());
        assertEquals(9L, clone.getChannelId());
        assertEquals(6L, clone.getTopUpId());
        assertEquals(50L, clone.getBroadcastId());
        assertEquals(0, clone.getErrorCount().intValue());

        assertEquals(MessageStatus.RESENT, original.getStatus());
        assertNull(original.getTopUpId());

        verify(broadcastStatusAggregator).updateFromMessages(50L);
        verify(eventPublisher).publishEvent(new MessagesCreatedEvent(50L, List.of(11L)));
    }

    @Test
    @DisplayName("Only failed or errored messages can be resent")
    void resend_delivered_rejected() {
        givenMsg(MessageStatus.DELIVERED, 0);

        assertThrows(InvalidRequestException.class, () -> messageStatusService.resend(MSG_ID));
        verifyNoInteractions(creditService);
    }

    @Test
    @DisplayName("Week old unsent messages are failed and their broadcasts refreshed")
    void failOldMessages_failsStale() {
        Msg stale = Msg.builder().id(1L).orgId(ORG_ID).direction(Direction.OUTGOING).status(MessageStatus.QUEUED)
                .broadcastId(50L).build();
        when(msgRepository.findStaleIds(eq(Direction.OUTGOING), anyCollection(), any(LocalDateTime.class)))
                .thenReturn(List.of(1L));
        when(msgRepository.findBroadcastIds(List.of(1L))).thenReturn(List.of(50L));
        when(msgRepository.findByIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of(stale));
        when(msgRepository.updateStatus(eq(List.of(1L)), eq(MessageStatus.FAILED), any(LocalDateTime.class)))
                .thenReturn(1);

        assertEquals(1, messageStatusService.failOldMessages());

        verify(systemLabelCounter).recordStatusChange(List.of(stale), MessageStatus.FAILED);
        verify(broadcastStatusAggregator).updateAll(List.of(50L));
    }

    @Test
    @DisplayName("Nothing stale means nothing to do")
    void failOldMessages_nothingStale() {
        when(msgRepository.findStaleIds(eq(Direction.OUTGOING), anyCollection(), any(LocalDateTime.class)))
                .thenReturn(List.of());

        assertEquals(0, messageStatusService.failOldMessages());
        verifyNoInteractions(broadcastStatusAggregator, systemLabelCounter);
    }
}
