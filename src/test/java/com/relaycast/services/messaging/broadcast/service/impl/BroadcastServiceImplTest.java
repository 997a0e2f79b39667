package com.relaycast.services.messaging.broadcast.service.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.relaycast.services.messaging.broadcast.dto.BroadcastRequest;
import com.relaycast.services.messaging.broadcast.event.BroadcastQueuedEvent;
import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.broadcast.repository.BroadcastMsgCountRepository;
import com.relaycast.services.messaging.broadcast.repository.BroadcastRepository;
import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.config.BroadcastProperties;
import com.relaycast.services.messaging.contact.dto.Recipient;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.service.impl.UrnResolverService;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.exception.CreditExhaustedException;
import com.relaycast.services.messaging.exception.DuplicateBroadcastException;
import com.relaycast.services.messaging.exception.InvalidRequestException;
import com.relaycast.services.messaging.message.dto.BatchSendRequest;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.message.service.impl.MessageMaterializer;
import com.relaycast.services.messaging.org.model.Org;
import com.relaycast.services.messaging.org.repository.OrgRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("BroadcastServiceImpl unit tests")
class BroadcastServiceImplTest {

    private static final Long ORG_ID = 1L;
    private static final Long BROADCAST_ID = 50L;
    private static final Set<String> TEL_ONLY = Set.of(Urn.TEL);

    @Mock
    private BroadcastRepository broadcastRepository;

    @Mock
    private BroadcastMsgCountRepository broadcastMsgCountRepository;

    @Mock
    private OrgRepository orgRepository;

    @Mock
    private MsgRepository msgRepository;

    @Mock
    private ChannelRegistryService channelRegistryService;

    @Mock
    private UrnResolverService urnResolverService;

    @Mock
    private RecipientSetBuilder recipientSetBuilder;

    @Mock
    private LoopGuardService loopGuardService;

    @Mock
    private MessageMaterializer messageMaterializer;

    @Mock
    private BroadcastStatusAggregator broadcastStatusAggregator;

    @Mock
    private SystemLabelCounter systemLabelCounter;

    @Spy
    private BroadcastProperties broadcastProperties = new BroadcastProperties();

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private BroadcastServiceImpl broadcastService;

    private Broadcast broadcast;

    @BeforeEach
    void setUp() {
        broadcast = Broadcast.builder()
                .id(BROADCAST_ID)
                .orgId(ORG_ID)
                .text(Map.of("eng", "Hello"))
                .baseLanguage("eng")
                .groupIds(new LinkedHashSet<>(List.of(100L)))
                .build();
    }

    private static List<Long> urnIds(int count) {
        List<Long> ids = new ArrayList<>();
        for (long i = 1; i <= count; i++) {
            ids.add(i);
        }
        return ids;
    }

    private void givenSendable(List<Long> urnIds) {
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));
        when(urnResolverService.resolveSchemes(ORG_ID, null, ChannelRole.SEND)).thenReturn(TEL_ONLY);
        when(recipientSetBuilder.buildUrnIds(broadcast, TEL_ONLY)).thenReturn(urnIds);
    }

    @Test
    @DisplayName("Small broadcast is materialized inline and queued")
    void send_smallSet_materializesInline() {
        // Given
        givenSendable(urnIds(3));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenReturn(List.of(11L, 12L, 13L));

        // When
        broadcastService.send(BROADCAST_ID);

        // Then
        ArgumentCaptor<BatchSendRequest> captor = ArgumentCaptor.forClass(BatchSendRequest.class);
        verify(messageMaterializer).sendBatch(captor.capture());
        assertEquals(List.of(1L, 2L, 3L), captor.getValue().getUrnIds());
        assertTrue(captor.getValue().isTriggerSend());
        assertFalse(captor.getValue().isHighPriority());

        verify(broadcastRepository).updateRecipientCount(eq(BROADCAST_ID), eq(3), any(LocalDateTime.class));
        verify(broadcastRepository).updateStatus(eq(BROADCAST_ID), eq(MessageStatus.QUEUED), any(LocalDateTime.class));
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("Broadcast to a single recipient is sent high priority")
    void send_singleRecipient_highPriority() {
        givenSendable(urnIds(1));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenReturn(List.of(11L));

        broadcastService.send(BROADCAST_ID);

        ArgumentCaptor<BatchSendRequest> captor = ArgumentCaptor.forClass(BatchSendRequest.class);
        verify(messageMaterializer).sendBatch(captor.capture());
        assertTrue(captor.getValue().isHighPriority());
    }

    @Test
    @DisplayName("Exactly batch size recipients still go inline")
    void send_atBatchSize_inline() {
        givenSendable(urnIds(500));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenReturn(List.of());

        broadcastService.send(BROADCAST_ID);

        verify(messageMaterializer).sendBatch(any(BatchSendRequest.class));
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("Large broadcast is split into ceil(N/500) Kafka batches")
    void send_largeSet_publishesBatches() {
        // Given: 1201 recipients
        givenSendable(urnIds(1201));

        // When
        broadcastService.send(BROADCAST_ID);

        // Then: three chunks of 500, 500 and 201 in recipient order
        ArgumentCaptor<BroadcastQueuedEvent> captor = ArgumentCaptor.forClass(BroadcastQueuedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        List<List<Long>> chunks = captor.getValue().chunks();
        assertEquals(3, chunks.size());
        assertEquals(500, chunks.get(0).size());
        assertEquals(500, chunks.get(1).size());
        assertEquals(201, chunks.get(2).size());
        assertEquals(501L, chunks.get(1).get(0));
        assertEquals(1201L, chunks.get(2).get(200));

        verify(messageMaterializer, never()).sendBatch(any());
        verify(broadcastRepository).updateStatus(eq(BROADCAST_ID), eq(MessageStatus.QUEUED), any(LocalDateTime.class));
    }

    @Test
    @DisplayName("Broadcast with no reachable recipient is failed")
    void send_noRecipients_failed() {
        givenSendable(List.of());

        broadcastService.send(BROADCAST_ID);

        verify(broadcastRepository).updateStatus(eq(BROADCAST_ID), eq(MessageStatus.FAILED), any(LocalDateTime.class));
        verify(broadcastRepository, never()).updateStatus(eq(BROADCAST_ID), eq(MessageStatus.QUEUED), any());
        verifyNoInteractions(messageMaterializer);
    }

    @Test
    @DisplayName("Loop guard trip fails the broadcast without creating messages")
    void send_loopGuardTrips_failedAndThrows() {
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));
        doThrow(new DuplicateBroadcastException(BROADCAST_ID, 100L)).when(loopGuardService).checkAndMark(broadcast);

        assertThrows(DuplicateBroadcastException.class, () -> broadcastService.send(BROADCAST_ID));

        verify(broadcastRepository).updateStatus(eq(BROADCAST_ID), eq(MessageStatus.FAILED), any(LocalDateTime.class));
        verifyNoInteractions(recipientSetBuilder, messageMaterializer);
    }

    @Test
    @DisplayName("A send that fails after the loop guard gives its markers back")
    void send_failsAfterLoopGuard_releasesMarkers() {
        // Given: the guard marked group 100, then the org runs out of credit mid batch
        givenSendable(urnIds(3));
        when(loopGuardService.checkAndMark(broadcast)).thenReturn(List.of("broadcast:loop:100:abc"));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenThrow(new CreditExhaustedException(ORG_ID));

        // When / Then
        assertThrows(CreditExhaustedException.class, () -> broadcastService.send(BROADCAST_ID));
        verify(loopGuardService).release(List.of("broadcast:loop:100:abc"));
    }

    @Test
    @DisplayName("A successful send keeps its loop guard markers")
    void send_success_keepsMarkers() {
        givenSendable(urnIds(2));
        when(loopGuardService.checkAndMark(broadcast)).thenReturn(List.of("broadcast:loop:100:abc"));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenReturn(List.of(11L, 12L));

        broadcastService.send(BROADCAST_ID);

        verify(loopGuardService, never()).release(any());
    }

    @Test
    @DisplayName("Already sent broadcast can't be sent again")
    void send_notInitializing_throws() {
        broadcast.setStatus(MessageStatus.QUEUED);
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));

        assertThrows(InvalidRequestException.class, () -> broadcastService.send(BROADCAST_ID));
        verifyNoInteractions(loopGuardService);
    }

    @Test
    @DisplayName("Text without the base language is rejected")
    void create_missingBaseLanguage_throws() {
        BroadcastRequest request = new BroadcastRequest();
        request.setOrgId(ORG_ID);
        request.setBaseLanguage("fra");
        request.setText(Map.of("eng", "Hello"));
        request.setContactIds(Set.of(1L));

        assertThrows(InvalidRequestException.class, () -> broadcastService.create(request));
        verifyNoInteractions(broadcastRepository);
    }

    @Test
    @DisplayName("Quick reply without the base language is rejected")
    void create_quickReplyMissingBaseLanguage_throws() {
        BroadcastRequest request = new BroadcastRequest();
        request.setOrgId(ORG_ID);
        request.setBaseLanguage("eng");
        request.setText(Map.of("eng", "Pick one"));
        request.setQuickReplies(List.of(Map.of("eng", "Yes"), Map.of("fra", "Non")));
        request.setContactIds(Set.of(1L));

        assertThrows(InvalidRequestException.class, () -> broadcastService.create(request));
    }

    @Test
    @DisplayName("Raw URNs are resolved to URN ids and a scheduled broadcast is counted")
    void create_resolvesRawUrns() {
        // Given
        BroadcastRequest request = new BroadcastRequest();
        request.setOrgId(ORG_ID);
        request.setUserId(3L);
        request.setBaseLanguage("eng");
        request.setText(Map.of("eng", "Hello"));
        request.setUrns(List.of("tel:+250788000001"));
        request.setScheduled(true);

        Org org = Org.builder().id(ORG_ID).primaryLanguage("eng").build();
        ContactUrn urn = ContactUrn.builder().id(77L).orgId(ORG_ID).scheme(Urn.TEL).path("+250788000001").build();
        when(orgRepository.findById(ORG_ID)).thenReturn(Optional.of(org));
        when(urnResolverService.resolveRecipient(eq(org), eq(3L), any(Recipient.class), isNull(),
                eq(ChannelRole.SEND))).thenReturn(new ResolvedRecipient(Contact.builder().id(5L).build(), urn));
        when(recipientSetBuilder.estimate(any())).thenReturn(1);
        when(broadcastRepository.save(any(Broadcast.class))).thenAnswer(inv -> {
            Broadcast saved = inv.getArgument(0);
            saved.setId(BROADCAST_ID);
            return saved;
        });

        // When
        Broadcast created = broadcastService.create(request);

        // Then
        assertEquals(Set.of(77L), created.getUrnIds());
        assertEquals(1, created.getRecipientCount());
        assertTrue(created.isScheduled());
        verify(systemLabelCounter).recordScheduled(ORG_ID, 1);
    }

    @Test
    @DisplayName("Firing a scheduled broadcast sends a copy pointing at its parent")
    void fire_sendsCopyWithParent() {
        // Given
        broadcast.setScheduled(true);
        broadcast.setRecipientCount(2);
        AtomicReference<Broadcast> copy = new AtomicReference<>();
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));
        when(broadcastRepository.save(any(Broadcast.class))).thenAnswer(inv -> {
            Broadcast saved = inv.getArgument(0);
            saved.setId(60L);
            copy.set(saved);
            return saved;
        });
        when(broadcastRepository.findByIdAndActiveTrue(60L)).thenAnswer(inv -> Optional.of(copy.get()));
        when(urnResolverService.resolveSchemes(ORG_ID, null, ChannelRole.SEND)).thenReturn(TEL_ONLY);
        when(recipientSetBuilder.buildUrnIds(any(Broadcast.class), eq(TEL_ONLY))).thenReturn(List.of(1L, 2L));
        when(messageMaterializer.sendBatch(any(BatchSendRequest.class))).thenReturn(List.of(11L, 12L));

        // When
        Broadcast fired = broadcastService.fire(BROADCAST_ID);

        // Then
        assertEquals(60L, fired.getId());
        assertEquals(BROADCAST_ID, fired.getParentId());
        assertFalse(fired.isScheduled());
        assertEquals(Set.of(100L), fired.getGroupIds());
        verify(broadcastRepository).updateStatus(eq(60L), eq(MessageStatus.QUEUED), any(LocalDateTime.class));
    }

    @Test
    @DisplayName("Only scheduled broadcasts can be fired")
    void fire_notScheduled_throws() {
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));

        assertThrows(InvalidRequestException.class, () -> broadcastService.fire(BROADCAST_ID));
        verify(broadcastRepository, never()).save(any());
    }

    @Test
    @DisplayName("Release deactivates the broadcast and soft-deletes its messages")
    void release_softDeletesMessages() {
        List<Msg> visible = List.of(Msg.builder().id(1L).orgId(ORG_ID).build());
        when(broadcastRepository.findByIdAndActiveTrue(BROADCAST_ID)).thenReturn(Optional.of(broadcast));
        when(msgRepository.findByBroadcastIdAndVisibility(BROADCAST_ID, Visibility.VISIBLE)).thenReturn(visible);
        when(msgRepository.releaseByBroadcast(eq(BROADCAST_ID), eq(Visibility.DELETED), any(LocalDateTime.class)))
                .thenReturn(1);

        broadcastService.release(BROADCAST_ID);

        verify(systemLabelCounter).recordVisibilityChange(visible, Visibility.DELETED);
        verify(systemLabelCounter, never()).recordScheduled(any(), anyInt());
        assertFalse(broadcast.isActive());
        verify(broadcastRepository).save(broadcast);
    }
}
