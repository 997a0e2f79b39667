package com.relaycast.services.messaging.broadcast.service.impl;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.broadcast.dto.BroadcastRequest;
import com.relaycast.services.messaging.broadcast.dto.RecipientSpec;
import com.relaycast.services.messaging.broadcast.event.BroadcastQueuedEvent;
import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.broadcast.repository.BroadcastMsgCountRepository;
import com.relaycast.services.messaging.broadcast.repository.BroadcastRepository;
import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.config.BroadcastProperties;
import com.relaycast.services.messaging.contact.dto.Recipient;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.service.impl.UrnResolverService;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.exception.DuplicateBroadcastException;
import com.relaycast.services.messaging.exception.InvalidRequestException;
import com.relaycast.services.messaging.exception.ResourceNotFoundException;
import com.relaycast.services.messaging.exception.UnreachableException;
import com.relaycast.services.messaging.message.dto.BatchSendRequest;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.message.service.impl.MessageMaterializer;
import com.relaycast.services.messaging.org.model.Org;
import com.relaycast.services.messaging.org.repository.OrgRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Broadcast lifecycle: create, send (inline or in Kafka batches), fire a scheduled copy, release.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastServiceImpl {

    private final BroadcastRepository broadcastRepository;
    private final BroadcastMsgCountRepository broadcastMsgCountRepository;
    private final OrgRepository orgRepository;
    private final MsgRepository msgRepository;
    private final ChannelRegistryService channelRegistryService;
    private final UrnResolverService urnResolverService;
    private final RecipientSetBuilder recipientSetBuilder;
    private final LoopGuardService loopGuardService;
    private final MessageMaterializer messageMaterializer;
    private final BroadcastStatusAggregator broadcastStatusAggregator;
    private final SystemLabelCounter systemLabelCounter;
    private final BroadcastProperties broadcastProperties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Persists a broadcast. Raw URNs are resolved to URN ids here, creating contacts as needed.
     * The recipient count is an estimate until the broadcast is sent.
     */
    @Transactional
    public Broadcast create(BroadcastRequest request) {
        log.info("=== Creating broadcast ===");
        validateTranslations(request);

        RecipientSpec spec = request.toRecipientSpec();
        recipientSetBuilder.validate(spec);

        Org org = orgRepository.findById(request.getOrgId())
                .orElseThrow(() -> new ResourceNotFoundException("Org", request.getOrgId()));

        Channel channel = null;
        if (request.getChannelId() != null) {
            channel = channelRegistryService.findById(request.getChannelId())
                    .filter(c -> c.getOrgId().equals(org.getId()))
                    .orElseThrow(() -> new ResourceNotFoundException("Channel", request.getChannelId()));
        }

        Set<Long> urnIds = new LinkedHashSet<>(spec.urnIds());
        for (String raw : spec.rawUrns()) {
            try {
                ResolvedRecipient resolved = urnResolverService.resolveRecipient(org, request.getUserId(),
                        Recipient.of(raw), channel, ChannelRole.SEND);
                urnIds.add(resolved.urn().getId());
            } catch (UnreachableException e) {
                log.warn("Skipping unreachable urn={} orgId={}: {}", raw, org.getId(), e.getMessage());
            }
        }

        RecipientSpec resolvedSpec = new RecipientSpec(spec.groupIds(), spec.contactIds(), urnIds, null);

        Broadcast broadcast = broadcastRepository.save(Broadcast.builder()
                .orgId(org.getId())
                .text(request.getText())
                .media(request.getMedia())
                .quickReplies(request.getQuickReplies())
                .baseLanguage(request.getBaseLanguage())
                .groupIds(new LinkedHashSet<>(resolvedSpec.groupIds()))
                .contactIds(new LinkedHashSet<>(resolvedSpec.contactIds()))
                .urnIds(new LinkedHashSet<>(resolvedSpec.urnIds()))
                .recipientCount(resolvedSpec.isEmpty() ? 0 : recipientSetBuilder.estimate(resolvedSpec))
                .channelId(channel != null ? channel.getId() : null)
                .sendAll(request.isSendAll())
                .scheduled(request.isScheduled())
                .createdBy(request.getUserId())
                .build());

        if (broadcast.isScheduled()) {
            systemLabelCounter.recordScheduled(broadcast.getOrgId(), 1);
        }

        log.info("Broadcast created. broadcastId={} orgId={} estimate={} scheduled={}",
                broadcast.getId(), broadcast.getOrgId(), broadcast.getRecipientCount(), broadcast.isScheduled());
        return broadcast;
    }

    /**
     * Sends a broadcast to its recipients. Up to batchSize recipients are materialized inline, larger sends are
     * split into batches on Kafka. The broadcast ends up FAILED when the loop guard trips or no recipient
     * is reachable.
     *
     * @throws DuplicateBroadcastException if a large group was sent the same text recently
     */
    @Transactional(noRollbackFor = DuplicateBroadcastException.class)
    public Broadcast send(Long broadcastId) {
        Broadcast broadcast = getBroadcast(broadcastId);
        if (broadcast.getStatus() != MessageStatus.INITIALIZING) {
            throw new InvalidRequestException(
                    "Broadcast " + broadcastId + " was already sent, status " + broadcast.getStatus().getValue());
        }
        if (broadcast.isScheduled()) {
            throw new InvalidRequestException("Broadcast " + broadcastId + " is scheduled and can only be fired");
        }

        log.info("=== Sending broadcast {} ===", broadcastId);

        List<String> markers;
        try {
            markers = loopGuardService.checkAndMark(broadcast);
        } catch (DuplicateBroadcastException e) {
            broadcastRepository.updateStatus(broadcastId, MessageStatus.FAILED, LocalDateTime.now());
            throw e;
        }

        try {
            queueRecipients(broadcast);
        } catch (RuntimeException e) {
            // the send rolls back, so the text was never sent to those groups
            log.warn("Broadcast send failed, releasing loop guard. broadcastId={}: {}", broadcastId, e.getMessage());
            loopGuardService.release(markers);
            throw e;
        }

        return getBroadcast(broadcastId);
    }

    /**
     * Counts the reachable recipients and materializes them inline or hands them to Kafka in batches.
     */
    private void queueRecipients(Broadcast broadcast) {
        Long broadcastId = broadcast.getId();
        Channel channelOverride = broadcast.getChannelId() == null ? null
                : channelRegistryService.findById(broadcast.getChannelId()).orElse(null);
        Set<String> schemes = urnResolverService.resolveSchemes(broadcast.getOrgId(), channelOverride,
                ChannelRole.SEND);

        List<Long> urnIds = recipientSetBuilder.buildUrnIds(broadcast, schemes);
        LocalDateTime now = LocalDateTime.now();
        broadcastRepository.updateRecipientCount(broadcastId, urnIds.size(), now);

        if (urnIds.isEmpty()) {
            log.warn("Broadcast has no reachable recipients. broadcastId={}", broadcastId);
            broadcastRepository.updateStatus(broadcastId, MessageStatus.FAILED, now);
            return;
        }

        broadcastRepository.updateStatus(broadcastId, MessageStatus.QUEUED, now);

        int batchSize = broadcastProperties.getBatchSize();
        if (urnIds.size() <= batchSize) {
            List<Long> msgIds = messageMaterializer.sendBatch(BatchSendRequest.builder()
                    .broadcastId(broadcastId)
                    .urnIds(urnIds)
                    .triggerSend(true)
                    .highPriority(urnIds.size() == 1)
                    .build());
            log.info("Broadcast sent inline. broadcastId={} recipients={} created={}",
                    broadcastId, urnIds.size(), msgIds.size());
        } else {
            List<List<Long>> chunks = new ArrayList<>();
            for (int start = 0; start < urnIds.size(); start += batchSize) {
                chunks.add(new ArrayList<>(urnIds.subList(start, Math.min(start + batchSize, urnIds.size()))));
            }
            eventPublisher.publishEvent(new BroadcastQueuedEvent(broadcastId, broadcast.getOrgId(), chunks));
            log.info("Broadcast queued in batches. broadcastId={} recipients={} batches={}",
                    broadcastId, urnIds.size(), chunks.size());
        }
    }

    /**
     * Sends a copy of a scheduled broadcast, leaving the schedule itself untouched.
     */
    @Transactional(noRollbackFor = DuplicateBroadcastException.class)
    public Broadcast fire(Long scheduledBroadcastId) {
        Broadcast scheduled = getBroadcast(scheduledBroadcastId);
        if (!scheduled.isScheduled()) {
            throw new InvalidRequestException("Broadcast " + scheduledBroadcastId + " is not scheduled");
        }

        Broadcast copy = broadcastRepository.save(Broadcast.builder()
                .orgId(scheduled.getOrgId())
                .text(scheduled.getText())
                .media(scheduled.getMedia())
                .quickReplies(scheduled.getQuickReplies())
                .baseLanguage(scheduled.getBaseLanguage())
                .groupIds(new LinkedHashSet<>(scheduled.getGroupIds()))
                .contactIds(new LinkedHashSet<>(scheduled.getContactIds()))
                .urnIds(new LinkedHashSet<>(scheduled.getUrnIds()))
                .recipientCount(scheduled.getRecipientCount())
                .channelId(scheduled.getChannelId())
                .sendAll(scheduled.isSendAll())
                .parentId(scheduled.getId())
                .createdBy(scheduled.getCreatedBy())
                .build());

        log.info("Firing scheduled broadcast. parentId={} broadcastId={}", scheduledBroadcastId, copy.getId());
        return send(copy.getId());
    }

    /**
     * Deactivates a broadcast and soft-deletes its messages
     */
    @Transactional
    public void release(Long broadcastId) {
        Broadcast broadcast = getBroadcast(broadcastId);

        List<Msg> visible = msgRepository.findByBroadcastIdAndVisibility(broadcastId, Visibility.VISIBLE);
        systemLabelCounter.recordVisibilityChange(visible, Visibility.DELETED);
        int released = msgRepository.releaseByBroadcast(broadcastId, Visibility.DELETED, LocalDateTime.now());

        if (broadcast.isScheduled()) {
            systemLabelCounter.recordScheduled(broadcast.getOrgId(), -1);
        }
        broadcast.setActive(false);
        broadcastRepository.save(broadcast);

        log.info("Broadcast released. broadcastId={} messages={}", broadcastId, released);
    }

    public MessageStatus updateFromMessages(Long broadcastId) {
        return broadcastStatusAggregator.updateFromMessages(broadcastId);
    }

    @Transactional(readOnly = true)
    public Broadcast getBroadcast(Long broadcastId) {
        return broadcastRepository.findByIdAndActiveTrue(broadcastId)
                .orElseThrow(() -> new ResourceNotFoundException("Broadcast", broadcastId));
    }

    @Transactional(readOnly = true)
    public long getMessageCount(Long broadcastId) {
        return broadcastMsgCountRepository.getMessageCount(broadcastId);
    }

    private void validateTranslations(BroadcastRequest request) {
        String base = request.getBaseLanguage();
        if (request.getText() == null || isBlank(request.getText().get(base))) {
            throw new InvalidRequestException("Text must have a translation for base language " + base);
        }
        if (request.getMedia() != null && !request.getMedia().isEmpty() && isBlank(request.getMedia().get(base))) {
            throw new InvalidRequestException("Media must have a translation for base language " + base);
        }
        if (request.getQuickReplies() != null) {
            for (Map<String, String> reply : request.getQuickReplies()) {
                if (reply == null || isBlank(reply.get(base))) {
                    throw new InvalidRequestException("Quick replies must have a translation for base language "
                            + base);
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
