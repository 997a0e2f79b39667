package com.relaycast.services.messaging.message.service.impl;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

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
import com.relaycast.services.messaging.exception.ResourceNotFoundException;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.kafka.event.MessageStatusEvent;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.org.service.impl.CreditService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Status transitions of outgoing messages. Transitions the message state machine doesn't allow are ignored,
 * so late or repeated reports from the delivery worker can't move a message backwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageStatusService {

    private static final EnumSet<MessageStatus> STALE_STATUSES = EnumSet.of(
            MessageStatus.QUEUED, MessageStatus.PENDING, MessageStatus.ERRORED);

    private final MsgRepository msgRepository;
    private final ContactUrnRepository contactUrnRepository;
    private final ChannelRegistryService channelRegistryService;
    private final CreditService creditService;
    private final SystemLabelCounter systemLabelCounter;
    private final BroadcastStatusAggregator broadcastStatusAggregator;
    private final MessageProperties messageProperties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Queues messages in bulk. Commits on its own so the delivery worker never sees a message that isn't queued yet.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markQueued(List<Msg> msgs) {
        if (msgs.isEmpty()) {
            return 0;
        }
        systemLabelCounter.recordStatusChange(msgs, MessageStatus.QUEUED);
        List<Long> ids = msgs.stream().map(Msg::getId).collect(Collectors.toList());
        return msgRepository.updateStatusQueued(ids, MessageStatus.QUEUED, LocalDateTime.now());
    }

    @Transactional
    public boolean markWired(Long msgId, String externalId) {
        return markSent(msgId, MessageStatus.WIRED, externalId);
    }

    @Transactional
    public boolean markSent(Long msgId, String externalId) {
        return markSent(msgId, MessageStatus.SENT, externalId);
    }

    private boolean markSent(Long msgId, MessageStatus status, String externalId) {
        Msg msg = load(msgId);
        if (!transition(msg, status)) {
            return false;
        }
        msg.setSentOn(LocalDateTime.now());
        if (externalId != null) {
            msg.setExternalId(externalId);
        }
        msgRepository.save(msg);
        return true;
    }

    @Transactional
    public boolean markDelivered(Long msgId) {
        Msg msg = load(msgId);
        if (!transition(msg, MessageStatus.DELIVERED)) {
            return false;
        }
        if (msg.getSentOn() == null) {
            msg.setSentOn(LocalDateTime.now());
        }
        msgRepository.save(msg);
        return true;
    }

    /**
     * Records a send failure. The message is retried with a growing delay until it has failed maxErrors times,
     * or failed at once if the error is fatal.
     */
    @Transactional
    public MessageStatus markError(Long msgId, boolean fatal) {
        Msg msg = load(msgId);
        MessageProperties.Retry retry = messageProperties.getRetry();

        int errorCount = msg.getErrorCount() + 1;
        MessageStatus next = fatal || errorCount >= retry.getMaxErrors() ? MessageStatus.FAILED : MessageStatus.ERRORED;

        if (!msg.getStatus().canTransitionTo(next)) {
            log.warn("Ignoring error report for msgId={} in status {}", msgId, msg.getStatus());
            return msg.getStatus();
        }

        systemLabelCounter.recordStatusChange(List.of(msg), next);
        msg.setErrorCount(errorCount);
        msg.setStatus(next);
        if (next == MessageStatus.ERRORED) {
            msg.setNextAttempt(LocalDateTime.now().plus(retry.getBackoff().multipliedBy(errorCount)));
            log.info("Message errored, will retry. msgId={} errorCount={} nextAttempt={}",
                    msgId, errorCount, msg.getNextAttempt());
        } else {
            log.info("Message failed. msgId={} errorCount={} fatal={}", msgId, errorCount, fatal);
        }
        msgRepository.save(msg);
        return next;
    }

    @Transactional
    public boolean markFailed(Long msgId) {
        Msg msg = load(msgId);
        if (!transition(msg, MessageStatus.FAILED)) {
            return false;
        }
        msgRepository.save(msg);
        return true;
    }

    /**
     * Applies a status report from the delivery worker
     */
    @Transactional
    public void apply(MessageStatusEvent event) {
        MessageStatus status = MessageStatus.fromValue(event.getStatus());
        switch (status) {
            case WIRED:
                markWired(event.getMsgId(), event.getExternalId());
                break;
            case SENT:
                markSent(event.getMsgId(), event.getExternalId());
                break;
            case DELIVERED:
                markDelivered(event.getMsgId());
                break;
            case ERRORED:
                markError(event.getMsgId(), event.isFatal());
                break;
            case FAILED:
                markError(event.getMsgId(), true);
                break;
            default:
                throw new InvalidRequestException("Status " + status.getValue() + " can't be reported for a message");
        }
    }

    /**
     * Sends a failed message again as a new message, retiring the original as resent. Costs one credit.
     */
    @Transactional
    public Msg resend(Long msgId) {
        Msg original = load(msgId);
        if (!original.isOutgoing()
                || (original.getStatus() != MessageStatus.FAILED && original.getStatus() != MessageStatus.ERRORED)) {
            throw new InvalidRequestException(
                    "Only failed or errored outgoing messages can be resent, msg " + msgId + " is "
                            + original.getStatus().getValue());
        }

        Long topUpId = creditService.decrementCredit(original.getOrgId()).topUpId();

        Long channelId = original.getChannelId();
        if (original.getContactUrnId() != null) {
            ContactUrn urn = contactUrnRepository.findById(original.getContactUrnId()).orElse(null);
            if (urn != null) {
                channelId = channelRegistryService.getSendChannel(original.getOrgId(), ChannelRole.SEND, urn)
                        .map(Channel::getId)
                        .orElse(channelId);
            }
        }

        LocalDateTime now = LocalDateTime.now();
        Msg clone = Msg.builder()
                .uuid(UUID.randomUUID().toString())
                .orgId(original.getOrgId())
                .channelId(channelId)
                .contactId(original.getContactId())
                .contactUrnId(original.getContactUrnId())
                .broadcastId(original.getBroadcastId())
                .text(original.getText())
                .attachments(original.getAttachments())
                .direction(Direction.OUTGOING)
                .status(MessageStatus.PENDING)
                .visibility(original.getVisibility())
                .msgType(original.getMsgType())
                .highPriority(original.isHighPriority())
                .metadata(original.getMetadata())
                .responseToId(original.getResponseToId())
                .topUpId(topUpId)
                .createdOn(now)
                .build();
        clone = msgRepository.save(clone);

        systemLabelCounter.recordStatusChange(List.of(original), MessageStatus.RESENT);
        original.setStatus(MessageStatus.RESENT);
        original.setTopUpId(null);
        msgRepository.save(original);
        systemLabelCounter.recordCreated(List.of(clone));

        if (clone.getBroadcastId() != null) {
            broadcastStatusAggregator.updateFromMessages(clone.getBroadcastId());
        }

        log.info("Message resent. originalId={} cloneId={} channelId={}", msgId, clone.getId(), channelId);
        eventPublisher.publishEvent(new MessagesCreatedEvent(clone.getBroadcastId(), List.of(clone.getId())));
        return clone;
    }

    /**
     * Fails outgoing messages that have been waiting to go out for too long, then refreshes their broadcasts.
     */
    @Scheduled(cron = "${message.retry.fail-old-cron:0 0 * * * *}")
    @Transactional
    public int failOldMessages() {
        LocalDateTime cutoff = LocalDateTime.now().minus(messageProperties.getRetry().getFailAfter());
        List<Long> staleIds = msgRepository.findStaleIds(Direction.OUTGOING, STALE_STATUSES, cutoff);
        if (staleIds.isEmpty()) {
            return 0;
        }

        List<Long> broadcastIds = msgRepository.findBroadcastIds(staleIds);
        List<Msg> stale = msgRepository.findByIdInOrderByIdAsc(staleIds);
        systemLabelCounter.recordStatusChange(stale, MessageStatus.FAILED);
        int failed = msgRepository.updateStatus(staleIds, MessageStatus.FAILED, LocalDateTime.now());

        broadcastStatusAggregator.updateAll(new ArrayList<>(broadcastIds));

        log.info("Failed {} messages older than {} across {} broadcasts", failed, cutoff, broadcastIds.size());
        return failed;
    }

    private Msg load(Long msgId) {
        return msgRepository.findById(msgId)
                .orElseThrow(() -> new ResourceNotFoundException("Msg", msgId));
    }

    private boolean transition(Msg msg, MessageStatus next) {
        if (!msg.getStatus().canTransitionTo(next)) {
            log.warn("Ignoring transition of msgId={} from {} to {}", msg.getId(), msg.getStatus(), next);
            return false;
        }
        systemLabelCounter.recordStatusChange(List.of(msg), next);
        msg.setStatus(next);
        return true;
    }
}
