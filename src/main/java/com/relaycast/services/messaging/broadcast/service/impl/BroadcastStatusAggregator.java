package com.relaycast.services.messaging.broadcast.service.impl;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.broadcast.repository.BroadcastRepository;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.repository.MsgRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives a broadcast's status from the statuses of its messages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastStatusAggregator {

    private final MsgRepository msgRepository;
    private final BroadcastRepository broadcastRepository;

    @Transactional
    public void updateAll(Collection<Long> broadcastIds) {
        for (Long broadcastId : broadcastIds) {
            updateFromMessages(broadcastId);
        }
    }

    /**
     * @return the new status, or null if the broadcast has no messages to aggregate
     */
    @Transactional
    public MessageStatus updateFromMessages(Long broadcastId) {
        Map<MessageStatus, Long> counts = new EnumMap<>(MessageStatus.class);
        long total = 0;
        for (Object[] row : msgRepository.countByStatus(broadcastId)) {
            MessageStatus status = (MessageStatus) row[0];
            long count = ((Number) row[1]).longValue();
            // resent messages were replaced by their clones
            if (status == MessageStatus.RESENT) {
                continue;
            }
            counts.put(status, count);
            total += count;
        }

        MessageStatus status = aggregate(counts, total);
        if (status == null) {
            return null;
        }

        broadcastRepository.updateStatus(broadcastId, status, LocalDateTime.now());
        log.debug("Broadcast status aggregated. broadcastId={} status={} counts={}", broadcastId, status, counts);
        return status;
    }

    static MessageStatus aggregate(Map<MessageStatus, Long> counts, long total) {
        if (total == 0) {
            return null;
        }
        long half = total / 2;
        if (counts.getOrDefault(MessageStatus.ERRORED, 0L) > half) {
            return MessageStatus.ERRORED;
        }
        if (counts.getOrDefault(MessageStatus.FAILED, 0L) > half) {
            return MessageStatus.FAILED;
        }
        if (counts.getOrDefault(MessageStatus.QUEUED, 0L) > 0 || counts.getOrDefault(MessageStatus.PENDING, 0L) > 0) {
            return MessageStatus.QUEUED;
        }
        if (counts.getOrDefault(MessageStatus.SENT, 0L) > 0 || counts.getOrDefault(MessageStatus.WIRED, 0L) > 0) {
            return MessageStatus.SENT;
        }
        if (counts.getOrDefault(MessageStatus.DELIVERED, 0L) == total) {
            return MessageStatus.DELIVERED;
        }
        return null;
    }
}
