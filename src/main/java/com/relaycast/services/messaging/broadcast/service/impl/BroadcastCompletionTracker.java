package com.relaycast.services.messaging.broadcast.service.impl;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import com.relaycast.services.messaging.broadcast.repository.BroadcastRepository;
import com.relaycast.services.messaging.config.BroadcastProperties;
import com.relaycast.services.messaging.message.enums.MessageStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts how many of a broadcast's recipients have been batched and marks the broadcast sent once all have.
 * The counter lives in Redis with a short expiry, it is a progress signal only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastCompletionTracker {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementWithExpiryScript;
    private final BroadcastRepository broadcastRepository;
    private final BroadcastProperties broadcastProperties;

    /**
     * @return true if this batch completed the broadcast
     */
    public boolean recordBatched(Long broadcastId, int batchedCount, int recipientCount) {
        BroadcastProperties.Completion completion = broadcastProperties.getCompletion();
        String key = completion.getKeyPrefix() + broadcastId;

        Long total = redisTemplate.execute(incrementWithExpiryScript, List.of(key),
                String.valueOf(batchedCount), String.valueOf(completion.getTtl().getSeconds()));

        log.debug("Broadcast progress broadcastId={} batched={}/{}", broadcastId, total, recipientCount);

        if (total == null || total < recipientCount) {
            return false;
        }

        int updated = broadcastRepository.updateStatusIfIn(broadcastId, MessageStatus.SENT,
                EnumSet.of(MessageStatus.QUEUED, MessageStatus.PENDING), LocalDateTime.now());
        if (updated > 0) {
            log.info("Broadcast fully batched, marked sent. broadcastId={} recipients={}", broadcastId, recipientCount);
        }
        return updated > 0;
    }
}
