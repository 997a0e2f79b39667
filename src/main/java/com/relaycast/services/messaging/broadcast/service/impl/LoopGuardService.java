package com.relaycast.services.messaging.broadcast.service.impl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.config.BroadcastProperties;
import com.relaycast.services.messaging.contact.repository.ContactGroupCountRepository;
import com.relaycast.services.messaging.exception.DuplicateBroadcastException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stops the same text from being blasted to a large group twice within a few hours.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoopGuardService {

    private final StringRedisTemplate redisTemplate;
    private final ContactGroupCountRepository contactGroupCountRepository;
    private final BroadcastProperties broadcastProperties;

    /**
     * Marks every large group of the broadcast as recently sent this text. If any group was already marked,
     * the markers set by this call are removed again and the send is refused.
     *
     * @return the marker keys taken, to be passed to {@link #release(List)} if the send fails afterwards
     * @throws DuplicateBroadcastException if a large group was sent the same text within the guard window
     */
    public List<String> checkAndMark(Broadcast broadcast) {
        BroadcastProperties.LoopGuard guard = broadcastProperties.getLoopGuard();
        String text = broadcast.getText().get(broadcast.getBaseLanguage());
        List<String> taken = new ArrayList<>();

        for (Long groupId : broadcast.getGroupIds()) {
            long members = contactGroupCountRepository.getMemberCount(groupId);
            if (members <= guard.getMinGroupSize()) {
                continue;
            }

            String key = markerKey(groupId, text);
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(key, String.valueOf(broadcast.getId()), guard.getTtl());

            if (!Boolean.TRUE.equals(acquired)) {
                log.warn("Loop guard tripped. broadcastId={} groupId={} members={}",
                        broadcast.getId(), groupId, members);
                release(taken);
                throw new DuplicateBroadcastException(broadcast.getId(), groupId);
            }
            taken.add(key);
        }

        if (!taken.isEmpty()) {
            log.debug("Loop guard marked {} groups for broadcastId={}", taken.size(), broadcast.getId());
        }
        return taken;
    }

    /**
     * Removes markers taken by a send that didn't go through, so the same text can be sent again.
     */
    public void release(List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        redisTemplate.delete(keys);
        log.info("Loop guard released {} markers", keys.size());
    }

    String markerKey(Long groupId, String text) {
        String digest = DigestUtils.md5DigestAsHex((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
        return broadcastProperties.getLoopGuard().getKeyPrefix() + groupId + ":" + digest;
    }
}
