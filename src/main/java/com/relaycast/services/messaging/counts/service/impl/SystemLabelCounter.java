package com.relaycast.services.messaging.counts.service.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.counts.enums.SystemLabelType;
import com.relaycast.services.messaging.counts.model.SystemLabelCount;
import com.relaycast.services.messaging.counts.repository.SystemLabelCountRepository;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends delta rows to the system label counts as messages are created and change state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemLabelCounter {

    private final SystemLabelCountRepository systemLabelCountRepository;

    @Transactional
    public void recordCreated(Collection<Msg> msgs) {
        Map<Long, Map<SystemLabelType, Integer>> deltas = new HashMap<>();
        for (Msg msg : msgs) {
            label(msg, msg.getStatus(), msg.getVisibility())
                    .ifPresent(type -> add(deltas, msg.getOrgId(), type, 1));
        }
        save(deltas);
    }

    /**
     * Records moving the messages to a new status. Must be called before the messages are changed.
     */
    @Transactional
    public void recordStatusChange(Collection<Msg> msgs, MessageStatus newStatus) {
        Map<Long, Map<SystemLabelType, Integer>> deltas = new HashMap<>();
        for (Msg msg : msgs) {
            diff(deltas, msg, label(msg, msg.getStatus(), msg.getVisibility()),
                    label(msg, newStatus, msg.getVisibility()));
        }
        save(deltas);
    }

    @Transactional
    public void recordVisibilityChange(Collection<Msg> msgs, Visibility newVisibility) {
        Map<Long, Map<SystemLabelType, Integer>> deltas = new HashMap<>();
        for (Msg msg : msgs) {
            diff(deltas, msg, label(msg, msg.getStatus(), msg.getVisibility()),
                    label(msg, msg.getStatus(), newVisibility));
        }
        save(deltas);
    }

    /**
     * Records an arbitrary change of one message, given a copy taken before it was changed
     */
    @Transactional
    public void recordChange(Msg before, Msg after) {
        Map<Long, Map<SystemLabelType, Integer>> deltas = new HashMap<>();
        diff(deltas, after, label(before, before.getStatus(), before.getVisibility()),
                label(after, after.getStatus(), after.getVisibility()));
        save(deltas);
    }

    @Transactional
    public void recordScheduled(Long orgId, int delta) {
        Map<Long, Map<SystemLabelType, Integer>> deltas = new HashMap<>();
        add(deltas, orgId, SystemLabelType.SCHEDULED, delta);
        save(deltas);
    }

    @Transactional(readOnly = true)
    public Map<SystemLabelType, Long> getCounts(Long orgId) {
        Map<SystemLabelType, Long> counts = new EnumMap<>(SystemLabelType.class);
        for (SystemLabelType type : SystemLabelType.values()) {
            counts.put(type, 0L);
        }
        for (Object[] row : systemLabelCountRepository.sumByLabelType(orgId)) {
            counts.put(SystemLabelType.fromCode(((String) row[0]).charAt(0)), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private Optional<SystemLabelType> label(Msg msg, MessageStatus status, Visibility visibility) {
        return SystemLabelType.classify(msg.getDirection(), visibility, msg.getMsgType(), status);
    }

    private void diff(Map<Long, Map<SystemLabelType, Integer>> deltas, Msg msg,
            Optional<SystemLabelType> before, Optional<SystemLabelType> after) {
        if (before.equals(after)) {
            return;
        }
        before.ifPresent(type -> add(deltas, msg.getOrgId(), type, -1));
        after.ifPresent(type -> add(deltas, msg.getOrgId(), type, 1));
    }

    private void add(Map<Long, Map<SystemLabelType, Integer>> deltas, Long orgId, SystemLabelType type, int delta) {
        deltas.computeIfAbsent(orgId, k -> new EnumMap<>(SystemLabelType.class)).merge(type, delta, Integer::sum);
    }

    private void save(Map<Long, Map<SystemLabelType, Integer>> deltas) {
        List<SystemLabelCount> rows = new ArrayList<>();
        deltas.forEach((orgId, byType) -> byType.forEach((type, count) -> {
            if (count != 0) {
                rows.add(SystemLabelCount.builder()
                        .orgId(orgId)
                        .labelType(String.valueOf(type.getCode()))
                        .count(count)
                        .build());
            }
        }));

        if (!rows.isEmpty()) {
            systemLabelCountRepository.saveAll(rows);
            log.debug("Appended {} system label count deltas", rows.size());
        }
    }
}
