package com.relaycast.services.messaging.broadcast.repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;

/**
 * Writes the broadcast_recipients rows mapped by {@link com.relaycast.services.messaging.broadcast.model.BroadcastRecipient}.
 */
@Repository
@RequiredArgsConstructor
public class BroadcastRecipientRepository {

    private static final String INSERT_SQL =
            "INSERT IGNORE INTO broadcast_recipients (broadcast_id, contact_id) VALUES (?, ?)";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Records contacts as recipients of a broadcast. Contacts already recorded, possibly by a concurrent
     * batch of the same broadcast, are skipped by the unique key rather than failing the insert.
     */
    public void recordAll(Long broadcastId, Collection<Long> contactIds) {
        if (contactIds.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(contactIds.size());
        for (Long contactId : contactIds) {
            rows.add(new Object[] { broadcastId, contactId });
        }
        jdbcTemplate.batchUpdate(INSERT_SQL, rows);
    }
}
