package com.relaycast.services.messaging.counts.service.impl;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.counts.enums.SquashableCounter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Compacts squashable counters: the delta rows of a key are replaced by a single row holding their sum.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterSquasher {

    private final JdbcTemplate jdbcTemplate;

    @Value("${counts.squash.max-keys:5000}")
    private int maxKeys;

    /**
     * Squashes up to maxKeys keys of a counter in one transaction.
     *
     * @return the number of keys squashed
     */
    @Transactional
    public int squash(SquashableCounter counter) {
        List<Object[]> keys = jdbcTemplate.query(counter.unsquashedKeysSql(), (rs, rowNum) -> {
            Object[] key = new Object[counter.getKeyColumns().size()];
            for (int i = 0; i < key.length; i++) {
                key[i] = rs.getObject(i + 1);
            }
            return key;
        }, maxKeys);

        for (Object[] key : keys) {
            squashKey(counter, key);
        }
        return keys.size();
    }

    void squashKey(SquashableCounter counter, Object[] key) {
        // rows of the key stay locked until commit, so concurrent deltas wait rather than get lost
        Long sum = jdbcTemplate.queryForObject(counter.lockingSumSql(), Long.class, key);
        long total = sum == null ? 0L : sum;

        jdbcTemplate.update(counter.deleteSql(), key);

        List<Object> args = new ArrayList<>(List.of(key));
        args.add(total);
        jdbcTemplate.update(counter.insertSquashedSql(), args.toArray());

        log.debug("Squashed {} key={} total={}", counter.getTable(), List.of(key), total);
    }
}
