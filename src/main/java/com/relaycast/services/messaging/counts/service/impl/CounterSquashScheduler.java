package com.relaycast.services.messaging.counts.service.impl;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.relaycast.services.messaging.counts.enums.SquashableCounter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class CounterSquashScheduler {

    private final CounterSquasher counterSquasher;

    @Scheduled(fixedDelayString = "${counts.squash.interval-ms:60000}")
    public void squashAll() {
        for (SquashableCounter counter : SquashableCounter.values()) {
            try {
                int squashed = counterSquasher.squash(counter);
                if (squashed > 0) {
                    log.info("Squashed {} keys of {}", squashed, counter.getTable());
                }
            } catch (Exception e) {
                log.error("Squashing {} failed", counter.getTable(), e);
            }
        }
    }
}
