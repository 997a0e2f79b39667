package com.relaycast.services.messaging.org.service.impl;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.exception.CreditExhaustedException;
import com.relaycast.services.messaging.org.dto.CreditDebit;
import com.relaycast.services.messaging.org.model.TopUp;
import com.relaycast.services.messaging.org.repository.TopUpRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Org credit accounting. Each call takes exactly one credit from the top-up that expires first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditService {

    private final TopUpRepository topUpRepository;

    /**
     * Decrements one credit. Joins the caller's transaction so a rolled back batch returns its credits.
     *
     * @throws CreditExhaustedException if no active top-up has credit left
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CreditDebit decrementCredit(Long orgId) {
        List<TopUp> candidates = topUpRepository.findUsable(orgId, LocalDateTime.now());

        for (TopUp topUp : candidates) {
            // conditional update, loses cleanly to a concurrent batch that drained this top-up
            if (topUpRepository.consume(topUp.getId(), 1) == 1) {
                log.debug("Debited 1 credit from topUpId={} orgId={}", topUp.getId(), orgId);
                return new CreditDebit(topUp.getId(), 1);
            }
        }

        log.warn("Credit exhausted for orgId={} (candidates={})", orgId, candidates.size());
        throw new CreditExhaustedException(orgId);
    }
}
