package com.relaycast.services.messaging.org.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.org.model.TopUp;

public interface TopUpRepository extends JpaRepository<TopUp, Long> {

    /**
     * Active, unexpired top-ups with credit left, soonest to expire first
     */
    @Query("""
                SELECT t FROM TopUp t
                WHERE t.orgId = :orgId
                  AND t.active = true
                  AND t.expiresOn > :now
                  AND t.used < t.credits
                ORDER BY t.expiresOn ASC, t.id ASC
            """)
    List<TopUp> findUsable(@Param("orgId") Long orgId, @Param("now") LocalDateTime now);

    /**
     * Takes credits from a top-up only if it still has them. Returns 1 when the credits were taken.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
                UPDATE TopUp t
                SET t.used = t.used + :amount
                WHERE t.id = :id
                  AND t.used + :amount <= t.credits
            """)
    int consume(@Param("id") Long id, @Param("amount") int amount);
}
