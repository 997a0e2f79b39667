package com.relaycast.services.messaging.message.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.Visibility;
import com.relaycast.services.messaging.message.model.Msg;

public interface MsgRepository extends JpaRepository<Msg, Long> {

    List<Msg> findByIdInOrderByIdAsc(Collection<Long> ids);

    List<Msg> findByBroadcastIdAndVisibility(Long broadcastId, Visibility visibility);

    Optional<Msg> findFirstByOrgIdAndContactIdAndDirectionAndTextAndSentOn(Long orgId, Long contactId,
            Direction direction, String text, LocalDateTime sentOn);

    /**
     * Queues messages without loading them
     */
    @Modifying(clearAutomatically = true)
    @Query("""
                UPDATE Msg m
                SET m.status = :status, m.queuedOn = :now, m.modifiedOn = :now
                WHERE m.id IN :ids
            """)
    int updateStatusQueued(@Param("ids") Collection<Long> ids,
            @Param("status") MessageStatus status,
            @Param("now") LocalDateTime now);

    @Query("""
                SELECT m.id FROM Msg m
                WHERE m.direction = :direction
                  AND m.status = :status
                  AND m.nextAttempt <= :now
                ORDER BY m.nextAttempt ASC, m.id ASC
            """)
    List<Long> findRetryableIds(@Param("direction") Direction direction,
            @Param("status") MessageStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    @Query("""
                SELECT m.id FROM Msg m
                WHERE m.direction = :direction
                  AND m.status IN :statuses
                  AND m.createdOn < :cutoff
            """)
    List<Long> findStaleIds(@Param("direction") Direction direction,
            @Param("statuses") Collection<MessageStatus> statuses,
            @Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Msg m SET m.status = :status, m.modifiedOn = :now WHERE m.id IN :ids")
    int updateStatus(@Param("ids") Collection<Long> ids,
            @Param("status") MessageStatus status,
            @Param("now") LocalDateTime now);

    @Query("SELECT DISTINCT m.broadcastId FROM Msg m WHERE m.id IN :ids AND m.broadcastId IS NOT NULL")
    List<Long> findBroadcastIds(@Param("ids") Collection<Long> ids);

    /**
     * Rows of (status, count) over a broadcast's messages
     */
    @Query("SELECT m.status, COUNT(m) FROM Msg m WHERE m.broadcastId = :broadcastId GROUP BY m.status")
    List<Object[]> countByStatus(@Param("broadcastId") Long broadcastId);

    @Modifying(clearAutomatically = true)
    @Query("""
                UPDATE Msg m
                SET m.visibility = :visibility, m.text = '', m.modifiedOn = :now
                WHERE m.broadcastId = :broadcastId
            """)
    int releaseByBroadcast(@Param("broadcastId") Long broadcastId,
            @Param("visibility") Visibility visibility,
            @Param("now") LocalDateTime now);
}
