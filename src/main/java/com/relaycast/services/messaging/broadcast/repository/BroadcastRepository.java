package com.relaycast.services.messaging.broadcast.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.message.enums.MessageStatus;

public interface BroadcastRepository extends JpaRepository<Broadcast, Long> {

    Optional<Broadcast> findByIdAndActiveTrue(Long id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Broadcast b SET b.status = :status, b.modifiedOn = :now WHERE b.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") MessageStatus status, @Param("now") LocalDateTime now);

    /**
     * Moves the broadcast to a status only while it is still in one of the expected ones.
     * Returns 0 when another worker already moved it.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
                UPDATE Broadcast b
                SET b.status = :status, b.modifiedOn = :now
                WHERE b.id = :id
                  AND b.status IN :expected
            """)
    int updateStatusIfIn(@Param("id") Long id,
            @Param("status") MessageStatus status,
            @Param("expected") Collection<MessageStatus> expected,
            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Broadcast b SET b.recipientCount = :count, b.modifiedOn = :now WHERE b.id = :id")
    int updateRecipientCount(@Param("id") Long id, @Param("count") int count, @Param("now") LocalDateTime now);
}
