package com.relaycast.services.messaging.broadcast.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.broadcast.model.BroadcastMsgCount;

public interface BroadcastMsgCountRepository extends JpaRepository<BroadcastMsgCount, Long> {

    @Query("SELECT COALESCE(SUM(c.count), 0) FROM BroadcastMsgCount c WHERE c.broadcastId = :broadcastId")
    long getMessageCount(@Param("broadcastId") Long broadcastId);
}
