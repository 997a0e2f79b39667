package com.relaycast.services.messaging.channel.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.relaycast.services.messaging.channel.model.Channel;

public interface ChannelRepository extends JpaRepository<Channel, Long> {

    /**
     * Active channels of an org, newest first
     */
    List<Channel> findByOrgIdAndActiveTrueOrderByCreatedOnDescIdDesc(Long orgId);
}
