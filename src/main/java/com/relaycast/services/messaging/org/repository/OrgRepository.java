package com.relaycast.services.messaging.org.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import com.relaycast.services.messaging.org.model.Org;

public interface OrgRepository extends JpaRepository<Org, Long> {
}
