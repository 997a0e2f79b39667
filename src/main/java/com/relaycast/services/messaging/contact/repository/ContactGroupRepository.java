package com.relaycast.services.messaging.contact.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.relaycast.services.messaging.contact.model.ContactGroup;

public interface ContactGroupRepository extends JpaRepository<ContactGroup, Long> {

    List<ContactGroup> findByOrgIdAndIdInAndActiveTrue(Long orgId, Collection<Long> ids);
}
