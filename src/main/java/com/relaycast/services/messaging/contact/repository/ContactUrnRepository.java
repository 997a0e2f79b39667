package com.relaycast.services.messaging.contact.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.relaycast.services.messaging.contact.model.ContactUrn;

public interface ContactUrnRepository extends JpaRepository<ContactUrn, Long> {

    Optional<ContactUrn> findByOrgIdAndIdentity(Long orgId, String identity);

    List<ContactUrn> findByContactIdOrderByPriorityDescIdAsc(Long contactId);

    List<ContactUrn> findByContactIdInOrderByPriorityDescIdAsc(Collection<Long> contactIds);

    List<ContactUrn> findByOrgIdAndIdIn(Long orgId, Collection<Long> ids);
}
