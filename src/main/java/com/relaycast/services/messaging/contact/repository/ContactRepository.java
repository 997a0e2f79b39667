package com.relaycast.services.messaging.contact.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.relaycast.services.messaging.contact.model.Contact;

public interface ContactRepository extends JpaRepository<Contact, Long> {

    List<Contact> findByOrgIdAndIdIn(Long orgId, Collection<Long> ids);
}
