package com.relaycast.services.messaging.contact.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.contact.model.ContactGroupCount;

public interface ContactGroupCountRepository extends JpaRepository<ContactGroupCount, Long> {

    @Query("SELECT COALESCE(SUM(c.count), 0) FROM ContactGroupCount c WHERE c.groupId = :groupId")
    long getMemberCount(@Param("groupId") Long groupId);
}
