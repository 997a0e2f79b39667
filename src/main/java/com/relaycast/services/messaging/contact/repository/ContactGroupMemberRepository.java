package com.relaycast.services.messaging.contact.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.relaycast.services.messaging.contact.model.ContactGroupMember;

public interface ContactGroupMemberRepository extends JpaRepository<ContactGroupMember, Long> {

    /**
     * Ids of the active, unblocked, unstopped members of the groups, each once, in id order
     */
    @Query("""
                SELECT DISTINCT m.contactId FROM ContactGroupMember m, Contact c
                WHERE m.contactId = c.id
                  AND m.groupId IN :groupIds
                  AND c.active = true
                  AND c.blocked = false
                  AND c.stopped = false
                ORDER BY m.contactId
            """)
    List<Long> findSendableContactIds(@Param("groupIds") Collection<Long> groupIds);
}
