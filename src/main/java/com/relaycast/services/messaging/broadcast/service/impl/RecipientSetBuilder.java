package com.relaycast.services.messaging.broadcast.service.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.broadcast.dto.RecipientSpec;
import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactGroupCountRepository;
import com.relaycast.services.messaging.contact.repository.ContactGroupMemberRepository;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.contact.service.impl.UrnResolverService;
import com.relaycast.services.messaging.exception.InvalidRequestException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expands a broadcast's groups, contacts and URNs into the URNs its messages go to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipientSetBuilder {

    private final ContactGroupCountRepository contactGroupCountRepository;
    private final ContactGroupMemberRepository contactGroupMemberRepository;
    private final ContactRepository contactRepository;
    private final ContactUrnRepository contactUrnRepository;
    private final UrnResolverService urnResolverService;

    @Value("${broadcast.recipient-load-chunk:1000}")
    private int loadChunkSize = 1000;

    public void validate(RecipientSpec spec) {
        if (spec == null || spec.isEmpty()) {
            throw new InvalidRequestException("Must provide at least one group, contact or URN");
        }
    }

    /**
     * Cheap recipient count: group sizes plus explicit contacts plus explicit URNs.
     * A contact reachable more than one way is counted more than once.
     */
    public int estimate(RecipientSpec spec) {
        validate(spec);
        long total = spec.contactIds().size() + spec.urnIds().size() + spec.rawUrns().size();
        for (Long groupId : spec.groupIds()) {
            total += contactGroupCountRepository.getMemberCount(groupId);
        }
        return (int) Math.min(total, Integer.MAX_VALUE);
    }

    /**
     * The de-duplicated URN ids a broadcast sends to, in send order. Explicit URNs come first, then the best URN
     * (or every sendable URN with sendAll) of each contact not already reached through an explicit URN.
     */
    @Transactional(readOnly = true)
    public List<Long> buildUrnIds(Broadcast broadcast, Set<String> schemes) {
        LinkedHashSet<Long> urnIds = new LinkedHashSet<>();
        Set<Long> includedByUrn = new HashSet<>();

        if (!broadcast.getUrnIds().isEmpty()) {
            Map<Long, ContactUrn> explicit = contactUrnRepository
                    .findByOrgIdAndIdIn(broadcast.getOrgId(), broadcast.getUrnIds()).stream()
                    .collect(Collectors.toMap(ContactUrn::getId, Function.identity()));

            for (Long urnId : broadcast.getUrnIds()) {
                ContactUrn urn = explicit.get(urnId);
                if (urn == null) {
                    log.debug("Skipping missing urnId={} broadcastId={}", urnId, broadcast.getId());
                    continue;
                }
                urnIds.add(urn.getId());
                if (urn.getContactId() != null) {
                    includedByUrn.add(urn.getContactId());
                }
            }
        }

        LinkedHashSet<Long> contactIds = new LinkedHashSet<>();
        if (!broadcast.getGroupIds().isEmpty()) {
            contactIds.addAll(contactGroupMemberRepository.findSendableContactIds(broadcast.getGroupIds()));
        }
        contactIds.addAll(broadcast.getContactIds());
        contactIds.removeAll(includedByUrn);

        List<Long> pending = new ArrayList<>(contactIds);
        for (int start = 0; start < pending.size(); start += loadChunkSize) {
            List<Long> chunk = pending.subList(start, Math.min(start + loadChunkSize, pending.size()));
            addContactUrns(broadcast, chunk, schemes, urnIds);
        }

        log.info("Built recipient set for broadcastId={}: urns={} (explicitUrns={} contacts={} sendAll={})",
                broadcast.getId(), urnIds.size(), broadcast.getUrnIds().size(), contactIds.size(),
                broadcast.isSendAll());

        return new ArrayList<>(urnIds);
    }

    private void addContactUrns(Broadcast broadcast, List<Long> contactIds, Set<String> schemes,
            LinkedHashSet<Long> urnIds) {
        Map<Long, Contact> contacts = contactRepository.findByOrgIdAndIdIn(broadcast.getOrgId(), contactIds).stream()
                .filter(Contact::isActive)
                .collect(Collectors.toMap(Contact::getId, Function.identity()));

        Map<Long, List<ContactUrn>> urnsByContact = new HashMap<>();
        for (ContactUrn urn : contactUrnRepository.findByContactIdInOrderByPriorityDescIdAsc(contactIds)) {
            urnsByContact.computeIfAbsent(urn.getContactId(), k -> new ArrayList<>()).add(urn);
        }

        for (Long contactId : contactIds) {
            Contact contact = contacts.get(contactId);
            if (contact == null) {
                continue;
            }
            List<ContactUrn> urns = urnsByContact.getOrDefault(contactId, List.of());

            if (broadcast.isSendAll()) {
                urnResolverService.selectAllUrns(contact, urns, schemes).forEach(u -> urnIds.add(u.getId()));
            } else {
                Optional<ContactUrn> best = urnResolverService.selectUrn(contact, urns, schemes);
                if (best.isPresent()) {
                    urnIds.add(best.get().getId());
                } else {
                    log.debug("Contact {} has no sendable URN, skipping", contactId);
                }
            }
        }
    }
}
