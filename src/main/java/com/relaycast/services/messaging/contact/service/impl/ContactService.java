package com.relaycast.services.messaging.contact.service.impl;

import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContactService {

    private final ContactRepository contactRepository;
    private final ContactUrnRepository contactUrnRepository;

    /**
     * Finds the contact owning a URN, creating the contact (and the URN) when there isn't one.
     * An orphaned URN is attached to the new contact.
     */
    @Transactional
    public ResolvedRecipient getOrCreateByUrn(Long orgId, Long actorId, Urn urn, Long channelId) {
        Optional<ContactUrn> existing = contactUrnRepository.findByOrgIdAndIdentity(orgId, urn.identity());

        if (existing.isPresent() && existing.get().getContactId() != null) {
            ContactUrn contactUrn = existing.get();
            Contact contact = contactRepository.findById(contactUrn.getContactId())
                    .orElseThrow(() -> new IllegalStateException(
                            "URN " + contactUrn.getId() + " points at missing contact " + contactUrn.getContactId()));
            return new ResolvedRecipient(contact, contactUrn);
        }

        Contact contact = contactRepository.save(Contact.builder()
                .uuid(UUID.randomUUID().toString())
                .orgId(orgId)
                .createdBy(actorId)
                .build());

        ContactUrn contactUrn = existing.orElseGet(() -> ContactUrn.builder()
                .orgId(orgId)
                .scheme(urn.scheme())
                .path(urn.path())
                .display(urn.display())
                .identity(urn.identity())
                .priority(ContactUrn.PRIORITY_HIGHEST)
                .build());
        contactUrn.setContactId(contact.getId());
        if (contactUrn.getChannelId() == null) {
            contactUrn.setChannelId(channelId);
        }
        contactUrn = contactUrnRepository.save(contactUrn);

        log.info("Created contact id={} for urn={} orgId={}", contact.getId(), urn.identity(), orgId);
        return new ResolvedRecipient(contact, contactUrn);
    }
}
