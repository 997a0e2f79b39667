package com.relaycast.services.messaging.contact.service.impl;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.contact.dto.Recipient;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.exception.UnreachableException;
import com.relaycast.services.messaging.org.model.Org;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a recipient to the contact and URN an outgoing message should go to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UrnResolverService {

    private static final Comparator<ContactUrn> BY_PRIORITY = Comparator
            .comparing(ContactUrn::getPriority, Comparator.reverseOrder())
            .thenComparing(ContactUrn::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ChannelRegistryService channelRegistryService;
    private final ContactService contactService;
    private final ContactRepository contactRepository;
    private final ContactUrnRepository contactUrnRepository;

    /**
     * @param channelOverride when given, only its schemes are considered
     * @throws UnreachableException if the recipient has no URN on a supported scheme
     */
    public ResolvedRecipient resolveRecipient(Org org, Long actorId, Recipient recipient, Channel channelOverride,
            ChannelRole role) {
        Set<String> schemes = resolveSchemes(org.getId(), channelOverride, role);

        switch (recipient.kind()) {
            case CONTACT: {
                Contact contact = ((Recipient.ContactRecipient) recipient).contact();
                List<ContactUrn> urns = contactUrnRepository.findByContactIdOrderByPriorityDescIdAsc(contact.getId());
                return selectUrn(contact, urns, schemes)
                        .map(urn -> new ResolvedRecipient(contact, urn))
                        .orElseThrow(() -> new UnreachableException(
                                "No suitable URN found for contact " + contact.getId()));
            }
            case URN: {
                ContactUrn urn = ((Recipient.UrnRecipient) recipient).urn();
                if (!schemes.contains(urn.getScheme()) || urn.getContactId() == null) {
                    throw new UnreachableException("URN " + urn.getIdentity() + " has no usable channel");
                }
                Contact contact = contactRepository.findById(urn.getContactId())
                        .orElseThrow(() -> new UnreachableException("URN " + urn.getIdentity() + " has no contact"));
                return new ResolvedRecipient(contact, urn);
            }
            case RAW_URN: {
                Urn urn = Urn.parse(((Recipient.RawUrnRecipient) recipient).urn());
                if (!schemes.contains(urn.scheme())) {
                    throw new UnreachableException("No channel supports scheme " + urn.scheme());
                }
                Long channelId = channelOverride != null ? channelOverride.getId() : null;
                return contactService.getOrCreateByUrn(org.getId(), actorId, urn, channelId);
            }
            default:
                throw new IllegalArgumentException("Unsupported recipient kind " + recipient.kind());
        }
    }

    public Set<String> resolveSchemes(Long orgId, Channel channelOverride, ChannelRole role) {
        if (channelOverride != null) {
            return channelOverride.getSchemes() == null ? Set.of() : Set.copyOf(channelOverride.getSchemes());
        }
        return channelRegistryService.getSchemes(orgId, role);
    }

    /**
     * Highest priority URN on a supported scheme. Test contacts take their first URN regardless of scheme.
     */
    public Optional<ContactUrn> selectUrn(Contact contact, List<ContactUrn> urns, Set<String> schemes) {
        List<ContactUrn> ordered = urns.stream().sorted(BY_PRIORITY).collect(Collectors.toList());
        if (contact.isTest()) {
            return ordered.stream().findFirst();
        }
        return ordered.stream()
                .filter(u -> schemes.contains(u.getScheme()))
                .findFirst();
    }

    /**
     * Every URN of the contact on a supported scheme, highest priority first
     */
    public List<ContactUrn> selectAllUrns(Contact contact, List<ContactUrn> urns, Set<String> schemes) {
        return urns.stream()
                .sorted(BY_PRIORITY)
                .filter(u -> contact.isTest() || schemes.contains(u.getScheme()))
                .collect(Collectors.toList());
    }
}
