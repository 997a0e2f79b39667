package com.relaycast.services.messaging.message.service.impl;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.broadcast.model.BroadcastMsgCount;
import com.relaycast.services.messaging.broadcast.repository.BroadcastMsgCountRepository;
import com.relaycast.services.messaging.broadcast.repository.BroadcastRecipientRepository;
import com.relaycast.services.messaging.broadcast.repository.BroadcastRepository;
import com.relaycast.services.messaging.broadcast.service.impl.BroadcastCompletionTracker;
import com.relaycast.services.messaging.broadcast.service.impl.TranslationResolver;
import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.dto.Recipient;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.contact.service.impl.UrnResolverService;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.delivery.event.MessagesCreatedEvent;
import com.relaycast.services.messaging.exception.InvalidRequestException;
import com.relaycast.services.messaging.exception.ResourceNotFoundException;
import com.relaycast.services.messaging.exception.UnreachableException;
import com.relaycast.services.messaging.message.dto.BatchSendRequest;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.org.model.Org;
import com.relaycast.services.messaging.org.repository.OrgRepository;
import com.relaycast.services.messaging.org.service.impl.CreditService;
import com.relaycast.services.messaging.template.TemplateEvaluator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the outgoing messages of one broadcast batch.
 *
 * Each recipient gets its own translation and evaluated text. Loops are dropped, then one credit is taken per
 * message. All rows of the batch are inserted together, and either the whole batch is created or none of it is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageMaterializer {

    public static final String QUICK_REPLIES = "quick_replies";

    private final BroadcastRepository broadcastRepository;
    private final BroadcastRecipientRepository broadcastRecipientRepository;
    private final BroadcastMsgCountRepository broadcastMsgCountRepository;
    private final OrgRepository orgRepository;
    private final ContactRepository contactRepository;
    private final ContactUrnRepository contactUrnRepository;
    private final MsgRepository msgRepository;
    private final UrnResolverService urnResolverService;
    private final ChannelRegistryService channelRegistryService;
    private final TranslationResolver translationResolver;
    private final TemplateEvaluator templateEvaluator;
    private final SpamGuard spamGuard;
    private final CreditService creditService;
    private final SystemLabelCounter systemLabelCounter;
    private final BroadcastCompletionTracker completionTracker;
    private final MessageProperties messageProperties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return ids of the messages created, possibly fewer than the recipients requested
     */
    @Transactional
    public List<Long> sendBatch(BatchSendRequest request) {
        if ((request.getUrnIds() == null) == (request.getContactIds() == null)) {
            throw new InvalidRequestException("Batch must have exactly one of urnIds and contactIds");
        }

        long startTime = System.currentTimeMillis();

        Broadcast broadcast = broadcastRepository.findById(request.getBroadcastId())
                .orElseThrow(() -> new ResourceNotFoundException("Broadcast", request.getBroadcastId()));
        Org org = orgRepository.findById(broadcast.getOrgId())
                .orElseThrow(() -> new ResourceNotFoundException("Org", broadcast.getOrgId()));

        Channel channelOverride = broadcast.getChannelId() == null ? null
                : channelRegistryService.findById(broadcast.getChannelId()).orElse(null);

        Msg responseTo = request.getResponseToId() == null ? null
                : msgRepository.findById(request.getResponseToId()).orElse(null);
        // incoming messages not yet handled have no type
        MsgType msgType = responseTo != null && responseTo.getMsgType() != null
                ? responseTo.getMsgType() : request.getMsgType();
        ChannelRole role = msgType.requiredRole();

        List<ResolvedRecipient> recipients = request.getUrnIds() != null
                ? resolveUrns(org, channelOverride, role, request.getUrnIds())
                : resolveContacts(org, broadcast, channelOverride, role, request.getContactIds());

        LocalDateTime createdOn = LocalDateTime.now();
        List<Msg> batch = new ArrayList<>();
        Set<Long> sentContactIds = new LinkedHashSet<>();
        int dropped = 0;

        for (ResolvedRecipient recipient : recipients) {
            Msg msg = buildMessage(broadcast, org, recipient, channelOverride, role, msgType, responseTo, request,
                    createdOn);
            if (msg == null) {
                dropped++;
                continue;
            }
            batch.add(msg);
            sentContactIds.add(msg.getContactId());
        }

        List<Msg> created = batch.isEmpty() ? List.of() : msgRepository.saveAll(batch);
        broadcastRecipientRepository.recordAll(broadcast.getId(), sentContactIds);
        if (!created.isEmpty()) {
            broadcastMsgCountRepository.save(BroadcastMsgCount.builder()
                    .broadcastId(broadcast.getId())
                    .count(created.size())
                    .build());
            systemLabelCounter.recordCreated(created);
        }

        completionTracker.recordBatched(broadcast.getId(), request.size(), broadcast.getRecipientCount());

        List<Long> msgIds = created.stream().map(Msg::getId).collect(Collectors.toList());
        if (request.isTriggerSend() && !msgIds.isEmpty()) {
            eventPublisher.publishEvent(new MessagesCreatedEvent(broadcast.getId(), msgIds));
        }

        log.info("Batch materialized. broadcastId={} requested={} resolved={} created={} dropped={} in {}ms",
                broadcast.getId(), request.size(), recipients.size(), msgIds.size(), dropped,
                System.currentTimeMillis() - startTime);

        return msgIds;
    }

    /**
     * URNs are loaded with their contacts in two queries. URNs on schemes no channel can send to are skipped.
     */
    private List<ResolvedRecipient> resolveUrns(Org org, Channel channelOverride, ChannelRole role,
            List<Long> urnIds) {
        Set<String> schemes = urnResolverService.resolveSchemes(org.getId(), channelOverride, role);

        Map<Long, ContactUrn> urns = contactUrnRepository.findByOrgIdAndIdIn(org.getId(), urnIds).stream()
                .collect(Collectors.toMap(ContactUrn::getId, Function.identity()));
        Set<Long> contactIds = urns.values().stream()
                .map(ContactUrn::getContactId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        Map<Long, Contact> contacts = contactIds.isEmpty() ? Map.of()
                : contactRepository.findByOrgIdAndIdIn(org.getId(), contactIds).stream()
                        .collect(Collectors.toMap(Contact::getId, Function.identity()));

        List<ResolvedRecipient> resolved = new ArrayList<>(urnIds.size());
        for (Long urnId : new LinkedHashSet<>(urnIds)) {
            ContactUrn urn = urns.get(urnId);
            Contact contact = urn == null || urn.getContactId() == null ? null : contacts.get(urn.getContactId());
            if (contact == null) {
                log.debug("Skipping urnId={}, no owning contact", urnId);
                continue;
            }
            if (!contact.isTest() && !schemes.contains(urn.getScheme())) {
                log.debug("Skipping urnId={}, scheme {} not sendable", urnId, urn.getScheme());
                continue;
            }
            resolved.add(new ResolvedRecipient(contact, urn));
        }
        return resolved;
    }

    private List<ResolvedRecipient> resolveContacts(Org org, Broadcast broadcast, Channel channelOverride,
            ChannelRole role, List<Long> contactIds) {
        Map<Long, Contact> contacts = contactRepository.findByOrgIdAndIdIn(org.getId(), contactIds).stream()
                .collect(Collectors.toMap(Contact::getId, Function.identity()));

        List<ResolvedRecipient> resolved = new ArrayList<>(contactIds.size());
        for (Long contactId : new LinkedHashSet<>(contactIds)) {
            Contact contact = contacts.get(contactId);
            if (contact == null) {
                continue;
            }
            try {
                resolved.add(urnResolverService.resolveRecipient(org, broadcast.getCreatedBy(),
                        Recipient.of(contact), channelOverride, role));
            } catch (UnreachableException e) {
                log.debug("Skipping contact {}: {}", contact.getId(), e.getMessage());
            }
        }
        return resolved;
    }

    /**
     * Builds one unsaved message, or returns null when the recipient can't be sent to or the message would loop.
     */
    private Msg buildMessage(Broadcast broadcast, Org org, ResolvedRecipient recipient, Channel channelOverride,
            ChannelRole role, MsgType msgType, Msg responseTo, BatchSendRequest request, LocalDateTime createdOn) {
        Contact contact = recipient.contact();
        ContactUrn urn = recipient.urn();

        Channel channel = channelOverride != null ? channelOverride
                : channelRegistryService.getSendChannel(org.getId(), role, urn).orElse(null);
        if (channel == null && !contact.isTest()) {
            log.debug("No channel can send to urnId={}, skipping", urn.getId());
            return null;
        }

        List<String> languages = translationResolver.preferredLanguages(contact, org, broadcast.getBaseLanguage());
        String text = translationResolver.localize(broadcast.getText(), languages);
        if (text == null) {
            text = broadcast.getText().get(broadcast.getBaseLanguage());
        }
        String media = translationResolver.qualifyMedia(translationResolver.localize(broadcast.getMedia(), languages));
        List<String> quickReplies = translationResolver.localizeQuickReplies(broadcast.getQuickReplies(), languages);

        if (request.getTemplateContext() != null) {
            Map<String, Object> context = new HashMap<>(request.getTemplateContext());
            context.putIfAbsent("contact", contactContext(contact, urn));
            if (channel != null) {
                context.putIfAbsent("channel", channelContext(channel));
            }

            text = templateEvaluator.evaluate(text, context).text();
            if (media != null) {
                media = templateEvaluator.evaluate(media, context).text();
            }
            List<String> evaluatedReplies = new ArrayList<>(quickReplies.size());
            for (String reply : quickReplies) {
                evaluatedReplies.add(templateEvaluator.evaluate(reply, context).text());
            }
            quickReplies = evaluatedReplies;
        }

        text = truncate(text).strip();
        List<String> attachments = media == null ? null : List.of(media);

        if (spamGuard.isLoop(urn, channel, text, attachments, createdOn)) {
            return null;
        }

        Long topUpId = null;
        if (!contact.isTest()) {
            topUpId = creditService.decrementCredit(org.getId()).topUpId();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (!quickReplies.isEmpty()) {
            metadata.put(QUICK_REPLIES, quickReplies);
        }

        return Msg.builder()
                .uuid(UUID.randomUUID().toString())
                .orgId(org.getId())
                .channelId(channel == null ? null : channel.getId())
                .contactId(contact.getId())
                .contactUrnId(urn.getId())
                .broadcastId(broadcast.getId())
                .text(text)
                .attachments(attachments)
                .direction(Direction.OUTGOING)
                .status(request.getStatus())
                .msgType(msgType)
                .highPriority(request.isHighPriority())
                .metadata(metadata)
                .responseToId(responseTo == null ? null : responseTo.getId())
                .topUpId(topUpId)
                .createdOn(createdOn)
                .build();
    }

    private String truncate(String text) {
        int max = messageProperties.getMaxTextLength();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private Map<String, Object> contactContext(Contact contact, ContactUrn urn) {
        Map<String, Object> context = new HashMap<>();
        String display = contact.getName() != null ? contact.getName() : urn.getPath();
        context.put("__default__", display);
        context.put("name", contact.getName() == null ? "" : contact.getName());
        context.put("first_name", firstName(contact.getName()));
        context.put("uuid", contact.getUuid());
        context.put("language", contact.getLanguage() == null ? "" : contact.getLanguage());
        context.put(urn.getScheme(), urn.getPath());
        return context;
    }

    private Map<String, Object> channelContext(Channel channel) {
        Map<String, Object> context = new HashMap<>();
        context.put("__default__", channel.getAddress() == null ? "" : channel.getAddress());
        context.put("name", channel.getName() == null ? "" : channel.getName());
        context.put("address", channel.getAddress() == null ? "" : channel.getAddress());
        return context;
    }

    private String firstName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return name.trim().split("\\s+")[0];
    }
}
