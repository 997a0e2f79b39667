package com.relaycast.services.messaging.message.service.impl;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.config.MessageProperties;
import com.relaycast.services.messaging.contact.dto.ResolvedRecipient;
import com.relaycast.services.messaging.contact.dto.Urn;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.model.ContactUrn;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.contact.repository.ContactUrnRepository;
import com.relaycast.services.messaging.contact.service.impl.ContactService;
import com.relaycast.services.messaging.counts.service.impl.SystemLabelCounter;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.handler.MessageHandlerChain;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.repository.MsgRepository;
import com.relaycast.services.messaging.org.service.impl.CreditService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records messages received on a channel and hands them to the handler chain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncomingMessageService {

    private final ContactService contactService;
    private final ContactRepository contactRepository;
    private final ContactUrnRepository contactUrnRepository;
    private final MsgRepository msgRepository;
    private final CreditService creditService;
    private final SystemLabelCounter systemLabelCounter;
    private final MessageHandlerChain messageHandlerChain;
    private final MessageProperties messageProperties;

    @Transactional
    public Msg createIncoming(Channel channel, Urn urn, String text, LocalDateTime sentOn, String externalId,
            List<String> attachments) {
        return createIncoming(channel, urn, text, sentOn, externalId, attachments, MessageStatus.PENDING, null);
    }

    /**
     * Creates an incoming message. A message with the same text, sent time and contact as an existing one
     * is a redelivery and returns the existing message.
     */
    @Transactional
    public Msg createIncoming(Channel channel, Urn urn, String text, LocalDateTime sentOn, String externalId,
            List<String> attachments, MessageStatus status, MsgType msgType) {
        LocalDateTime now = LocalDateTime.now();
        if (sentOn == null) {
            sentOn = now;
        }

        ResolvedRecipient recipient = contactService.getOrCreateByUrn(channel.getOrgId(), null, urn.normalize(),
                channel.getId());
        Contact contact = recipient.contact();
        ContactUrn contactUrn = recipient.urn();

        if (!channel.getId().equals(contactUrn.getChannelId())) {
            contactUrn.setChannelId(channel.getId());
            contactUrnRepository.save(contactUrn);
        }

        String body = truncate(text == null ? "" : text);

        Optional<Msg> existing = msgRepository.findFirstByOrgIdAndContactIdAndDirectionAndTextAndSentOn(
                channel.getOrgId(), contact.getId(), Direction.INCOMING, body, sentOn);
        if (existing.isPresent()) {
            log.info("Duplicate incoming message ignored. existingId={} contactId={}", existing.get().getId(),
                    contact.getId());
            return existing.get();
        }

        Long topUpId = contact.isTest() ? null : creditService.decrementCredit(channel.getOrgId()).topUpId();

        Msg msg = msgRepository.save(Msg.builder()
                .uuid(UUID.randomUUID().toString())
                .orgId(channel.getOrgId())
                .channelId(channel.getId())
                .contactId(contact.getId())
                .contactUrnId(contactUrn.getId())
                .text(body)
                .attachments(attachments)
                .direction(Direction.INCOMING)
                .status(status)
                .msgType(msgType)
                .externalId(externalId)
                .topUpId(topUpId)
                .createdOn(now)
                .queuedOn(now)
                .sentOn(sentOn)
                .build());
        systemLabelCounter.recordCreated(List.of(msg));

        if (contact.isStopped()) {
            contact.setStopped(false);
            contactRepository.save(contact);
            log.info("Contact unstopped by incoming message. contactId={}", contact.getId());
        }

        log.info("Incoming message created. msgId={} channelId={} contactId={}", msg.getId(), channel.getId(),
                contact.getId());

        if (status == MessageStatus.PENDING && msgType != MsgType.IVR) {
            messageHandlerChain.process(msg, contact);
        }
        return msg;
    }

    private String truncate(String text) {
        int max = messageProperties.getMaxTextLength();
        return text.length() > max ? text.substring(0, max) : text;
    }
}
