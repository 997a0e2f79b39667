package com.relaycast.services.messaging.delivery.service.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.service.impl.ChannelRegistryService;
import com.relaycast.services.messaging.contact.model.Contact;
import com.relaycast.services.messaging.contact.repository.ContactRepository;
import com.relaycast.services.messaging.delivery.dto.DeliveryBatch;
import com.relaycast.services.messaging.delivery.dto.DeliveryPriority;
import com.relaycast.services.messaging.delivery.dto.MsgTaskPayload;
import com.relaycast.services.messaging.delivery.queue.DeliveryQueue;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.service.impl.MessageStatusService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Queues outgoing messages and pushes them to the delivery worker, one batch per run of
 * consecutive messages to the same contact.
 *
 * Not transactional: messages are marked queued in their own transaction before anything is pushed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryDispatcher {

    static final int CHUNK_SIZE = 1000;

    private final ChannelRegistryService channelRegistryService;
    private final ContactRepository contactRepository;
    private final MessageStatusService messageStatusService;
    private final DeliveryQueue deliveryQueue;

    /**
     * @return number of messages pushed
     */
    public int sendMessages(List<Msg> msgs) {
        int pushed = 0;
        for (int start = 0; start < msgs.size(); start += CHUNK_SIZE) {
            List<Msg> chunk = msgs.subList(start, Math.min(start + CHUNK_SIZE, msgs.size()));
            pushed += sendChunk(chunk);
        }
        return pushed;
    }

    private int sendChunk(List<Msg> chunk) {
        Map<Long, Channel> channels = new HashMap<>();
        Set<Long> testContactIds = loadTestContactIds(chunk);

        List<Msg> eligible = new ArrayList<>();
        for (Msg msg : chunk) {
            Channel channel = msg.getChannelId() == null ? null
                    : channels.computeIfAbsent(msg.getChannelId(),
                            id -> channelRegistryService.findById(id).orElse(null));

            if (isSendable(msg, channel, testContactIds)) {
                eligible.add(msg);
            } else {
                log.debug("Not dispatching msgId={} channelId={} msgType={}", msg.getId(), msg.getChannelId(),
                        msg.getMsgType());
            }
        }

        if (eligible.isEmpty()) {
            return 0;
        }

        messageStatusService.markQueued(eligible);

        List<Msg> courier = new ArrayList<>();
        List<Msg> legacy = new ArrayList<>();
        for (Msg msg : eligible) {
            if (channelRegistryService.isCourier(channels.get(msg.getChannelId()))) {
                courier.add(msg);
            } else {
                legacy.add(msg);
            }
        }

        List<DeliveryBatch> batches = new ArrayList<>();
        batches.addAll(groupCourier(courier, channels));
        batches.addAll(groupLegacy(legacy));
        batches.forEach(deliveryQueue::push);

        log.info("Dispatched {} of {} messages in {} batches (courier={}, legacy={})",
                eligible.size(), chunk.size(), batches.size(), courier.size(), legacy.size());
        return eligible.size();
    }

    private boolean isSendable(Msg msg, Channel channel, Set<Long> testContactIds) {
        return channel != null
                && !channel.isAndroid()
                && msg.getMsgType() != MsgType.IVR
                && msg.getTopUpId() != null
                && !testContactIds.contains(msg.getContactId());
    }

    private Set<Long> loadTestContactIds(List<Msg> chunk) {
        Set<Long> contactIds = new HashSet<>();
        for (Msg msg : chunk) {
            contactIds.add(msg.getContactId());
        }
        Set<Long> testIds = new HashSet<>();
        for (Contact contact : contactRepository.findAllById(contactIds)) {
            if (contact.isTest()) {
                testIds.add(contact.getId());
            }
        }
        return testIds;
    }

    /**
     * A new courier batch starts whenever the contact or the channel changes
     */
    List<DeliveryBatch> groupCourier(List<Msg> msgs, Map<Long, Channel> channels) {
        List<DeliveryBatch> batches = new ArrayList<>();
        List<Msg> run = new ArrayList<>();
        for (Msg msg : msgs) {
            if (!run.isEmpty()) {
                Msg last = run.get(run.size() - 1);
                if (!Objects.equals(last.getContactId(), msg.getContactId())
                        || !Objects.equals(last.getChannelId(), msg.getChannelId())) {
                    batches.add(courierBatch(run, channels.get(last.getChannelId())));
                    run = new ArrayList<>();
                }
            }
            run.add(msg);
        }
        if (!run.isEmpty()) {
            batches.add(courierBatch(run, channels.get(run.get(0).getChannelId())));
        }
        return batches;
    }

    List<DeliveryBatch> groupLegacy(List<Msg> msgs) {
        List<DeliveryBatch> batches = new ArrayList<>();
        List<Msg> run = new ArrayList<>();
        for (Msg msg : msgs) {
            if (!run.isEmpty() && !Objects.equals(run.get(0).getContactId(), msg.getContactId())) {
                batches.add(legacyBatch(run));
                run = new ArrayList<>();
            }
            run.add(msg);
        }
        if (!run.isEmpty()) {
            batches.add(legacyBatch(run));
        }
        return batches;
    }

    private DeliveryBatch courierBatch(List<Msg> run, Channel channel) {
        Msg first = run.get(0);
        return DeliveryBatch.builder()
                .orgId(first.getOrgId())
                .contactId(first.getContactId())
                .channelUuid(channel.getUuid())
                .courier(true)
                .priority(first.isHighPriority() ? DeliveryPriority.HIGH : DeliveryPriority.DEFAULT)
                .msgs(payloads(run, channel.getUuid()))
                .build();
    }

    private DeliveryBatch legacyBatch(List<Msg> run) {
        Msg first = run.get(0);
        boolean anyHigh = run.stream().anyMatch(Msg::isHighPriority);
        return DeliveryBatch.builder()
                .orgId(first.getOrgId())
                .contactId(first.getContactId())
                .courier(false)
                .priority(anyHigh ? DeliveryPriority.DEFAULT : DeliveryPriority.LOW)
                .msgs(payloads(run, null))
                .build();
    }

    private List<MsgTaskPayload> payloads(List<Msg> run, String channelUuid) {
        List<MsgTaskPayload> payloads = new ArrayList<>(run.size());
        for (Msg msg : run) {
            payloads.add(MsgTaskPayload.from(msg, channelUuid));
        }
        return payloads;
    }
}
