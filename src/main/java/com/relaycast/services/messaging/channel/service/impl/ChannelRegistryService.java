package com.relaycast.services.messaging.channel.service.impl;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.channel.model.Channel;
import com.relaycast.services.messaging.channel.repository.ChannelRepository;
import com.relaycast.services.messaging.contact.model.ContactUrn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Looks up which channels an org can use for a role, and which channel should carry a message to a URN.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelRegistryService {

    private final ChannelRepository channelRepository;

    @Value("${delivery.courier-channel-types:T,TG,FB,WA,EX}")
    private String courierChannelTypes;

    public List<Channel> getActiveChannels(Long orgId, ChannelRole role) {
        return channelRepository.findByOrgIdAndActiveTrueOrderByCreatedOnDescIdDesc(orgId).stream()
                .filter(c -> c.hasRole(role))
                .collect(Collectors.toList());
    }

    /**
     * Union of URN schemes over the org's active channels having the role
     */
    public Set<String> getSchemes(Long orgId, ChannelRole role) {
        Set<String> schemes = new LinkedHashSet<>();
        for (Channel channel : getActiveChannels(orgId, role)) {
            if (channel.getSchemes() != null) {
                schemes.addAll(channel.getSchemes());
            }
        }
        return schemes;
    }

    /**
     * Picks the channel to send to a URN on: the URN's own channel if it is still usable,
     * otherwise the newest active channel with the role that supports the URN scheme.
     */
    public Optional<Channel> getSendChannel(Long orgId, ChannelRole role, ContactUrn urn) {
        List<Channel> channels = getActiveChannels(orgId, role);

        if (urn.getChannelId() != null) {
            Optional<Channel> affinity = channels.stream()
                    .filter(c -> c.getId().equals(urn.getChannelId()))
                    .filter(c -> c.supportsScheme(urn.getScheme()))
                    .findFirst();
            if (affinity.isPresent()) {
                return affinity;
            }
        }

        Optional<Channel> channel = channels.stream()
                .filter(c -> c.supportsScheme(urn.getScheme()))
                .findFirst();

        if (channel.isEmpty()) {
            log.debug("No {} channel for scheme={} orgId={}", role, urn.getScheme(), orgId);
        }
        return channel;
    }

    public Optional<Channel> findById(Long channelId) {
        return channelRepository.findById(channelId);
    }

    /**
     * Push-style channels are handed to the courier, everything else is polled
     */
    public boolean isCourier(Channel channel) {
        if (channel == null || channel.isAndroid()) {
            return false;
        }
        return Arrays.stream(courierChannelTypes.split(","))
                .map(String::trim)
                .anyMatch(t -> t.equals(channel.getChannelType()));
    }
}
