package com.relaycast.services.messaging.broadcast.dto;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Who a broadcast is addressed to. Raw URNs are turned into URN ids when the broadcast is created.
 */
public record RecipientSpec(Set<Long> groupIds, Set<Long> contactIds, Set<Long> urnIds, List<String> rawUrns) {

    public RecipientSpec {
        groupIds = groupIds == null ? Collections.emptySet() : new LinkedHashSet<>(groupIds);
        contactIds = contactIds == null ? Collections.emptySet() : new LinkedHashSet<>(contactIds);
        urnIds = urnIds == null ? Collections.emptySet() : new LinkedHashSet<>(urnIds);
        rawUrns = rawUrns == null ? Collections.emptyList() : List.copyOf(rawUrns);
    }

    public boolean isEmpty() {
        return groupIds.isEmpty() && contactIds.isEmpty() && urnIds.isEmpty() && rawUrns.isEmpty();
    }
}
