package com.relaycast.services.messaging.broadcast.dto;

import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class BroadcastRequest {

    @NotNull(message = "Org id is required")
    private Long orgId;

    private Long userId;

    @NotEmpty(message = "Text translations cannot be empty")
    private Map<String, String> text;

    @NotBlank(message = "Base language is required")
    private String baseLanguage;

    private Map<String, String> media;

    private List<Map<String, String>> quickReplies;

    private Set<Long> groupIds;
    private Set<Long> contactIds;
    private Set<Long> urnIds;
    private List<String> urns; // raw scheme:path strings

    private Long channelId;
    private boolean sendAll;
    private boolean scheduled;

    public RecipientSpec toRecipientSpec() {
        return new RecipientSpec(groupIds, contactIds, urnIds, urns);
    }
}
