package com.relaycast.services.messaging.delivery.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.relaycast.services.messaging.message.model.Msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the delivery worker needs to send one message
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MsgTaskPayload {
    private Long id;
    private String uuid;
    private Long orgId;
    private Long channelId;
    private String channelUuid;
    private Long contactId;
    private Long contactUrnId;
    private String text;
    private List<String> attachments;
    private Map<String, Object> metadata;
    private boolean highPriority;
    private Integer errorCount;
    private Long responseToId;
    private LocalDateTime createdOn;

    public static MsgTaskPayload from(Msg msg, String channelUuid) {
        return MsgTaskPayload.builder()
                .id(msg.getId())
                .uuid(msg.getUuid())
                .orgId(msg.getOrgId())
                .channelId(msg.getChannelId())
                .channelUuid(channelUuid)
                .contactId(msg.getContactId())
                .contactUrnId(msg.getContactUrnId())
                .text(msg.getText())
                .attachments(msg.getAttachments())
                .metadata(msg.getMetadata())
                .highPriority(msg.isHighPriority())
                .errorCount(msg.getErrorCount())
                .responseToId(msg.getResponseToId())
                .createdOn(msg.getCreatedOn())
                .build();
    }
}
