package com.relaycast.services.messaging.message.dto;

import java.util.List;
import java.util.Map;

import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One batch of a broadcast to materialize. Exactly one of urnIds and contactIds is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSendRequest {
    private Long broadcastId;

    private List<Long> urnIds;

    private List<Long> contactIds;

    @Builder.Default
    private boolean triggerSend = true;

    /**
     * Expression context, or null to send the text as written
     */
    private Map<String, Object> templateContext;

    private Long responseToId;

    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    @Builder.Default
    private MsgType msgType = MsgType.INBOX;

    private boolean highPriority;

    public int size() {
        if (urnIds != null) {
            return urnIds.size();
        }
        return contactIds == null ? 0 : contactIds.size();
    }
}
