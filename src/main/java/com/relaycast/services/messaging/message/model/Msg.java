package com.relaycast.services.messaging.message.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import com.relaycast.services.messaging.common.converter.MessageStatusConverter;
import com.relaycast.services.messaging.common.converter.StringListConverter;
import com.relaycast.services.messaging.message.enums.Direction;
import com.relaycast.services.messaging.message.enums.MessageStatus;
import com.relaycast.services.messaging.message.enums.MsgType;
import com.relaycast.services.messaging.message.enums.Visibility;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "msgs", indexes = {
        @Index(name = "idx_msgs_broadcast", columnList = "broadcast_id"),
        @Index(name = "idx_msgs_urn_created", columnList = "contact_urn_id, created_on"),
        @Index(name = "idx_msgs_status_next_attempt", columnList = "status, next_attempt"),
        @Index(name = "idx_msgs_org_direction_status", columnList = "org_id, direction, status")
})
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Msg {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36)
    private String uuid;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "channel_id")
    private Long channelId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    @Column(name = "contact_urn_id")
    private Long contactUrnId;

    @Column(name = "broadcast_id")
    private Long broadcastId;

    @Column(name = "text", columnDefinition = "TEXT")
    private String text;

    /**
     * content_type:url entries, null when there are none
     */
    @Convert(converter = StringListConverter.class)
    @Column(name = "attachments", columnDefinition = "TEXT")
    private List<String> attachments;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private Direction direction;

    @Builder.Default
    @Convert(converter = MessageStatusConverter.class)
    @Column(name = "status", nullable = false, length = 1)
    private MessageStatus status = MessageStatus.PENDING;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false, length = 10)
    private Visibility visibility = Visibility.VISIBLE;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "msg_type", length = 10)
    private MsgType msgType = MsgType.INBOX;

    @Builder.Default
    @Column(name = "error_count", nullable = false)
    private Integer errorCount = 0;

    @Column(name = "next_attempt")
    private LocalDateTime nextAttempt;

    @Column(name = "external_id")
    private String externalId;

    @Builder.Default
    @Column(name = "high_priority", nullable = false)
    private boolean highPriority = false;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "JSON")
    private Map<String, Object> metadata;

    @Column(name = "response_to_id")
    private Long responseToId;

    @Column(name = "topup_id")
    private Long topUpId;

    @Column(name = "created_on", nullable = false, updatable = false)
    private LocalDateTime createdOn;

    @Column(name = "modified_on", nullable = false)
    private LocalDateTime modifiedOn;

    @Column(name = "queued_on")
    private LocalDateTime queuedOn;

    @Column(name = "sent_on")
    private LocalDateTime sentOn;

    @PrePersist
    protected void onCreate() {
        if (createdOn == null) {
            createdOn = LocalDateTime.now();
        }
        modifiedOn = createdOn;
    }

    @PreUpdate
    protected void onUpdate() {
        modifiedOn = LocalDateTime.now();
    }

    public boolean isOutgoing() {
        return direction == Direction.OUTGOING;
    }
}
