package com.relaycast.services.messaging.broadcast.model;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import com.relaycast.services.messaging.common.converter.MessageStatusConverter;
import com.relaycast.services.messaging.message.enums.MessageStatus;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "broadcasts", indexes = {
        @Index(name = "idx_broadcasts_org_status", columnList = "org_id, status")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Broadcast {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    /**
     * Language code to translated text. Always holds baseLanguage.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "text", columnDefinition = "JSON", nullable = false)
    private Map<String, String> text;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media", columnDefinition = "JSON")
    private Map<String, String> media;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "quick_replies", columnDefinition = "JSON")
    private List<Map<String, String>> quickReplies;

    @Column(name = "base_language", nullable = false, length = 4)
    private String baseLanguage;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "broadcast_groups", joinColumns = @JoinColumn(name = "broadcast_id"))
    @Column(name = "group_id")
    private Set<Long> groupIds = new LinkedHashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "broadcast_contacts", joinColumns = @JoinColumn(name = "broadcast_id"))
    @Column(name = "contact_id")
    private Set<Long> contactIds = new LinkedHashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "broadcast_urns", joinColumns = @JoinColumn(name = "broadcast_id"))
    @Column(name = "contact_urn_id")
    private Set<Long> urnIds = new LinkedHashSet<>();

    @Builder.Default
    @Column(name = "recipient_count", nullable = false)
    private Integer recipientCount = 0;

    @Builder.Default
    @Convert(converter = MessageStatusConverter.class)
    @Column(name = "status", nullable = false, length = 1)
    private MessageStatus status = MessageStatus.INITIALIZING;

    @Column(name = "channel_id")
    private Long channelId;

    @Column(name = "parent_id")
    private Long parentId;

    @Builder.Default
    @Column(name = "send_all", nullable = false)
    private boolean sendAll = false;

    @Builder.Default
    @Column(name = "is_scheduled", nullable = false)
    private boolean scheduled = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_on", nullable = false, updatable = false)
    private LocalDateTime createdOn;

    @Column(name = "modified_on", nullable = false)
    private LocalDateTime modifiedOn;

    @PrePersist
    protected void onCreate() {
        createdOn = LocalDateTime.now();
        modifiedOn = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        modifiedOn = LocalDateTime.now();
    }

    public boolean hasRecipients() {
        return !groupIds.isEmpty() || !contactIds.isEmpty() || !urnIds.isEmpty();
    }
}
