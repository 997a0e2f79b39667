package com.relaycast.services.messaging.channel.model;

import java.time.LocalDateTime;
import java.util.List;

import com.relaycast.services.messaging.channel.enums.ChannelRole;
import com.relaycast.services.messaging.common.converter.StringListConverter;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "channels", indexes = {
        @Index(name = "idx_channels_org_active", columnList = "org_id, is_active")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Channel {

    public static final String TYPE_ANDROID = "A";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String uuid;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "channel_type", nullable = false, length = 3)
    private String channelType;

    @Column(name = "name")
    private String name;

    @Column(name = "address")
    private String address;

    @Convert(converter = StringListConverter.class)
    @Column(name = "schemes", columnDefinition = "TEXT")
    private List<String> schemes;

    /**
     * Role codes, e.g. "SR" for send and receive
     */
    @Column(name = "role", nullable = false, length = 4)
    private String role;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_on", nullable = false, updatable = false)
    private LocalDateTime createdOn;

    @PrePersist
    protected void onCreate() {
        if (createdOn == null) {
            createdOn = LocalDateTime.now();
        }
    }

    public boolean hasRole(ChannelRole channelRole) {
        return role != null && role.indexOf(channelRole.getCode()) >= 0;
    }

    public boolean supportsScheme(String scheme) {
        return schemes != null && schemes.contains(scheme);
    }

    public boolean isAndroid() {
        return TYPE_ANDROID.equals(channelType);
    }
}
