package com.relaycast.services.messaging.contact.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * A channel address owned by a contact, e.g. tel:+250788123123. Higher priority URNs are preferred for sending.
 */
@Data
@Entity
@Table(name = "contact_urns", uniqueConstraints = {
        @UniqueConstraint(name = "uk_contact_urns_org_identity", columnNames = { "org_id", "identity" })
}, indexes = {
        @Index(name = "idx_contact_urns_contact", columnList = "contact_id, priority")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactUrn {

    public static final int PRIORITY_DEFAULT = 50;
    public static final int PRIORITY_HIGHEST = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "contact_id")
    private Long contactId;

    @Column(name = "scheme", nullable = false, length = 128)
    private String scheme;

    @Column(name = "path", nullable = false)
    private String path;

    @Column(name = "display")
    private String display;

    @Column(name = "identity", nullable = false)
    private String identity;

    @Builder.Default
    @Column(name = "priority", nullable = false)
    private Integer priority = PRIORITY_DEFAULT;

    /**
     * Channel this URN last talked to, preferred when sending
     */
    @Column(name = "channel_id")
    private Long channelId;
}
