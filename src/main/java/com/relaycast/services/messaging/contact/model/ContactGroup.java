package com.relaycast.services.messaging.contact.model;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "contact_groups")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "name", nullable = false)
    private String name;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
