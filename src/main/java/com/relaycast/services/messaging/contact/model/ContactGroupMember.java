package com.relaycast.services.messaging.contact.model;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "contact_group_members", uniqueConstraints = {
        @UniqueConstraint(name = "uk_group_member", columnNames = { "group_id", "contact_id" })
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactGroupMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private Long groupId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;
}
