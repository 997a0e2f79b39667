package com.relaycast.services.messaging.contact.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Delta row of a group's member count. The member count is the sum over all rows of the group.
 */
@Data
@Entity
@Table(name = "contact_group_counts", indexes = {
        @Index(name = "idx_group_counts_group", columnList = "group_id")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactGroupCount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private Long groupId;

    @Column(name = "count", nullable = false)
    private Integer count;

    @Builder.Default
    @Column(name = "is_squashed", nullable = false)
    private boolean squashed = false;
}
