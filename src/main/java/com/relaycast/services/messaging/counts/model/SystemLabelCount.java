package com.relaycast.services.messaging.counts.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Delta row of an org's system label count
 */
@Data
@Entity
@Table(name = "system_label_counts", indexes = {
        @Index(name = "idx_system_label_counts_org_label", columnList = "org_id, label_type")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemLabelCount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "label_type", nullable = false, length = 1)
    private String labelType;

    @Column(name = "count", nullable = false)
    private Integer count;

    @Builder.Default
    @Column(name = "is_squashed", nullable = false)
    private boolean squashed = false;
}
