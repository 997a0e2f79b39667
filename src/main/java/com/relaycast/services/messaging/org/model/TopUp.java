package com.relaycast.services.messaging.org.model;

import java.time.LocalDateTime;

import jakarta.persistence.*;
import lombok.*;

/**
 * A block of message credits bought by an org. Messages record which top-up paid for them.
 */
@Entity
@Table(name = "topups", indexes = {
        @Index(name = "idx_topups_org_expires", columnList = "org_id, expires_on")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopUp {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(nullable = false)
    private Integer credits;

    @Builder.Default
    @Column(nullable = false)
    private Integer used = 0;

    @Column(name = "expires_on", nullable = false)
    private LocalDateTime expiresOn;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public int remaining() {
        return credits - used;
    }
}
