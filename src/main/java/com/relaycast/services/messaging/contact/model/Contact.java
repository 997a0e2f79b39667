package com.relaycast.services.messaging.contact.model;

import java.time.LocalDateTime;

import jakarta.persistence.*;
import lombok.*;

@Data
@Entity
@Table(name = "contacts")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36)
    private String uuid;

    @Column(name = "org_id", nullable = false)
    private Long orgId;

    @Column(name = "name")
    private String name;

    /**
     * ISO-639-3 language code, may be null
     */
    @Column(name = "language", length = 3)
    private String language;

    @Builder.Default
    @Column(name = "is_test", nullable = false)
    private boolean test = false;

    @Builder.Default
    @Column(name = "is_blocked", nullable = false)
    private boolean blocked = false;

    @Builder.Default
    @Column(name = "is_stopped", nullable = false)
    private boolean stopped = false;

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
}
