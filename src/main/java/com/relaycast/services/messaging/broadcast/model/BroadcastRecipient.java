package com.relaycast.services.messaging.broadcast.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * A contact that was actually sent a message of a broadcast
 */
@Data
@Entity
@Table(name = "broadcast_recipients", uniqueConstraints = {
        @UniqueConstraint(name = "uk_broadcast_recipient", columnNames = { "broadcast_id", "contact_id" })
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastRecipient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "broadcast_id", nullable = false)
    private Long broadcastId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;
}
