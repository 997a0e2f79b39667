package com.relaycast.services.messaging.broadcast.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Delta row of the number of messages created for a broadcast
 */
@Data
@Entity
@Table(name = "broadcast_msg_counts", indexes = {
        @Index(name = "idx_broadcast_msg_counts_broadcast", columnList = "broadcast_id")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastMsgCount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "broadcast_id", nullable = false)
    private Long broadcastId;

    @Column(name = "count", nullable = false)
    private Integer count;

    @Builder.Default
    @Column(name = "is_squashed", nullable = false)
    private boolean squashed = false;
}
