package com.relaycast.services.messaging.broadcast.kafka.event;

import java.util.List;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chunk of a broadcast's recipients, materialized by whichever consumer picks it up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastBatchEvent {
    private String eventId;

    private Long broadcastId;

    private Long orgId;

    private Integer batchIndex;

    private Integer totalBatches;

    private List<Long> urnIds; // contact URN ids, in send order

    private Boolean highPriority;

    private Long timestamp;

    public static BroadcastBatchEvent createForBatch(
            Long broadcastId,
            Long orgId,
            int batchIndex,
            int totalBatches,
            List<Long> urnIds,
            boolean highPriority) {

        return BroadcastBatchEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .broadcastId(broadcastId)
                .orgId(orgId)
                .batchIndex(batchIndex)
                .totalBatches(totalBatches)
                .urnIds(urnIds)
                .highPriority(highPriority)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
