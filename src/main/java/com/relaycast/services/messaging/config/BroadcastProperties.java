package com.relaycast.services.messaging.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "broadcast")
@Data
@Validated
public class BroadcastProperties {

    /**
     * Recipients per batch. Sends at or under this size are materialized inline.
     */
    @Positive
    private int batchSize = 500;

    private final LoopGuard loopGuard = new LoopGuard();
    private final Completion completion = new Completion();

    @Data
    public static class LoopGuard {
        /**
         * Groups with more members than this are checked for repeat sends
         */
        @Positive
        private int minGroupSize = 30;
        @NotNull
        private Duration ttl = Duration.ofHours(4);
        @NotNull
        private String keyPrefix = "broadcast:loop:";
    }

    @Data
    public static class Completion {
        @NotNull
        private Duration ttl = Duration.ofHours(1);
        @NotNull
        private String keyPrefix = "broadcast:batched:";
    }
}
