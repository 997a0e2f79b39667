package com.relaycast.services.messaging.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "message")
@Data
@Validated
public class MessageProperties {

    @Positive
    private int maxTextLength = 640;

    /**
     * Base URL (host and optional path) that relative media paths are served from
     */
    private String mediaBaseUrl = "localhost";

    private final SpamGuard spamGuard = new SpamGuard();
    private final Retry retry = new Retry();

    @Data
    public static class SpamGuard {
        @Positive
        private int threshold = 10;
        @NotNull
        private Duration window = Duration.ofMinutes(10);
        @NotNull
        private Duration shortCodeWindow = Duration.ofHours(24);
        /**
         * Phone paths shorter than this are treated as short codes
         */
        @Positive
        private int shortCodeMaxLength = 6;
    }

    @Data
    public static class Retry {
        /**
         * Errors after which a message is failed
         */
        @Positive
        private int maxErrors = 3;
        @NotNull
        private Duration backoff = Duration.ofMinutes(5);
        @NotNull
        private Duration failAfter = Duration.ofDays(7);
        @Positive
        private int pollSize = 1000;
    }
}
