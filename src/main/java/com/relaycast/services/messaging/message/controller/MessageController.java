package com.relaycast.services.messaging.message.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.relaycast.services.messaging.common.response.ResponseMessage;
import com.relaycast.services.messaging.message.model.Msg;
import com.relaycast.services.messaging.message.service.impl.MessageStatusService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageStatusService messageStatusService;

    @PostMapping("/{id}/resend")
    public ResponseEntity<ResponseMessage<ResendResult>> resend(@PathVariable Long id) {
        log.info("=== Resend Request Received === msgId={}", id);
        Msg clone = messageStatusService.resend(id);
        return ResponseEntity.ok(ResponseMessage.success("Message resent",
                new ResendResult(id, clone.getId(), clone.getStatus().getValue())));
    }

    /**
     * Response for resend endpoint
     */
    public record ResendResult(
            Long originalId,
            Long msgId,
            String status) {
    }
}
