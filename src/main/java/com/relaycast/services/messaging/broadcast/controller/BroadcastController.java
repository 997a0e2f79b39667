package com.relaycast.services.messaging.broadcast.controller;

import java.util.Collection;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.relaycast.services.messaging.broadcast.dto.BroadcastRequest;
import com.relaycast.services.messaging.broadcast.dto.BroadcastResponse;
import com.relaycast.services.messaging.broadcast.model.Broadcast;
import com.relaycast.services.messaging.broadcast.service.impl.BroadcastServiceImpl;
import com.relaycast.services.messaging.common.response.ResponseMessage;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST Controller for broadcast operations.
 * Errors are mapped to responses by the global exception handler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/broadcasts")
@RequiredArgsConstructor
public class BroadcastController {

    private final BroadcastServiceImpl broadcastService;

    /**
     * Creates a broadcast and, unless it is scheduled, sends it.
     */
    @PostMapping
    public ResponseEntity<ResponseMessage<BroadcastResponse>> createBroadcast(
            @Valid @RequestBody BroadcastRequest request) {

        log.info("=== Broadcast Request Received ===");
        log.info("orgId={} groups={} contacts={} urns={} scheduled={}", request.getOrgId(),
                sizeOf(request.getGroupIds()), sizeOf(request.getContactIds()),
                sizeOf(request.getUrnIds()) + sizeOf(request.getUrns()), request.isScheduled());

        Broadcast broadcast = broadcastService.create(request);
        if (!broadcast.isScheduled()) {
            broadcast = broadcastService.send(broadcast.getId());
        }

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResponseMessage.success(
                        broadcast.isScheduled() ? "Broadcast scheduled" : "Broadcast queued",
                        toResponse(broadcast)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResponseMessage<BroadcastResponse>> getBroadcast(@PathVariable Long id) {
        return ResponseEntity.ok(ResponseMessage.success("Broadcast found", toResponse(broadcastService.getBroadcast(id))));
    }

    @PostMapping("/{id}/fire")
    public ResponseEntity<ResponseMessage<BroadcastResponse>> fireBroadcast(@PathVariable Long id) {
        log.info("=== Fire Request Received === scheduledBroadcastId={}", id);
        Broadcast fired = broadcastService.fire(id);
        return ResponseEntity.ok(ResponseMessage.success("Scheduled broadcast fired", toResponse(fired)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ResponseMessage<Void>> releaseBroadcast(@PathVariable Long id) {
        log.info("=== Release Request Received === broadcastId={}", id);
        broadcastService.release(id);
        return ResponseEntity.ok(ResponseMessage.success("Broadcast released", null));
    }

    private BroadcastResponse toResponse(Broadcast broadcast) {
        return BroadcastResponse.from(broadcast, broadcastService.getMessageCount(broadcast.getId()));
    }

    private static int sizeOf(Collection<?> values) {
        return values == null ? 0 : values.size();
    }
}
