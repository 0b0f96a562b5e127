package com.example.messaging.chat.controller;

import com.example.messaging.chat.backend.BackendFaultInjector;
import com.example.messaging.chat.backend.InMemoryMessagingBackend;
import com.example.messaging.chat.dto.RemoteMessageRequest;
import com.example.messaging.shared.model.Message;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Manual-testing hooks into the in-memory backend.
 */
@RestController
@RequestMapping("/api/chat/testing")
@RequiredArgsConstructor
@Slf4j
public class TestingController {

    private final BackendFaultInjector faultInjector;
    private final InMemoryMessagingBackend inMemoryBackend;

    @PostMapping("/offline")
    public ResponseEntity<Void> setOffline(@RequestBody Map<String, Boolean> request) {
        boolean enabled = request.getOrDefault("enabled", false);
        faultInjector.setOffline(enabled);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/offline")
    public ResponseEntity<Map<String, Boolean>> getOffline() {
        return ResponseEntity.ok(Map.of("enabled", faultInjector.isOffline()));
    }

    @PostMapping("/stall-uploads")
    public ResponseEntity<Void> setUploadsStalled(@RequestBody Map<String, Boolean> request) {
        boolean enabled = request.getOrDefault("enabled", false);
        faultInjector.setUploadsStalled(enabled);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/conversations/{conversationId}/fail")
    public ResponseEntity<Void> failConversation(@PathVariable String conversationId) {
        faultInjector.failConversation(conversationId);
        log.warn("Backend calls for conversation {} will fail", conversationId);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/conversations/{conversationId}/fail")
    public ResponseEntity<Void> restoreConversation(@PathVariable String conversationId) {
        faultInjector.restoreConversation(conversationId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        faultInjector.reset();
        log.info("All backend fault simulations cleared");
        return ResponseEntity.ok().build();
    }

    @PostMapping("/conversations/{conversationId}/remote-messages")
    public ResponseEntity<Message> injectRemoteMessage(
            @PathVariable String conversationId,
            @Valid @RequestBody RemoteMessageRequest request) {
        log.info("Injecting remote message from {} into {}", request.getAuthorId(), conversationId);
        return ResponseEntity.ok(inMemoryBackend.injectRemoteMessage(conversationId, request.getAuthorId(), request.getText()));
    }
}
