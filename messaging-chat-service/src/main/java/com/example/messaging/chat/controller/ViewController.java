package com.example.messaging.chat.controller;

import com.example.messaging.chat.dto.SelectConversationRequest;
import com.example.messaging.chat.dto.ViewportRequest;
import com.example.messaging.chat.service.ConversationStore;
import com.example.messaging.chat.service.ViewCoordinator;
import com.example.messaging.shared.dto.ViewState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/chat/view")
@RequiredArgsConstructor
@Slf4j
public class ViewController {

    private final ViewCoordinator viewCoordinator;
    private final ConversationStore conversationStore;

    @GetMapping
    public ResponseEntity<ViewState> currentState() {
        return ResponseEntity.ok(viewCoordinator.currentState());
    }

    /**
     * Selecting a conversation also marks it read.
     */
    @PostMapping("/select")
    public ResponseEntity<ViewState> selectConversation(@Valid @RequestBody SelectConversationRequest request) {
        conversationStore.markConversationRead(request.getConversationId());
        return ResponseEntity.ok(viewCoordinator.selectConversation(request.getConversationId()));
    }

    @PostMapping("/back")
    public ResponseEntity<ViewState> goBack() {
        return ResponseEntity.ok(viewCoordinator.goBack());
    }

    @PostMapping("/viewport")
    public ResponseEntity<ViewState> onViewportResize(@Valid @RequestBody ViewportRequest request) {
        log.debug("Viewport resized to {}px", request.getWidth());
        return ResponseEntity.ok(viewCoordinator.onViewportResize(request.getWidth()));
    }
}
