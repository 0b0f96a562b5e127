package com.example.messaging.chat.controller;

import com.example.messaging.chat.dto.CreatePollRequest;
import com.example.messaging.chat.dto.SendMessageRequest;
import com.example.messaging.chat.dto.VoteRequest;
import com.example.messaging.chat.service.ConversationStore;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.Poll;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

    private final ConversationStore conversationStore;
    private final AppProperties appProperties;

    @GetMapping("/conversations")
    public ResponseEntity<List<Conversation>> listConversations() {
        return ResponseEntity.ok(conversationStore.listConversations());
    }

    @PostMapping("/conversations/refresh")
    public Mono<List<Conversation>> refreshConversations() {
        log.info("Conversation refresh requested");
        return conversationStore.refreshConversations();
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<List<Message>> loadMessages(@PathVariable String conversationId) {
        return ResponseEntity.ok(conversationStore.loadMessages(conversationId));
    }

    @PostMapping("/conversations/{conversationId}/messages/refresh")
    public Mono<List<Message>> refreshMessages(@PathVariable String conversationId) {
        return conversationStore.refreshMessages(conversationId);
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<Message> sendMessage(
            @PathVariable String conversationId,
            @Valid @RequestBody SendMessageRequest request) {
        Message message = conversationStore.sendMessage(conversationId, request.getText());
        log.info("Message {} queued in conversation {}", message.getId(), conversationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(message);
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<Void> discardMessage(@PathVariable String messageId) {
        conversationStore.discardMessage(messageId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/conversations/{conversationId}/polls")
    public ResponseEntity<Poll> createPoll(
            @PathVariable String conversationId,
            @Valid @RequestBody CreatePollRequest request) {
        Poll poll = conversationStore.createPoll(conversationId, request.getQuestion(), request.getOptions());
        log.info("Poll {} created in conversation {}", poll.getId(), conversationId);
        return ResponseEntity.status(HttpStatus.CREATED).body(poll);
    }

    @GetMapping("/polls/{pollId}")
    public ResponseEntity<Poll> getPoll(@PathVariable String pollId) {
        return ResponseEntity.ok(conversationStore.getPoll(pollId));
    }

    @PostMapping("/polls/{pollId}/votes")
    public ResponseEntity<Poll> vote(@PathVariable String pollId, @Valid @RequestBody VoteRequest request) {
        String voterId = request.getVoterId() == null || request.getVoterId().isBlank()
                ? appProperties.getSession().getParticipantId()
                : request.getVoterId();
        return ResponseEntity.ok(conversationStore.voteOnPoll(pollId, voterId, request.getOptionIndex()));
    }

    @PostMapping("/polls/{pollId}/close")
    public ResponseEntity<Poll> closePoll(@PathVariable String pollId) {
        log.info("Closing poll {}", pollId);
        return ResponseEntity.ok(conversationStore.closePoll(pollId));
    }
}
