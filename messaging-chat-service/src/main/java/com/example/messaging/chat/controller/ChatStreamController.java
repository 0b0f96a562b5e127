package com.example.messaging.chat.controller;

import com.example.messaging.chat.service.ChatStreamService;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

import java.util.UUID;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatStreamController {

    private final ChatStreamService chatStreamService;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "chatStreamLimiter", fallbackMethod = "connectFallback")
    public Flux<ServerSentEvent<String>> connect(
            @RequestParam(required = false) String connectionId,
            ServerWebExchange exchange) {
        final String resolvedConnectionId = (connectionId == null || connectionId.isBlank())
                ? UUID.randomUUID().toString()
                : connectionId;
        log.info("Chat stream connection request, connectionId='{}', IP='{}'", resolvedConnectionId,
                exchange.getRequest().getRemoteAddress() != null
                        ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress()
                        : "unknown");
        return chatStreamService.createEventStream(resolvedConnectionId);
    }

    public Flux<ServerSentEvent<String>> connectFallback(String connectionId, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Chat stream rate limit exceeded. IP: {}. Details: {}", exchange.getRequest().getRemoteAddress(), ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }
}
