package com.example.messaging.chat.service;

import com.example.messaging.shared.backend.MessagingBackend;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.dto.RemoteEvent;
import com.example.messaging.shared.exception.MessagingException;
import com.example.messaging.shared.exception.TransportException;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.StorageReference;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Every call to the {@link MessagingBackend} goes through here. Calls run on the backend scheduler,
 * are bounded by the configured timeout and by the {@code messagingBackend} circuit breaker,
 * and any failure that is not already a {@link MessagingException} surfaces as a {@link TransportException}.
 */
@Component
@Slf4j
public class BackendGateway {

    private final MessagingBackend backend;
    private final CircuitBreaker circuitBreaker;
    private final Scheduler backendScheduler;
    private final Duration timeout;

    public BackendGateway(MessagingBackend backend,
                          CircuitBreaker messagingBackendCircuitBreaker,
                          @Qualifier("backendScheduler") Scheduler backendScheduler,
                          AppProperties appProperties) {
        this.backend = backend;
        this.circuitBreaker = messagingBackendCircuitBreaker;
        this.backendScheduler = backendScheduler;
        this.timeout = appProperties.getBackend().getTimeout();
    }

    public Mono<List<Conversation>> fetchConversations(String participantId) {
        return guard("fetchConversations", () -> backend.fetchConversations(participantId).collectList());
    }

    public Mono<List<Message>> fetchMessages(String conversationId) {
        return guard("fetchMessages", () -> backend.fetchMessages(conversationId).collectList());
    }

    public Mono<Poll> fetchPoll(String pollId) {
        return guard("fetchPoll", () -> backend.fetchPoll(pollId));
    }

    public Mono<Message> postMessage(Message draft) {
        return guard("postMessage", () -> backend.postMessage(draft))
                .switchIfEmpty(Mono.error(() -> new TransportException("Backend did not acknowledge message " + draft.getId())));
    }

    public Mono<Void> postPoll(Poll poll) {
        return guard("postPoll", () -> backend.postPoll(poll));
    }

    public Mono<Void> postVote(String pollId, String voterId, int optionIndex) {
        return guard("postVote", () -> backend.postVote(pollId, voterId, optionIndex));
    }

    public Mono<StorageReference> storeFile(String ownerId, FileHandle file) {
        return guard("storeFile", () -> backend.storeFile(ownerId, file))
                .switchIfEmpty(Mono.error(() -> new TransportException("Storage returned no reference for " + file.getFileName())));
    }

    public Mono<Void> deleteFile(StorageReference reference) {
        return guard("deleteFile", () -> backend.deleteFile(reference));
    }

    /**
     * The notification channel is long-lived, so it gets neither the call timeout nor the circuit breaker.
     */
    public Flux<RemoteEvent> subscribe(String participantId) {
        return Flux.defer(() -> backend.subscribe(participantId))
                .onErrorMap(e -> !(e instanceof MessagingException),
                        e -> new TransportException("Notification channel failed: " + e.getMessage(), e));
    }

    private <T> Mono<T> guard(String operation, Supplier<Mono<T>> call) {
        return Mono.defer(call)
                .subscribeOn(backendScheduler)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .doOnError(e -> log.debug("Backend call {} failed: {}", operation, e.toString()))
                .onErrorMap(e -> !(e instanceof MessagingException),
                        e -> new TransportException("Backend call " + operation + " failed: " + e.getMessage(), e));
    }
}
