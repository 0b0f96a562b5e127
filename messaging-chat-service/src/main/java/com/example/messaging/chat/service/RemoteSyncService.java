package com.example.messaging.chat.service;

import com.example.messaging.shared.config.AppProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Performs the initial conversation sync and keeps the store subscribed to the backing
 * service's notification channel, resubscribing with backoff when the channel drops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemoteSyncService {

    private final ConversationStore conversationStore;
    private final BackendGateway backendGateway;
    private final AppProperties appProperties;

    private Disposable subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        String participantId = appProperties.getSession().getParticipantId();

        conversationStore.refreshConversations().subscribe(
                conversations -> log.info("Initial sync loaded {} conversations", conversations.size()),
                error -> log.warn("Initial conversation sync failed: {}", error.getMessage()));

        subscription = backendGateway.subscribe(participantId)
                .concatMap(event -> conversationStore.applyRemoteEvent(event)
                        .onErrorResume(error -> {
                            log.warn("Failed to apply remote event {}: {}", event.getEventId(), error.getMessage());
                            return Mono.empty();
                        }))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, appProperties.getBackend().getResubscribeBackoff())
                        .maxBackoff(appProperties.getBackend().getResubscribeBackoff().multipliedBy(30))
                        .doBeforeRetry(signal -> log.warn("Notification channel dropped (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .subscribe(
                        unused -> { },
                        error -> log.error("Notification channel gave up: {}", error.getMessage()),
                        () -> log.info("Notification channel completed"));
        log.info("Subscribed to notifications for participant {}", participantId);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
        }
    }
}
