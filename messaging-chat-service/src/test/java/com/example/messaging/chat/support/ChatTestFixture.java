package com.example.messaging.chat.support;

import com.example.messaging.chat.backend.BackendFaultInjector;
import com.example.messaging.chat.backend.InMemoryMessagingBackend;
import com.example.messaging.chat.service.AttachmentUploader;
import com.example.messaging.chat.service.BackendGateway;
import com.example.messaging.chat.service.ConversationStore;
import com.example.messaging.chat.service.PollEngine;
import com.example.messaging.chat.service.StateChangePublisher;
import com.example.messaging.chat.service.ViewCoordinator;
import com.example.messaging.shared.backend.MessagingBackend;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.config.MonitoringConfig.MessagingMetricsCollector;
import com.example.messaging.shared.model.Conversation;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;

/**
 * Wires the chat services by hand on the immediate scheduler, so backend calls settle
 * before the calling method returns.
 */
public class ChatTestFixture {

    public static final String ME = "director-001";
    public static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    public final TestClock clock = new TestClock(START);
    public final AppProperties properties = new AppProperties();
    public final BackendFaultInjector faults = new BackendFaultInjector();
    public final MessagingBackend backend;
    public final BackendGateway gateway;
    public final StateChangePublisher publisher;
    public final PollEngine pollEngine;
    public final Bulkhead uploadBulkhead;
    public final AttachmentUploader uploader;
    public final ViewCoordinator viewCoordinator;
    public final ConversationStore store;

    private Disposable remoteSync;

    /**
     * Backed by the in-memory backend, with no demo data.
     */
    public ChatTestFixture() {
        this(null);
    }

    public ChatTestFixture(MessagingBackend customBackend) {
        properties.getSession().setParticipantId(ME);
        properties.getBackend().setSeedDemoData(false);
        properties.getUpload().setMaxSizeBytes(1024);
        properties.getUpload().setMaxConcurrent(2);

        backend = customBackend != null ? customBackend : new InMemoryMessagingBackend(faults, clock, properties);
        gateway = new BackendGateway(backend, CircuitBreaker.ofDefaults("test-backend"), Schedulers.immediate(), properties);
        publisher = new StateChangePublisher(clock);
        pollEngine = new PollEngine(properties);
        uploadBulkhead = Bulkhead.of("test-upload", BulkheadConfig.custom()
                .maxConcurrentCalls(properties.getUpload().getMaxConcurrent())
                .maxWaitDuration(Duration.ZERO)
                .build());
        uploader = new AttachmentUploader(gateway, uploadBulkhead, properties);
        viewCoordinator = new ViewCoordinator(publisher, properties);
        store = new ConversationStore(gateway, pollEngine, uploader, viewCoordinator, publisher,
                Caffeine.newBuilder().build(),
                new MessagingMetricsCollector(new SimpleMeterRegistry()),
                clock, properties);
    }

    public InMemoryMessagingBackend inMemoryBackend() {
        return (InMemoryMessagingBackend) backend;
    }

    /**
     * Adds a conversation with the session participant and another member, then syncs the store.
     */
    public Conversation addConversation(String id, String otherParticipant) {
        Conversation conversation = Conversation.builder()
                .id(id)
                .displayName("Conversation " + id)
                .participantId(ME)
                .participantId(otherParticipant)
                .build();
        inMemoryBackend().addConversation(conversation);
        store.refreshConversations().block();
        return conversation;
    }

    /**
     * Feeds the backend's notification channel into the store.
     */
    public void connectRemoteSync() {
        remoteSync = backend.subscribe(ME)
                .concatMap(store::applyRemoteEvent)
                .subscribe();
    }

    public void close() {
        if (remoteSync != null) {
            remoteSync.dispose();
        }
    }
}
