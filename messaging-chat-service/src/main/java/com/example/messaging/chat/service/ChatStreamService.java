package com.example.messaging.chat.service;

import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.config.MonitoringConfig.MessagingMetricsCollector;
import com.example.messaging.shared.util.Constants.SseEventType;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns state-change notifications into per-connection SSE streams with periodic heartbeats.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatStreamService {

    private final StateChangePublisher stateChangePublisher;
    private final SseEventFactory sseEventFactory;
    private final AppProperties appProperties;
    private final MessagingMetricsCollector metricsCollector;

    private final Sinks.One<Boolean> shutdownSignal = Sinks.one();
    private final AtomicLong activeConnections = new AtomicLong();

    public Flux<ServerSentEvent<String>> createEventStream(String connectionId) {
        Duration heartbeatInterval = Duration.ofMillis(appProperties.getSse().getHeartbeatInterval());

        Flux<ServerSentEvent<String>> stateChanges = stateChangePublisher.events()
                .mapNotNull(event -> sseEventFactory.createEvent(SseEventType.STATE_CHANGED, null, event));
        Flux<ServerSentEvent<String>> heartbeats = Flux.interval(heartbeatInterval)
                .mapNotNull(tick -> sseEventFactory.createHeartbeatEvent());
        Flux<ServerSentEvent<String>> shutdown = shutdownSignal.asMono()
                .map(signal -> sseEventFactory.createShutdownEvent())
                .flux();

        return Flux.just(sseEventFactory.createConnectedEvent(connectionId, appProperties.getSession().getParticipantId()))
                .concatWith(Flux.merge(stateChanges, heartbeats, shutdown))
                .takeUntil(event -> SseEventType.SERVER_SHUTDOWN.name().equals(event.event()))
                .doOnSubscribe(subscription -> {
                    long active = activeConnections.incrementAndGet();
                    metricsCollector.setGauge("messaging.sse.connections.active", active);
                    log.info("Chat stream {} opened ({} active)", connectionId, active);
                })
                .doFinally(signal -> {
                    long active = activeConnections.decrementAndGet();
                    metricsCollector.setGauge("messaging.sse.connections.active", active);
                    log.info("Chat stream {} closed on {} ({} active)", connectionId, signal, active);
                });
    }

    public long getActiveConnectionCount() {
        return activeConnections.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Notifying {} chat streams of shutdown", activeConnections.get());
        shutdownSignal.tryEmitValue(Boolean.TRUE);
    }
}
