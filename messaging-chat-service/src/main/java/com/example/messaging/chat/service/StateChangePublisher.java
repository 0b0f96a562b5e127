package com.example.messaging.chat.service;

import com.example.messaging.shared.dto.StateChangeEvent;
import com.example.messaging.shared.util.Constants.StateChangeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Fan-out point for state-change notifications. A slow subscriber misses events rather than
 * holding back the writers; it re-reads state on the next notification.
 */
@Component
@Slf4j
public class StateChangePublisher {

    private final Sinks.Many<StateChangeEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Clock clock;

    public StateChangePublisher(Clock clock) {
        this.clock = clock;
    }

    // Serialized because Sinks.Many does not allow concurrent emission
    public synchronized void publish(StateChangeType type, String conversationId, String entityId) {
        StateChangeEvent event = StateChangeEvent.builder()
                .type(type)
                .conversationId(conversationId)
                .entityId(entityId)
                .timestamp(OffsetDateTime.now(clock))
                .build();
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to publish {} for conversation {}: {}", type, conversationId, result);
        }
    }

    public Flux<StateChangeEvent> events() {
        return sink.asFlux();
    }
}
