package com.example.messaging.chat.service;

import com.example.messaging.shared.util.Constants.SseEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Builds an SSE event with a JSON payload.
     * @return the event, or null if the payload cannot be serialized
     */
    public ServerSentEvent<String> createEvent(SseEventType eventType, String eventId, Object data) {
        try {
            String payload = objectMapper.writeValueAsString(data);
            return ServerSentEvent.<String>builder()
                    .event(eventType.name())
                    .id(eventId)
                    .data(payload)
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event type {}: {}", eventType, e.getMessage());
            return null;
        }
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        Map<String, String> data = Map.of("timestamp", OffsetDateTime.now(clock).toString());
        return createEvent(SseEventType.HEARTBEAT, null, data);
    }

    public ServerSentEvent<String> createConnectedEvent(String connectionId, String participantId) {
        Map<String, String> data = Map.of(
                "message", "Chat stream connected",
                "connectionId", connectionId,
                "participantId", participantId,
                "timestamp", OffsetDateTime.now(clock).toString());
        return createEvent(SseEventType.CONNECTED, connectionId, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
                .event(SseEventType.SERVER_SHUTDOWN.name())
                .data("Server is shutting down. Please reconnect momentarily.")
                .build();
    }
}
