package com.example.messaging.chat.service;

import com.example.messaging.chat.support.TestClock;
import com.example.messaging.shared.dto.StateChangeEvent;
import com.example.messaging.shared.util.Constants.StateChangeType;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;

class StateChangePublisherTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final StateChangePublisher publisher = new StateChangePublisher(new TestClock(NOW));

    @Test
    void publishingWithoutSubscribersIsHarmless() {
        assertThatCode(() -> publisher.publish(StateChangeType.CONVERSATIONS_CHANGED, null, null))
                .doesNotThrowAnyException();
    }

    @Test
    void subscribersReceiveEventsPublishedAfterSubscribing() {
        publisher.publish(StateChangeType.MESSAGES_CHANGED, "conv-a", "missed");

        StepVerifier.create(publisher.events().take(2))
                .then(() -> {
                    publisher.publish(StateChangeType.MESSAGES_CHANGED, "conv-a", "msg-1");
                    publisher.publish(StateChangeType.POLL_TALLY_CHANGED, "conv-a", "poll-1");
                })
                .expectNext(StateChangeEvent.builder()
                        .type(StateChangeType.MESSAGES_CHANGED)
                        .conversationId("conv-a")
                        .entityId("msg-1")
                        .timestamp(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))
                        .build())
                .expectNextMatches(event -> event.getType() == StateChangeType.POLL_TALLY_CHANGED
                        && "poll-1".equals(event.getEntityId()))
                .verifyComplete();
    }
}
