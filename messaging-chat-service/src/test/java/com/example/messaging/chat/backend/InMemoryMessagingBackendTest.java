package com.example.messaging.chat.backend;

import com.example.messaging.chat.support.TestClock;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.dto.RemoteEvent;
import com.example.messaging.shared.exception.ResourceNotFoundException;
import com.example.messaging.shared.exception.TransportException;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.MessagePayload;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.PollOption;
import com.example.messaging.shared.util.Constants.DeliveryStatus;
import com.example.messaging.shared.util.Constants.RemoteEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMessagingBackendTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final TestClock clock = new TestClock(NOW);
    private final BackendFaultInjector faults = new BackendFaultInjector();
    private AppProperties properties;
    private InMemoryMessagingBackend backend;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getBackend().setSeedDemoData(false);
        backend = new InMemoryMessagingBackend(faults, clock, properties);
        backend.addConversation(Conversation.builder()
                .id("conv-a")
                .displayName("Ana Lima")
                .participantId("director-001")
                .participantId("prof-ana")
                .build());
    }

    private static Message draft(String id, String text) {
        return Message.builder()
                .id(id)
                .conversationId("conv-a")
                .authorId("director-001")
                .createdAt(OffsetDateTime.of(2025, 3, 1, 11, 59, 58, 0, ZoneOffset.UTC))
                .payload(MessagePayload.text(text))
                .deliveryStatus(DeliveryStatus.PENDING)
                .build();
    }

    @Test
    void postedMessageKeepsClientIdAndGetsServerTimestamp() {
        StepVerifier.create(backend.postMessage(draft("msg-1", "Olá")))
                .assertNext(stored -> {
                    assertThat(stored.getId()).isEqualTo("msg-1");
                    assertThat(stored.getCreatedAt().toInstant()).isEqualTo(NOW);
                    assertThat(stored.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
                })
                .verifyComplete();

        StepVerifier.create(backend.fetchConversations("director-001"))
                .assertNext(conversation -> assertThat(conversation.getLastMessagePreview()).isEqualTo("Olá"))
                .verifyComplete();
    }

    @Test
    void participantsOnlySeeTheirConversations() {
        StepVerifier.create(backend.fetchConversations("outsider").collectList())
                .assertNext(conversations -> assertThat(conversations).isEmpty())
                .verifyComplete();
    }

    @Test
    void notificationsReachOnlyParticipants() {
        List<RemoteEvent> mine = new ArrayList<>();
        List<RemoteEvent> theirs = new ArrayList<>();
        Disposable first = backend.subscribe("director-001").subscribe(mine::add);
        Disposable second = backend.subscribe("outsider").subscribe(theirs::add);

        backend.injectRemoteMessage("conv-a", "prof-ana", "Bom dia");
        first.dispose();
        second.dispose();

        assertThat(mine).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(RemoteEventType.MESSAGE_CREATED);
            assertThat(event.getMessage().getAuthorId()).isEqualTo("prof-ana");
            assertThat(event.getEventId()).isNotBlank();
        });
        assertThat(theirs).isEmpty();
    }

    @Test
    void onlyFirstVoteOfAVoterIsAnnounced() {
        Poll poll = Poll.builder()
                .id("poll-1")
                .messageId("msg-poll")
                .conversationId("conv-a")
                .question("Recital?")
                .options(List.of(new PollOption("Sexta", 0), new PollOption("Sábado", 0)))
                .voterIds(Set.of())
                .failedVoterIds(Set.of())
                .build();
        backend.postPoll(poll).block();
        List<RemoteEvent> events = new ArrayList<>();
        Disposable subscription = backend.subscribe("director-001").subscribe(events::add);

        backend.postVote("poll-1", "aluno-1", 1).block();
        backend.postVote("poll-1", "aluno-1", 0).block();
        subscription.dispose();

        assertThat(events).hasSize(1);
        StepVerifier.create(backend.fetchPoll("poll-1"))
                .assertNext(snapshot -> {
                    assertThat(snapshot.getOptions()).extracting(PollOption::getTally).containsExactly(0L, 1L);
                    assertThat(snapshot.getVoterIds()).containsExactly("aluno-1");
                })
                .verifyComplete();
    }

    @Test
    void faultsAreScopedToConversation() {
        faults.failConversation("conv-a");

        StepVerifier.create(backend.postMessage(draft("msg-1", "Olá")))
                .expectError(TransportException.class)
                .verify();
        StepVerifier.create(backend.fetchConversations("director-001").count())
                .expectNext(1L)
                .verifyComplete();

        faults.reset();
        StepVerifier.create(backend.postMessage(draft("msg-1", "Olá")))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void unknownConversationIsNotFound() {
        StepVerifier.create(backend.fetchMessages("conv-x"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void demoDataIsSeededForSessionParticipant() {
        AppProperties seeded = new AppProperties();
        InMemoryMessagingBackend demo = new InMemoryMessagingBackend(new BackendFaultInjector(), clock, seeded);

        StepVerifier.create(demo.fetchConversations(seeded.getSession().getParticipantId()).count())
                .expectNext(3L)
                .verifyComplete();
        StepVerifier.create(demo.fetchMessages("conv-turma-violao-01").count())
                .expectNext(2L)
                .verifyComplete();
    }
}
