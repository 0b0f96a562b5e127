package com.example.messaging.chat.backend;

import com.example.messaging.shared.backend.MessagingBackend;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.dto.RemoteEvent;
import com.example.messaging.shared.exception.AttachmentRejectedException;
import com.example.messaging.shared.exception.ResourceNotFoundException;
import com.example.messaging.shared.exception.TransportException;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.MessagePayload;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.PollOption;
import com.example.messaging.shared.model.StorageReference;
import com.example.messaging.shared.util.Constants.DeliveryStatus;
import com.example.messaging.shared.util.Constants.RemoteEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated hosted backend: keeps conversations, messages, polls and stored files in memory
 * and pushes every accepted message and vote on its notification channel.
 * <p>
 * Client-assigned message ids are adopted; the creation timestamp is stamped on arrival.
 */
@Component
@Slf4j
public class InMemoryMessagingBackend implements MessagingBackend {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Message>> messages = new ConcurrentHashMap<>();
    private final Map<String, Poll> polls = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> pollVotes = new ConcurrentHashMap<>();
    private final Map<String, byte[]> storedFiles = new ConcurrentHashMap<>();
    private final Sinks.Many<RemoteEvent> events = Sinks.many().multicast().directBestEffort();

    private final BackendFaultInjector faultInjector;
    private final Clock clock;
    private final Duration latency;
    private final AppProperties.Upload uploadProperties;

    public InMemoryMessagingBackend(BackendFaultInjector faultInjector, Clock clock, AppProperties appProperties) {
        this.faultInjector = faultInjector;
        this.clock = clock;
        this.latency = appProperties.getBackend().getSimulatedLatency();
        this.uploadProperties = appProperties.getUpload();
        if (appProperties.getBackend().isSeedDemoData()) {
            seedDemoData(appProperties.getSession().getParticipantId());
        }
    }

    @Override
    public Flux<Conversation> fetchConversations(String participantId) {
        return guard(null, Mono.fromSupplier(() -> conversations.values().stream()
                        .filter(c -> c.getParticipantIds().contains(participantId))
                        .toList()))
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Flux<Message> fetchMessages(String conversationId) {
        return guard(conversationId, Mono.fromSupplier(() -> {
                    requireConversation(conversationId);
                    return List.copyOf(messagesOf(conversationId).values());
                }))
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Poll> fetchPoll(String pollId) {
        return guard(null, Mono.fromSupplier(() -> pollSnapshot(pollId)));
    }

    @Override
    public Mono<Message> postMessage(Message draft) {
        return guard(draft.getConversationId(), Mono.fromSupplier(() -> {
            requireConversation(draft.getConversationId());
            Message stored = store(draft.toBuilder()
                    .createdAt(OffsetDateTime.now(clock))
                    .deliveryStatus(DeliveryStatus.SENT)
                    .build());
            emit(RemoteEvent.builder()
                    .type(RemoteEventType.MESSAGE_CREATED)
                    .conversationId(stored.getConversationId())
                    .message(stored)
                    .build());
            return stored;
        }));
    }

    @Override
    public Mono<Void> postPoll(Poll poll) {
        return guard(poll.getConversationId(), Mono.fromRunnable(() -> {
            requireConversation(poll.getConversationId());
            polls.putIfAbsent(poll.getId(), poll);
            pollVotes.putIfAbsent(poll.getId(), new ConcurrentHashMap<>());
            log.debug("Poll {} stored with {} options", poll.getId(), poll.getOptions().size());
        }));
    }

    @Override
    public Mono<Void> postVote(String pollId, String voterId, int optionIndex) {
        Poll poll = polls.get(pollId);
        String conversationId = poll == null ? null : poll.getConversationId();
        return guard(conversationId, Mono.fromRunnable(() -> {
            if (poll == null) {
                throw new ResourceNotFoundException("Poll not found: " + pollId);
            }
            Integer previous = pollVotes.get(pollId).putIfAbsent(voterId, optionIndex);
            if (previous == null) {
                emit(RemoteEvent.builder()
                        .type(RemoteEventType.POLL_VOTE_RECORDED)
                        .conversationId(conversationId)
                        .pollId(pollId)
                        .voterId(voterId)
                        .optionIndex(optionIndex)
                        .build());
            }
        }));
    }

    @Override
    public Mono<StorageReference> storeFile(String ownerId, FileHandle file) {
        if (faultInjector.isUploadsStalled()) {
            return Mono.never();
        }
        return guard(null, Mono.fromSupplier(() -> {
            if (file.getSizeBytes() > uploadProperties.getMaxSizeBytes()) {
                throw AttachmentRejectedException.tooLarge(file.getFileName(), file.getSizeBytes(), uploadProperties.getMaxSizeBytes());
            }
            byte[] content = file.getContent() == null ? new byte[0] : file.getContent();
            // Every upload gets its own object, even for identical content
            long stamp = clock.millis();
            String path = ownerId + "/" + stamp + "_" + file.getFileName();
            while (storedFiles.putIfAbsent(path, content) != null) {
                stamp++;
                path = ownerId + "/" + stamp + "_" + file.getFileName();
            }
            return new StorageReference(uploadProperties.getBucket(), path,
                    uploadProperties.getPublicBaseUrl() + "/" + uploadProperties.getBucket() + "/" + path);
        }));
    }

    @Override
    public Mono<Void> deleteFile(StorageReference reference) {
        return guard(null, Mono.fromRunnable(() -> storedFiles.remove(reference.getPath())));
    }

    @Override
    public Flux<RemoteEvent> subscribe(String participantId) {
        return events.asFlux()
                .filter(event -> {
                    Conversation conversation = conversations.get(event.getConversationId());
                    return conversation != null && conversation.getParticipantIds().contains(participantId);
                });
    }

    /**
     * Simulates a message written by another participant.
     */
    public Message injectRemoteMessage(String conversationId, String authorId, String text) {
        requireConversation(conversationId);
        Message stored = store(Message.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .authorId(authorId)
                .createdAt(OffsetDateTime.now(clock))
                .payload(MessagePayload.text(text))
                .deliveryStatus(DeliveryStatus.SENT)
                .build());
        emit(RemoteEvent.builder()
                .type(RemoteEventType.MESSAGE_CREATED)
                .conversationId(conversationId)
                .message(stored)
                .build());
        log.info("Injected remote message {} from {} into {}", stored.getId(), authorId, conversationId);
        return stored;
    }

    public void addConversation(Conversation conversation) {
        conversations.put(conversation.getId(), conversation);
    }

    public boolean isStored(String path) {
        return storedFiles.containsKey(path);
    }

    private Message store(Message message) {
        messagesOf(message.getConversationId()).put(message.getId(), message);
        conversations.computeIfPresent(message.getConversationId(), (id, conversation) -> conversation.toBuilder()
                .lastActivityAt(message.getCreatedAt())
                .lastMessagePreview(message.getPayload().toPreview())
                .build());
        return message;
    }

    private Map<String, Message> messagesOf(String conversationId) {
        return messages.computeIfAbsent(conversationId, id -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    private Poll pollSnapshot(String pollId) {
        Poll poll = polls.get(pollId);
        if (poll == null) {
            throw new ResourceNotFoundException("Poll not found: " + pollId);
        }
        Map<String, Integer> votes = pollVotes.get(pollId);
        long[] tallies = new long[poll.getOptions().size()];
        votes.values().forEach(index -> tallies[index]++);
        List<PollOption> options = new ArrayList<>();
        for (int i = 0; i < tallies.length; i++) {
            options.add(new PollOption(poll.getOptions().get(i).getText(), tallies[i]));
        }
        return poll.toBuilder()
                .options(List.copyOf(options))
                .voterIds(Set.copyOf(votes.keySet()))
                .failedVoterIds(Set.of())
                .build();
    }

    private void requireConversation(String conversationId) {
        if (!conversations.containsKey(conversationId)) {
            throw new ResourceNotFoundException("Conversation not found: " + conversationId);
        }
    }

    private synchronized void emit(RemoteEvent event) {
        event.setEventId(UUID.randomUUID().toString());
        event.setTimestamp(OffsetDateTime.now(clock));
        events.tryEmitNext(event);
    }

    private <T> Mono<T> guard(String conversationId, Mono<T> call) {
        Mono<T> checked = Mono.defer(() -> faultInjector.shouldFail(conversationId)
                ? Mono.<T>error(new TransportException("Backend unreachable (simulated)"))
                : call);
        return latency.isZero() ? checked : Mono.delay(latency).then(checked);
    }

    private void seedDemoData(String participantId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        addConversation(Conversation.builder()
                .id("conv-turma-violao-01")
                .displayName("Violão Iniciante - Turma A")
                .groupChat(true)
                .classId("turma-violao-01")
                .participantId(participantId)
                .participantId("prof-ana-lima")
                .participantId("aluno-pedro-alves")
                .participantId("aluno-julia-costa")
                .build());
        addConversation(Conversation.builder()
                .id("conv-prof-carlos")
                .displayName("Carlos Mendes")
                .participantId(participantId)
                .participantId("prof-carlos-mendes")
                .build());
        addConversation(Conversation.builder()
                .id("conv-resp-marina")
                .displayName("Marina Souza")
                .participantId(participantId)
                .participantId("resp-marina-souza")
                .build());

        store(seedMessage("conv-turma-violao-01", "prof-ana-lima", now.minusHours(3),
                "Lembrete: aula de sábado começa às 9h."));
        store(seedMessage("conv-turma-violao-01", "aluno-pedro-alves", now.minusHours(2),
                "Professora, preciso levar o afinador?"));
        store(seedMessage("conv-prof-carlos", participantId, now.minusDays(1),
                "Carlos, pode confirmar a reposição de quinta?"));
        store(seedMessage("conv-prof-carlos", "prof-carlos-mendes", now.minusHours(20),
                "Confirmado, às 16h na sala 2."));
        log.info("Seeded {} demo conversations for {}", conversations.size(), participantId);
    }

    private static Message seedMessage(String conversationId, String authorId, OffsetDateTime createdAt, String text) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .authorId(authorId)
                .createdAt(createdAt)
                .payload(MessagePayload.text(text))
                .deliveryStatus(DeliveryStatus.SENT)
                .build();
    }
}
