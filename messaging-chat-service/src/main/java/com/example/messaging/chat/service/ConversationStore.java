package com.example.messaging.chat.service;

import com.example.messaging.shared.aspect.Monitored;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.config.MonitoringConfig.MessagingMetricsCollector;
import com.example.messaging.shared.dto.RemoteEvent;
import com.example.messaging.shared.exception.AttachmentRejectedException;
import com.example.messaging.shared.exception.InvalidInputException;
import com.example.messaging.shared.exception.ResourceNotFoundException;
import com.example.messaging.shared.model.Attachment;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.MessagePayload;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.StorageReference;
import com.example.messaging.shared.util.Constants;
import com.example.messaging.shared.util.Constants.AttachmentKind;
import com.example.messaging.shared.util.Constants.DeliveryStatus;
import com.example.messaging.shared.util.Constants.PayloadType;
import com.example.messaging.shared.util.Constants.StateChangeType;
import com.example.messaging.shared.util.Constants.UploadFailureReason;
import com.example.messaging.shared.util.Constants.UploadStatus;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-memory projection of the session's conversations and their messages,
 * and the single write path for them.
 * <p>
 * Writes are optimistic: the local entry is visible at once as {@code PENDING} and settles to
 * {@code SENT} or {@code FAILED} when the backing service answers. Each conversation has its own
 * lock; state-change notifications are published after it is released.
 */
@Service
@Monitored("store")
@Slf4j
public class ConversationStore {

    private final Map<String, ConversationState> conversations = new ConcurrentHashMap<>();
    private final Map<String, String> conversationByMessageId = new ConcurrentHashMap<>();
    private final Map<String, Attachment> attachments = new ConcurrentHashMap<>();
    private final Map<String, UploadHandle> activeUploads = new ConcurrentHashMap<>();

    private final BackendGateway backendGateway;
    private final PollEngine pollEngine;
    private final AttachmentUploader attachmentUploader;
    private final ViewCoordinator viewCoordinator;
    private final StateChangePublisher stateChangePublisher;
    private final Cache<String, List<String>> pendingFingerprints;
    private final MessagingMetricsCollector metricsCollector;
    private final Clock clock;
    private final String participantId;
    private final Duration timestampBucket;
    private final long retiredIdMaxSize;

    public ConversationStore(BackendGateway backendGateway,
                             PollEngine pollEngine,
                             AttachmentUploader attachmentUploader,
                             ViewCoordinator viewCoordinator,
                             StateChangePublisher stateChangePublisher,
                             Cache<String, List<String>> pendingFingerprintCache,
                             MessagingMetricsCollector metricsCollector,
                             Clock clock,
                             AppProperties appProperties) {
        this.backendGateway = backendGateway;
        this.pollEngine = pollEngine;
        this.attachmentUploader = attachmentUploader;
        this.viewCoordinator = viewCoordinator;
        this.stateChangePublisher = stateChangePublisher;
        this.pendingFingerprints = pendingFingerprintCache;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.participantId = appProperties.getSession().getParticipantId();
        this.timestampBucket = appProperties.getReconciliation().getTimestampBucket();
        this.retiredIdMaxSize = appProperties.getReconciliation().getRetiredIdMaxSize();
    }

    // ---------------------------------------------------------------- reads

    /**
     * Last-synchronized conversations, most recent activity first. Never blocks on a writer.
     */
    public List<Conversation> listConversations() {
        return conversations.values().stream()
                .map(state -> state.conversation)
                .sorted(Conversation.BY_RECENT_ACTIVITY)
                .toList();
    }

    /**
     * Messages of a conversation in (createdAt, id) order. The first call for a conversation
     * also starts loading its history from the backing service.
     */
    public List<Message> loadMessages(String conversationId) {
        ConversationState state = require(conversationId);
        hydrateIfNeeded(state);
        state.lock.lock();
        try {
            return state.snapshot();
        } finally {
            state.lock.unlock();
        }
    }

    public Poll getPoll(String pollId) {
        return pollEngine.snapshot(pollId);
    }

    public Attachment getAttachment(String attachmentId) {
        Attachment attachment = attachments.get(attachmentId);
        if (attachment == null) {
            throw new ResourceNotFoundException("Attachment not found: " + attachmentId);
        }
        return attachment;
    }

    // ---------------------------------------------------------------- writes

    public Message sendMessage(String conversationId, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Message text must not be empty");
        }
        ConversationState state = require(conversationId);
        Message pending = newPendingMessage(conversationId, MessagePayload.text(text.trim()));

        state.lock.lock();
        try {
            insertLocal(state, pending);
        } finally {
            state.lock.unlock();
        }
        publishMessageChange(conversationId, pending.getId());

        dispatch(pending);
        return pending;
    }

    /**
     * Creates a poll and its hosting message together. The poll definition is posted before the message.
     */
    public Poll createPoll(String conversationId, String question, List<String> options) {
        pollEngine.validateDefinition(question, options);
        ConversationState state = require(conversationId);
        String pollId = newId();
        Message pending = newPendingMessage(conversationId, MessagePayload.poll(pollId, question.trim()));

        Poll poll;
        state.lock.lock();
        try {
            poll = pollEngine.create(pollId, pending.getId(), conversationId, question, options);
            insertLocal(state, pending);
        } finally {
            state.lock.unlock();
        }
        publishMessageChange(conversationId, pending.getId());
        stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, conversationId, pollId);

        backendGateway.postPoll(poll)
                .then(backendGateway.postMessage(pending))
                .subscribe(this::acknowledge, error -> markFailed(pending, error));
        return poll;
    }

    /**
     * Records one vote. The returned snapshot includes it; if the backing service then refuses the vote,
     * it is rolled back and the voter is listed among the poll's failed voters.
     */
    public Poll voteOnPoll(String pollId, String voterId, int optionIndex) {
        String conversationId = pollEngine.conversationOf(pollId);
        ConversationState state = require(conversationId);

        Poll poll;
        state.lock.lock();
        try {
            poll = pollEngine.recordVote(pollId, voterId, optionIndex);
        } finally {
            state.lock.unlock();
        }
        stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, conversationId, pollId);

        backendGateway.postVote(pollId, voterId, optionIndex).subscribe(
                unused -> { },
                error -> onVoteFailed(state, pollId, voterId, error),
                () -> {
                    pollEngine.confirmVote(pollId, voterId);
                    metricsCollector.incrementCounter("messaging.polls.votes", "status", "success");
                });
        return poll;
    }

    public Poll closePoll(String pollId) {
        String conversationId = pollEngine.conversationOf(pollId);
        ConversationState state = require(conversationId);

        boolean wasClosed;
        Poll poll;
        state.lock.lock();
        try {
            wasClosed = pollEngine.snapshot(pollId).isClosed();
            poll = pollEngine.close(pollId);
        } finally {
            state.lock.unlock();
        }
        if (!wasClosed) {
            stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, conversationId, pollId);
        }
        return poll;
    }

    /**
     * Adds a message carrying the file and starts uploading it. The message is posted once the upload
     * is ready. A file rejected before upload leaves the message visible with a failed attachment,
     * and the rejection is rethrown to the caller.
     */
    public Attachment attachFile(String conversationId, FileHandle file) {
        if (file == null || file.getFileName() == null || file.getFileName().isBlank()) {
            throw new InvalidInputException("A file with a name is required");
        }
        ConversationState state = require(conversationId);
        String attachmentId = newId();
        Message pending = newPendingMessage(conversationId, MessagePayload.attachment(attachmentId, file.getFileName()));
        Attachment attachment = Attachment.builder()
                .id(attachmentId)
                .messageId(pending.getId())
                .conversationId(conversationId)
                .fileName(file.getFileName())
                .contentType(file.getContentType())
                .kind(AttachmentKind.fromContentType(file.getContentType()))
                .sizeBytes(file.getSizeBytes())
                .uploadStatus(UploadStatus.UPLOADING)
                .build();

        state.lock.lock();
        try {
            attachments.put(attachmentId, attachment);
            insertLocal(state, pending);
        } finally {
            state.lock.unlock();
        }
        publishMessageChange(conversationId, pending.getId());
        stateChangePublisher.publish(StateChangeType.ATTACHMENT_STATUS_CHANGED, conversationId, attachmentId);

        UploadHandle handle = attachmentUploader.upload(participantId, file);
        activeUploads.put(attachmentId, handle);
        handle.result().subscribe(
                reference -> onUploadReady(attachmentId, reference),
                error -> onUploadFailed(attachmentId, error));

        if (handle.getFailure() instanceof AttachmentRejectedException rejected) {
            throw rejected;
        }
        return getAttachment(attachmentId);
    }

    /**
     * Removes a failed message, or a message whose upload is still running (the upload is cancelled).
     * A discarded message never comes back, not even through a late acknowledgment. Its poll is
     * forgotten and a file it already uploaded is deleted from storage.
     */
    public void discardMessage(String messageId) {
        String conversationId = conversationByMessageId.get(messageId);
        if (conversationId == null) {
            throw new ResourceNotFoundException("Message not found: " + messageId);
        }
        ConversationState state = require(conversationId);

        UploadHandle uploadToCancel = null;
        StorageReference storedToDelete = null;
        String changedAttachmentId = null;
        String discardedPollId = null;
        state.lock.lock();
        try {
            Message message = state.get(messageId);
            if (message == null) {
                throw new ResourceNotFoundException("Message not found: " + messageId);
            }
            Attachment attachment = attachmentOf(message);
            boolean uploading = attachment != null && attachment.getUploadStatus() == UploadStatus.UPLOADING;
            if (message.getDeliveryStatus() != DeliveryStatus.FAILED && !uploading) {
                throw new InvalidInputException("Only failed messages or messages with an upload in progress can be discarded");
            }
            forgetFingerprint(message);
            state.retire(messageId);
            conversationByMessageId.remove(messageId);
            if (uploading) {
                attachments.put(attachment.getId(), attachment.toBuilder()
                        .uploadStatus(UploadStatus.FAILED)
                        .failureReason(UploadFailureReason.CANCELLED)
                        .build());
                uploadToCancel = activeUploads.remove(attachment.getId());
                changedAttachmentId = attachment.getId();
            } else if (attachment != null && attachment.getUploadStatus() == UploadStatus.READY) {
                // Uploaded, but the message carrying it was never accepted
                attachments.remove(attachment.getId());
                storedToDelete = attachment.getStorageReference();
                changedAttachmentId = attachment.getId();
            }
            if (message.getPayload() != null && message.getPayload().getType() == PayloadType.POLL) {
                discardedPollId = message.getPayload().getPollId();
                pollEngine.discard(discardedPollId);
            }
            summarize(state);
        } finally {
            state.lock.unlock();
        }

        if (uploadToCancel != null) {
            uploadToCancel.cancel();
        }
        if (storedToDelete != null) {
            deleteStoredFile(storedToDelete);
        }
        log.info("Message {} discarded from conversation {}", messageId, conversationId);
        publishMessageChange(conversationId, messageId);
        if (changedAttachmentId != null) {
            stateChangePublisher.publish(StateChangeType.ATTACHMENT_STATUS_CHANGED, conversationId, changedAttachmentId);
        }
        if (discardedPollId != null) {
            stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, conversationId, discardedPollId);
        }
    }

    public void markConversationRead(String conversationId) {
        ConversationState state = require(conversationId);
        boolean changed = false;
        state.lock.lock();
        try {
            if (state.conversation.getUnreadCount() > 0) {
                state.conversation = state.conversation.toBuilder().unreadCount(0).build();
                changed = true;
            }
        } finally {
            state.lock.unlock();
        }
        if (changed) {
            stateChangePublisher.publish(StateChangeType.CONVERSATIONS_CHANGED, conversationId, null);
        }
    }

    // ---------------------------------------------------------------- synchronization

    /**
     * Re-reads the participant's conversations and merges them. Local unread counters and
     * newer local activity survive the merge.
     */
    public Mono<List<Conversation>> refreshConversations() {
        return backendGateway.fetchConversations(participantId)
                .map(remote -> {
                    remote.forEach(this::mergeConversation);
                    log.info("Synchronized {} conversations for {}", remote.size(), participantId);
                    stateChangePublisher.publish(StateChangeType.CONVERSATIONS_CHANGED, null, null);
                    return listConversations();
                });
    }

    /**
     * Re-reads a conversation's messages and merges them. Local pending and failed entries survive.
     */
    public Mono<List<Message>> refreshMessages(String conversationId) {
        ConversationState state = require(conversationId);
        return backendGateway.fetchMessages(conversationId)
                .flatMap(remote -> {
                    List<String> unknownPolls = new ArrayList<>();
                    List<Message> merged = mergeFetched(state, remote, unknownPolls);
                    return fetchUnknownPolls(unknownPolls).thenReturn(merged);
                })
                .doFinally(signal -> {
                    state.lock.lock();
                    try {
                        state.hydrating = false;
                    } finally {
                        state.lock.unlock();
                    }
                });
    }

    public Mono<Void> applyRemoteEvent(RemoteEvent event) {
        return Mono.defer(() -> {
            if (event == null || event.getType() == null) {
                log.warn("Ignoring remote event without type: {}", event);
                return Mono.empty();
            }
            switch (event.getType()) {
                case MESSAGE_CREATED:
                    return applyRemoteMessage(event.getMessage());
                case POLL_VOTE_RECORDED:
                    return applyRemoteVote(event.getPollId(), event.getVoterId(), event.getOptionIndex());
                default:
                    log.debug("Ignoring remote event {} of type {}", event.getEventId(), event.getType());
                    return Mono.empty();
            }
        });
    }

    Mono<Void> applyRemoteMessage(Message remote) {
        if (remote == null || remote.getId() == null || remote.getConversationId() == null) {
            log.warn("Ignoring incomplete remote message: {}", remote);
            return Mono.empty();
        }
        ConversationState state = conversations.get(remote.getConversationId());
        if (state != null) {
            return mergeIncoming(state, remote);
        }
        log.info("Message {} belongs to unknown conversation {}, refreshing conversations",
                remote.getId(), remote.getConversationId());
        return refreshConversations().then(Mono.defer(() -> {
            ConversationState refreshed = conversations.get(remote.getConversationId());
            if (refreshed == null) {
                log.warn("Dropping message {} for unknown conversation {}", remote.getId(), remote.getConversationId());
                return Mono.empty();
            }
            return mergeIncoming(refreshed, remote);
        }));
    }

    Mono<Void> applyRemoteVote(String pollId, String voterId, Integer optionIndex) {
        if (pollId == null || voterId == null || optionIndex == null) {
            log.warn("Ignoring incomplete remote vote on poll {} by {}", pollId, voterId);
            return Mono.empty();
        }
        if (pollEngine.isDiscarded(pollId)) {
            log.debug("Ignoring remote vote on discarded poll {}", pollId);
            return Mono.empty();
        }
        if (!pollEngine.isKnown(pollId)) {
            // The fetched snapshot already contains the vote
            return fetchUnknownPolls(List.of(pollId));
        }
        String conversationId = pollEngine.conversationOf(pollId);
        ConversationState state = conversations.get(conversationId);
        if (state == null) {
            log.warn("Poll {} refers to unknown conversation {}", pollId, conversationId);
            return Mono.empty();
        }
        boolean changed;
        state.lock.lock();
        try {
            changed = pollEngine.applyRemoteVote(pollId, voterId, optionIndex);
        } finally {
            state.lock.unlock();
        }
        if (changed) {
            stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, conversationId, pollId);
        }
        return Mono.empty();
    }

    // ---------------------------------------------------------------- settlement

    private void dispatch(Message draft) {
        backendGateway.postMessage(draft).subscribe(
                this::acknowledge,
                error -> markFailed(draft, error));
    }

    private void acknowledge(Message ack) {
        ConversationState state = conversations.get(ack.getConversationId());
        if (state == null) {
            log.warn("Acknowledgment for message {} of unknown conversation {}", ack.getId(), ack.getConversationId());
            return;
        }
        state.lock.lock();
        try {
            if (state.isRetired(ack.getId())) {
                log.debug("Acknowledgment for retired message {} ignored", ack.getId());
                return;
            }
            Message local = state.get(ack.getId());
            if (local != null) {
                forgetFingerprint(local);
            }
            state.upsert(ack.withDeliveryStatus(DeliveryStatus.SENT));
            conversationByMessageId.put(ack.getId(), ack.getConversationId());
            summarize(state);
        } finally {
            state.lock.unlock();
        }
        metricsCollector.incrementCounter("messaging.messages.sent", "status", "success");
        log.debug("Message {} acknowledged in conversation {}", ack.getId(), ack.getConversationId());
        publishMessageChange(ack.getConversationId(), ack.getId());
    }

    private void markFailed(Message draft, Throwable error) {
        ConversationState state = conversations.get(draft.getConversationId());
        if (state == null) {
            return;
        }
        state.lock.lock();
        try {
            Message current = state.get(draft.getId());
            if (current == null || current.getDeliveryStatus() != DeliveryStatus.PENDING) {
                return;
            }
            forgetFingerprint(current);
            state.upsert(current.withDeliveryStatus(DeliveryStatus.FAILED));
        } finally {
            state.lock.unlock();
        }
        metricsCollector.incrementCounter("messaging.messages.sent", "status", "failed");
        log.warn("Message {} in conversation {} failed: {}", draft.getId(), draft.getConversationId(), error.getMessage());
        publishMessageChange(draft.getConversationId(), draft.getId());
    }

    private void onVoteFailed(ConversationState state, String pollId, String voterId, Throwable error) {
        boolean rolledBack;
        state.lock.lock();
        try {
            rolledBack = pollEngine.rollbackVote(pollId, voterId);
        } finally {
            state.lock.unlock();
        }
        metricsCollector.incrementCounter("messaging.polls.votes", "status", "failed");
        log.warn("Vote of {} on poll {} failed and was {}: {}", voterId, pollId,
                rolledBack ? "rolled back" : "already settled", error.getMessage());
        if (rolledBack) {
            stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED, state.conversation.getId(), pollId);
        }
    }

    private void onUploadReady(String attachmentId, StorageReference reference) {
        activeUploads.remove(attachmentId);
        Attachment attachment = attachments.get(attachmentId);
        ConversationState state = conversations.get(attachment.getConversationId());

        Message ready = null;
        boolean orphaned = false;
        state.lock.lock();
        try {
            Attachment current = attachments.get(attachmentId);
            if (current.getUploadStatus() != UploadStatus.UPLOADING) {
                orphaned = true;
            } else {
                attachments.put(attachmentId, current.toBuilder()
                        .uploadStatus(UploadStatus.READY)
                        .storageReference(reference)
                        .build());
                Message message = state.get(current.getMessageId());
                if (message != null) {
                    ready = message.withPayload(message.getPayload().withFileUrl(reference.getPublicUrl()));
                    state.upsert(ready);
                }
            }
        } finally {
            state.lock.unlock();
        }

        if (orphaned) {
            log.info("Attachment {} was discarded before its upload finished", attachmentId);
            deleteStoredFile(reference);
            return;
        }
        metricsCollector.incrementCounter("messaging.uploads", "status", "ready");
        log.info("Attachment {} ready at {}", attachmentId, reference.getPublicUrl());
        stateChangePublisher.publish(StateChangeType.ATTACHMENT_STATUS_CHANGED, attachment.getConversationId(), attachmentId);
        if (ready != null) {
            publishMessageChange(ready.getConversationId(), ready.getId());
            dispatch(ready);
        }
    }

    private void onUploadFailed(String attachmentId, Throwable error) {
        activeUploads.remove(attachmentId);
        Attachment attachment = attachments.get(attachmentId);
        ConversationState state = conversations.get(attachment.getConversationId());
        UploadFailureReason reason = failureReasonOf(error);

        state.lock.lock();
        try {
            Attachment current = attachments.get(attachmentId);
            if (current.getUploadStatus() != UploadStatus.UPLOADING) {
                return;
            }
            attachments.put(attachmentId, current.toBuilder()
                    .uploadStatus(UploadStatus.FAILED)
                    .failureReason(reason)
                    .build());
            Message message = state.get(current.getMessageId());
            if (message != null && message.getDeliveryStatus() == DeliveryStatus.PENDING) {
                forgetFingerprint(message);
                state.upsert(message.withDeliveryStatus(DeliveryStatus.FAILED));
            }
        } finally {
            state.lock.unlock();
        }
        metricsCollector.incrementCounter("messaging.uploads", "status", "failed");
        log.warn("Attachment {} failed ({}): {}", attachmentId, reason, error.getMessage());
        stateChangePublisher.publish(StateChangeType.ATTACHMENT_STATUS_CHANGED, attachment.getConversationId(), attachmentId);
        publishMessageChange(attachment.getConversationId(), attachment.getMessageId());
    }

    // ---------------------------------------------------------------- merging

    private void mergeConversation(Conversation remote) {
        ConversationState existing = conversations.putIfAbsent(remote.getId(), new ConversationState(remote, retiredIdMaxSize));
        if (existing == null) {
            log.debug("Conversation {} ({}) added", remote.getId(), remote.getDisplayName());
            return;
        }
        existing.lock.lock();
        try {
            Conversation local = existing.conversation;
            Conversation.ConversationBuilder merged = remote.toBuilder().unreadCount(local.getUnreadCount());
            if (local.getLastActivityAt() != null
                    && (remote.getLastActivityAt() == null || local.getLastActivityAt().isAfter(remote.getLastActivityAt()))) {
                merged.lastActivityAt(local.getLastActivityAt()).lastMessagePreview(local.getLastMessagePreview());
            }
            existing.conversation = merged.build();
        } finally {
            existing.lock.unlock();
        }
    }

    private List<Message> mergeFetched(ConversationState state, List<Message> remote, List<String> unknownPolls) {
        List<Message> snapshot;
        state.lock.lock();
        try {
            for (Message message : remote) {
                mergeRemote(state, message, unknownPolls);
            }
            state.hydrated = true;
            summarize(state);
            snapshot = state.snapshot();
        } finally {
            state.lock.unlock();
        }
        log.debug("Loaded {} messages for conversation {}", remote.size(), state.conversation.getId());
        stateChangePublisher.publish(StateChangeType.MESSAGES_CHANGED, state.conversation.getId(), null);
        stateChangePublisher.publish(StateChangeType.CONVERSATIONS_CHANGED, state.conversation.getId(), null);
        return snapshot;
    }

    private Mono<Void> mergeIncoming(ConversationState state, Message remote) {
        List<String> unknownPolls = new ArrayList<>();
        state.lock.lock();
        try {
            boolean isNew = mergeRemote(state, remote, unknownPolls);
            if (isNew && !participantId.equals(remote.getAuthorId())
                    && !viewCoordinator.isViewing(remote.getConversationId())) {
                state.conversation = state.conversation.toBuilder()
                        .unreadCount(state.conversation.getUnreadCount() + 1)
                        .build();
            }
            summarize(state);
        } finally {
            state.lock.unlock();
        }
        publishMessageChange(remote.getConversationId(), remote.getId());
        return fetchUnknownPolls(unknownPolls);
    }

    /**
     * Merges one canonical message, by id first and then by fingerprint against local pending entries.
     * Caller holds the conversation lock.
     *
     * @return true if the message was not known in any form
     */
    private boolean mergeRemote(ConversationState state, Message remote, List<String> unknownPolls) {
        if (state.isRetired(remote.getId())) {
            log.debug("Remote message {} was retired locally, ignored", remote.getId());
            return false;
        }
        Message known = state.get(remote.getId());
        if (known == null) {
            known = takePendingMatch(state, remote);
        }
        if (known != null) {
            forgetFingerprint(known);
        }
        Message canonical = remote.withDeliveryStatus(DeliveryStatus.SENT);
        state.upsert(canonical);
        conversationByMessageId.put(canonical.getId(), canonical.getConversationId());

        MessagePayload payload = canonical.getPayload();
        if (payload != null && payload.getType() == PayloadType.POLL && !pollEngine.isKnown(payload.getPollId())) {
            unknownPolls.add(payload.getPollId());
        }
        return known == null;
    }

    private Message takePendingMatch(ConversationState state, Message remote) {
        for (String key : MessageFingerprint.candidates(remote, timestampBucket)) {
            List<String> ids = pendingFingerprints.getIfPresent(key);
            if (ids == null) {
                continue;
            }
            for (String id : ids) {
                Message local = state.get(id);
                if (local != null && local.getDeliveryStatus() == DeliveryStatus.PENDING) {
                    state.retire(id);
                    conversationByMessageId.remove(id);
                    log.debug("Pending message {} reconciled with remote message {}", id, remote.getId());
                    return local;
                }
            }
        }
        return null;
    }

    private Mono<Void> fetchUnknownPolls(List<String> pollIds) {
        return Flux.fromIterable(pollIds)
                .concatMap(pollId -> backendGateway.fetchPoll(pollId)
                        .doOnNext(poll -> pollEngine.registerRemote(poll).ifPresent(registered ->
                                stateChangePublisher.publish(StateChangeType.POLL_TALLY_CHANGED,
                                        registered.getConversationId(), registered.getId())))
                        .onErrorResume(error -> {
                            log.warn("Could not load poll {}: {}", pollId, error.getMessage());
                            return Mono.empty();
                        }))
                .then();
    }

    // ---------------------------------------------------------------- helpers

    private ConversationState require(String conversationId) {
        ConversationState state = conversationId == null ? null : conversations.get(conversationId);
        if (state == null) {
            throw new ResourceNotFoundException("Conversation not found: " + conversationId);
        }
        return state;
    }

    private void hydrateIfNeeded(ConversationState state) {
        boolean start;
        state.lock.lock();
        try {
            start = !state.hydrated && !state.hydrating;
            if (start) {
                state.hydrating = true;
            }
        } finally {
            state.lock.unlock();
        }
        if (start) {
            String conversationId = state.conversation.getId();
            refreshMessages(conversationId).subscribe(
                    messages -> { },
                    error -> log.warn("Could not load messages of conversation {}: {}", conversationId, error.getMessage()));
        }
    }

    // Caller holds the conversation lock
    private void insertLocal(ConversationState state, Message pending) {
        state.upsert(pending);
        conversationByMessageId.put(pending.getId(), pending.getConversationId());
        pendingFingerprints.asMap().merge(MessageFingerprint.of(pending, timestampBucket), List.of(pending.getId()),
                (existing, added) -> {
                    List<String> ids = new ArrayList<>(existing);
                    ids.addAll(added);
                    return List.copyOf(ids);
                });
        summarize(state);
    }

    private void forgetFingerprint(Message message) {
        if (message.getDeliveryStatus() != DeliveryStatus.PENDING) {
            return;
        }
        pendingFingerprints.asMap().computeIfPresent(MessageFingerprint.of(message, timestampBucket), (key, ids) -> {
            List<String> remaining = ids.stream().filter(id -> !id.equals(message.getId())).toList();
            return remaining.isEmpty() ? null : remaining;
        });
    }

    // Caller holds the conversation lock
    private void summarize(ConversationState state) {
        Conversation current = state.conversation;
        Optional<Message> latest = state.latest();
        Conversation.ConversationBuilder summary = current.toBuilder();
        if (latest.isPresent()) {
            Message message = latest.get();
            summary.lastMessagePreview(message.getPayload().toPreview());
            if (current.getLastActivityAt() == null || message.getCreatedAt().isAfter(current.getLastActivityAt())) {
                summary.lastActivityAt(message.getCreatedAt());
            }
        } else if (state.hydrated) {
            summary.lastMessagePreview(Constants.EMPTY_CONVERSATION_PREVIEW);
        }
        state.conversation = summary.build();
    }

    private void deleteStoredFile(StorageReference reference) {
        log.info("Deleting orphaned upload {}", reference.getPath());
        backendGateway.deleteFile(reference).subscribe(
                unused -> { },
                error -> log.warn("Could not delete orphaned upload {}: {}", reference.getPath(), error.getMessage()));
    }

    private Attachment attachmentOf(Message message) {
        MessagePayload payload = message.getPayload();
        if (payload == null || payload.getType() != PayloadType.ATTACHMENT) {
            return null;
        }
        return attachments.get(payload.getAttachmentId());
    }

    private static UploadFailureReason failureReasonOf(Throwable error) {
        if (error instanceof AttachmentRejectedException rejected) {
            return rejected.toFailureReason();
        }
        if (error instanceof UploadCancelledException) {
            return UploadFailureReason.CANCELLED;
        }
        return UploadFailureReason.TRANSPORT_ERROR;
    }

    private Message newPendingMessage(String conversationId, MessagePayload payload) {
        return Message.builder()
                .id(newId())
                .conversationId(conversationId)
                .authorId(participantId)
                .createdAt(OffsetDateTime.now(clock))
                .payload(payload)
                .deliveryStatus(DeliveryStatus.PENDING)
                .build();
    }

    private void publishMessageChange(String conversationId, String messageId) {
        stateChangePublisher.publish(StateChangeType.MESSAGES_CHANGED, conversationId, messageId);
        stateChangePublisher.publish(StateChangeType.CONVERSATIONS_CHANGED, conversationId, null);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
