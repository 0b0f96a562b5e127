package com.example.messaging.shared.backend;

import com.example.messaging.shared.dto.RemoteEvent;
import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.FileHandle;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.StorageReference;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Narrow contract to the hosted data store behind the messaging core.
 * Implementations signal {@link com.example.messaging.shared.exception.TransportException}
 * on network failure.
 */
public interface MessagingBackend {

    Flux<Conversation> fetchConversations(String participantId);

    Flux<Message> fetchMessages(String conversationId);

    Mono<Poll> fetchPoll(String pollId);

    /**
     * Persists a draft. The draft's id and author are adopted; the returned message
     * carries the canonical creation timestamp.
     */
    Mono<Message> postMessage(Message draft);

    /**
     * Persists a poll definition before its hosting message is posted.
     */
    Mono<Void> postPoll(Poll poll);

    Mono<Void> postVote(String pollId, String voterId, int optionIndex);

    /**
     * Stores a file under the owner's folder.
     * May fail with {@link com.example.messaging.shared.exception.AttachmentRejectedException}.
     */
    Mono<StorageReference> storeFile(String ownerId, FileHandle file);

    Mono<Void> deleteFile(StorageReference reference);

    /**
     * Newly created messages and poll votes for conversations the participant belongs to.
     */
    Flux<RemoteEvent> subscribe(String participantId);
}
