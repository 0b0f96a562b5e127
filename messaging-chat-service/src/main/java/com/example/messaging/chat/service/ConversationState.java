package com.example.messaging.chat.service;

import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.Message;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One conversation and its message sequence. All access goes through {@link #lock};
 * {@link #conversation} is also readable without it.
 */
final class ConversationState {

    final ReentrantLock lock = new ReentrantLock();

    volatile Conversation conversation;

    // sorted by Message.CHRONOLOGICAL
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, Message> messagesById = new HashMap<>();
    // ids that must never be (re)inserted: discarded by the user, or replaced by their remote echo.
    // Bounded; an id evicted here is long past any late acknowledgment or echo.
    private final Cache<String, Boolean> retiredIds;

    boolean hydrated;
    boolean hydrating;

    ConversationState(Conversation conversation, long retiredIdMaxSize) {
        this.conversation = conversation;
        this.retiredIds = Caffeine.newBuilder()
                .maximumSize(retiredIdMaxSize)
                .executor(Runnable::run)
                .build();
    }

    Message get(String messageId) {
        return messagesById.get(messageId);
    }

    boolean isRetired(String messageId) {
        return retiredIds.getIfPresent(messageId) != null;
    }

    /**
     * Inserts the message, or replaces the entry with the same id. A changed timestamp moves the entry.
     */
    void upsert(Message message) {
        Message previous = messagesById.put(message.getId(), message);
        if (previous != null) {
            removeFromSequence(previous);
        }
        int index = Collections.binarySearch(messages, message, Message.CHRONOLOGICAL);
        messages.add(index < 0 ? -index - 1 : index, message);
    }

    Message retire(String messageId) {
        retiredIds.put(messageId, Boolean.TRUE);
        Message removed = messagesById.remove(messageId);
        if (removed != null) {
            removeFromSequence(removed);
        }
        return removed;
    }

    List<Message> snapshot() {
        return List.copyOf(messages);
    }

    Optional<Message> latest() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    long retiredCount() {
        retiredIds.cleanUp();
        return retiredIds.estimatedSize();
    }

    private void removeFromSequence(Message message) {
        int index = Collections.binarySearch(messages, message, Message.CHRONOLOGICAL);
        if (index < 0) {
            throw new IllegalStateException("Message " + message.getId() + " is indexed but not in sequence");
        }
        messages.remove(index);
    }
}
