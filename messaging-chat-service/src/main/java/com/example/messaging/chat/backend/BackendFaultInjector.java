package com.example.messaging.chat.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Switches for simulating backend failures in the in-memory backend.
 */
@Component
@Slf4j
public class BackendFaultInjector {

    private final AtomicBoolean offline = new AtomicBoolean(false);
    private final AtomicBoolean uploadsStalled = new AtomicBoolean(false);
    private final Set<String> failingConversations = ConcurrentHashMap.newKeySet();

    public void setOffline(boolean enabled) {
        offline.set(enabled);
        log.warn("Backend offline simulation {}", enabled ? "ENABLED" : "DISABLED");
    }

    public boolean isOffline() {
        return offline.get();
    }

    /**
     * Stalled uploads never settle on their own; they end only by timeout or cancellation.
     */
    public void setUploadsStalled(boolean enabled) {
        uploadsStalled.set(enabled);
        log.warn("Upload stall simulation {}", enabled ? "ENABLED" : "DISABLED");
    }

    public boolean isUploadsStalled() {
        return uploadsStalled.get();
    }

    public void failConversation(String conversationId) {
        failingConversations.add(conversationId);
    }

    public void restoreConversation(String conversationId) {
        failingConversations.remove(conversationId);
    }

    public boolean shouldFail(String conversationId) {
        return offline.get() || (conversationId != null && failingConversations.contains(conversationId));
    }

    public void reset() {
        offline.set(false);
        uploadsStalled.set(false);
        failingConversations.clear();
    }
}
