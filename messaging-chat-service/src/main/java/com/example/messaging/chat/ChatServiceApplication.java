package com.example.messaging.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * In-app messaging service of the school dashboard.
 *
 * - Conversation list and chat with text messages, polls and file attachments
 * - Optimistic sends reconciled with the backing service's notification channel
 * - List/detail view state for desktop and mobile layouts
 * - SSE stream of state changes for the presentation layer
 */
@SpringBootApplication(scanBasePackages = "com.example.messaging")
public class ChatServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatServiceApplication.class, args);
    }
}
