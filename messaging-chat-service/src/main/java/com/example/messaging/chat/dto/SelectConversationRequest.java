package com.example.messaging.chat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SelectConversationRequest {
    @NotBlank(message = "Conversation ID is required")
    private String conversationId;
}
