package com.example.messaging.chat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteMessageRequest {
    @NotBlank(message = "Author ID is required")
    private String authorId;

    @NotBlank(message = "Message text is required")
    private String text;
}
