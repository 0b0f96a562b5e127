package com.example.messaging.chat.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {
    private String voterId;   // defaults to the session participant

    @NotNull(message = "Option index is required")
    private Integer optionIndex;
}
