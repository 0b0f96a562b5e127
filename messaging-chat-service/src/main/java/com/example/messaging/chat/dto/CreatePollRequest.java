package com.example.messaging.chat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Option count and option text are checked by the poll engine, so a malformed poll
 * gets the same error whether it arrives over HTTP or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePollRequest {
    @NotBlank(message = "Poll question is required")
    private String question;

    @NotNull(message = "Poll options are required")
    private List<String> options;
}
