package com.example.messaging.chat.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViewportRequest {
    @Positive(message = "Viewport width must be positive")
    private int width;
}
