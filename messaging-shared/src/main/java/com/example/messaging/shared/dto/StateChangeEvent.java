package com.example.messaging.shared.dto;

import com.example.messaging.shared.util.Constants.StateChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateChangeEvent {
    private StateChangeType type;
    private String conversationId;
    private String entityId;  // message, poll or attachment id; null for list and view changes
    private OffsetDateTime timestamp;
}
