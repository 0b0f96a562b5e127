package com.example.messaging.shared.dto;

import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.util.Constants.RemoteEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A notification pushed by the backing service's subscription channel.
 * {@code MESSAGE_CREATED} carries {@link #message}; {@code POLL_VOTE_RECORDED}
 * carries the poll, voter and option index.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RemoteEvent {
    private String eventId;
    private RemoteEventType type;
    private String conversationId;
    private Message message;
    private String pollId;
    private String voterId;
    private Integer optionIndex;
    private OffsetDateTime timestamp;
}
