package com.example.messaging.shared.model;

import com.example.messaging.shared.util.Constants.DeliveryStatus;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.OffsetDateTime;
import java.util.Comparator;

/**
 * A single chat message. Messages of a conversation are totally ordered by
 * (createdAt, id); see {@link #CHRONOLOGICAL}.
 */
@Value
@Builder(toBuilder = true)
@With
public class Message {

    public static final Comparator<Message> CHRONOLOGICAL = Comparator
            .comparing(Message::getCreatedAt, OffsetDateTime.timeLineOrder())
            .thenComparing(Message::getId);

    String id;
    String conversationId;
    String authorId;
    OffsetDateTime createdAt;
    MessagePayload payload;
    DeliveryStatus deliveryStatus;
}
