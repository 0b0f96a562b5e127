package com.example.messaging.shared.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * A thread of messages among a fixed set of participants. Group chats belong to a class (turma).
 */
@Value
@Builder(toBuilder = true)
public class Conversation {

    /** Most recent activity first, ties broken by id. */
    public static final Comparator<Conversation> BY_RECENT_ACTIVITY = Comparator
            .comparing(Conversation::getLastActivityAt,
                    Comparator.nullsLast(OffsetDateTime.timeLineOrder().reversed()))
            .thenComparing(Conversation::getId);

    String id;
    @Singular
    List<String> participantIds;
    String displayName;
    boolean groupChat;
    String classId;
    OffsetDateTime lastActivityAt;
    String lastMessagePreview;
    int unreadCount;
}
