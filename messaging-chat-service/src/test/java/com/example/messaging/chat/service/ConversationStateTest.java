package com.example.messaging.chat.service;

import com.example.messaging.shared.model.Conversation;
import com.example.messaging.shared.model.Message;
import com.example.messaging.shared.model.MessagePayload;
import com.example.messaging.shared.util.Constants.DeliveryStatus;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationStateTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private static ConversationState state(long retiredIdMaxSize) {
        return new ConversationState(Conversation.builder().id("conv-a").displayName("Turma A").build(), retiredIdMaxSize);
    }

    private static Message message(String id, int secondsAfterStart) {
        return Message.builder()
                .id(id)
                .conversationId("conv-a")
                .authorId("prof-ana")
                .createdAt(T0.plusSeconds(secondsAfterStart))
                .payload(MessagePayload.text("texto " + id))
                .deliveryStatus(DeliveryStatus.SENT)
                .build();
    }

    @Test
    void retiredMessageLeavesTheSequenceAndIsRemembered() {
        ConversationState state = state(100);
        state.upsert(message("m1", 1));
        state.upsert(message("m2", 2));

        Message removed = state.retire("m1");

        assertThat(removed.getId()).isEqualTo("m1");
        assertThat(state.snapshot()).extracting(Message::getId).containsExactly("m2");
        assertThat(state.isRetired("m1")).isTrue();
        assertThat(state.isRetired("m2")).isFalse();
    }

    @Test
    void retiredIdsAreBounded() {
        ConversationState state = state(5);

        for (int i = 0; i < 100; i++) {
            state.retire("m" + i);
        }

        assertThat(state.retiredCount()).isLessThanOrEqualTo(5);
    }
}
