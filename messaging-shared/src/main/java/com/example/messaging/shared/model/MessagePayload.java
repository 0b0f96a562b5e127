package com.example.messaging.shared.model;

import com.example.messaging.shared.util.Constants;
import com.example.messaging.shared.util.Constants.PayloadType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Content of a chat message: plain text, a reference to a poll, or a reference to an attachment.
 */
@Value
@Builder(toBuilder = true)
@With
public class MessagePayload {
    PayloadType type;
    String text;          // message text, or the poll question for POLL payloads
    String pollId;
    String attachmentId;
    String fileName;
    String fileUrl;       // set once the attachment is stored

    public static MessagePayload text(String text) {
        return MessagePayload.builder()
                .type(PayloadType.TEXT)
                .text(text)
                .build();
    }

    public static MessagePayload poll(String pollId, String question) {
        return MessagePayload.builder()
                .type(PayloadType.POLL)
                .pollId(pollId)
                .text(question)
                .build();
    }

    public static MessagePayload attachment(String attachmentId, String fileName) {
        return MessagePayload.builder()
                .type(PayloadType.ATTACHMENT)
                .attachmentId(attachmentId)
                .fileName(fileName)
                .build();
    }

    /**
     * The line shown under the conversation name in the conversation list.
     */
    public String toPreview() {
        if (type == null) {
            return Constants.EMPTY_CONVERSATION_PREVIEW;
        }
        switch (type) {
            case POLL:
                return Constants.POLL_PREVIEW_PREFIX + text;
            case ATTACHMENT:
                return Constants.ATTACHMENT_PREVIEW_PREFIX + fileName;
            case TEXT:
            default:
                return text;
        }
    }

    /**
     * The content half of the reconciliation fingerprint.
     */
    public String fingerprintContent() {
        String content = type == PayloadType.ATTACHMENT ? fileName : text;
        return type + ":" + (content == null ? "" : content);
    }
}
