package com.example.messaging.chat.service;

import com.example.messaging.shared.model.Message;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Deterministic reconciliation key of a message: conversation, author, timestamp bucket and content.
 */
final class MessageFingerprint {

    private MessageFingerprint() {}

    static String of(Message message, Duration bucket) {
        return key(message, bucketOf(message.getCreatedAt(), bucket));
    }

    /**
     * Keys a remote message may match. The server stamps messages after the client does,
     * so the previous bucket is a candidate too.
     */
    static List<String> candidates(Message remote, Duration bucket) {
        long index = bucketOf(remote.getCreatedAt(), bucket);
        return List.of(key(remote, index), key(remote, index - 1));
    }

    static long bucketOf(OffsetDateTime timestamp, Duration bucket) {
        return Math.floorDiv(timestamp.toInstant().toEpochMilli(), bucket.toMillis());
    }

    private static String key(Message message, long bucketIndex) {
        return message.getConversationId() + '|' + message.getAuthorId() + '|' + bucketIndex + '|'
                + message.getPayload().fingerprintContent();
    }
}
