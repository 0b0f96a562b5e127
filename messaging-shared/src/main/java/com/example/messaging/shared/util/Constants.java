package com.example.messaging.shared.util;

import java.util.Locale;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String EMPTY_CONVERSATION_PREVIEW = "Nenhuma mensagem";
    public static final String ATTACHMENT_PREVIEW_PREFIX = "📎 ";
    public static final String POLL_PREVIEW_PREFIX = "📊 ";

    public enum DeliveryStatus {
        PENDING,
        SENT,
        FAILED
    }

    public enum UploadStatus {
        UPLOADING,
        READY,
        FAILED
    }

    public enum UploadFailureReason {
        TOO_LARGE,
        UNSUPPORTED_TYPE,
        TRANSPORT_ERROR,
        CANCELLED
    }

    public enum PayloadType {
        TEXT,
        POLL,
        ATTACHMENT
    }

    public enum AttachmentKind {
        IMAGE,
        DOCUMENT,
        AUDIO;

        public static AttachmentKind fromContentType(String contentType) {
            if (contentType == null) {
                return DOCUMENT;
            }
            String normalized = contentType.toLowerCase(Locale.ROOT);
            if (normalized.startsWith("image/")) {
                return IMAGE;
            }
            if (normalized.startsWith("audio/")) {
                return AUDIO;
            }
            return DOCUMENT;
        }
    }

    public enum LayoutMode {
        DESKTOP,
        MOBILE_LIST,
        MOBILE_CHAT
    }

    public enum StateChangeType {
        CONVERSATIONS_CHANGED,
        MESSAGES_CHANGED,
        POLL_TALLY_CHANGED,
        ATTACHMENT_STATUS_CHANGED,
        VIEW_MODE_CHANGED
    }

    public enum RemoteEventType {
        MESSAGE_CREATED,
        POLL_VOTE_RECORDED
    }

    public enum SseEventType {
        CONNECTED,
        STATE_CHANGED,
        HEARTBEAT,
        SERVER_SHUTDOWN
    }
}
