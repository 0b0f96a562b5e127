package com.example.messaging.shared.model;

import com.example.messaging.shared.util.Constants.AttachmentKind;
import com.example.messaging.shared.util.Constants.UploadFailureReason;
import com.example.messaging.shared.util.Constants.UploadStatus;
import lombok.Builder;
import lombok.Value;

/**
 * A file attached to a message. An attachment is created in {@code UPLOADING} state and
 * settles exactly once, to {@code READY} or {@code FAILED}. A retry is a new attachment.
 */
@Value
@Builder(toBuilder = true)
public class Attachment {
    String id;
    String messageId;
    String conversationId;
    String fileName;
    String contentType;
    AttachmentKind kind;
    long sizeBytes;
    StorageReference storageReference;
    UploadStatus uploadStatus;
    UploadFailureReason failureReason;
}
