package com.example.messaging.shared.exception;

import com.example.messaging.shared.util.Constants.UploadFailureReason;

/**
 * A file was refused before or during storage: too large, or of a type that may not be uploaded.
 */
public class AttachmentRejectedException extends MessagingException {

    private AttachmentRejectedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static AttachmentRejectedException tooLarge(String fileName, long sizeBytes, long maxSizeBytes) {
        return new AttachmentRejectedException(ErrorCode.TOO_LARGE,
                String.format("File '%s' has %d bytes, the limit is %d bytes", fileName, sizeBytes, maxSizeBytes));
    }

    public static AttachmentRejectedException unsupportedType(String fileName, String contentType) {
        return new AttachmentRejectedException(ErrorCode.UNSUPPORTED_TYPE,
                String.format("File '%s' of type '%s' is not allowed", fileName, contentType));
    }

    public UploadFailureReason toFailureReason() {
        return getErrorCode() == ErrorCode.TOO_LARGE
                ? UploadFailureReason.TOO_LARGE
                : UploadFailureReason.UNSUPPORTED_TYPE;
    }
}
