package com.example.messaging.shared.exception;

import lombok.Getter;

/**
 * Base of every error the messaging core reports to its callers.
 */
@Getter
public abstract class MessagingException extends RuntimeException {

    private final ErrorCode errorCode;

    protected MessagingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MessagingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
