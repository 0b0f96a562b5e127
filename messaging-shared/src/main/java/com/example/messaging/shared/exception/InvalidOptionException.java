package com.example.messaging.shared.exception;

public class InvalidOptionException extends MessagingException {
    public InvalidOptionException(String message) {
        super(ErrorCode.INVALID_OPTION, message);
    }
}
