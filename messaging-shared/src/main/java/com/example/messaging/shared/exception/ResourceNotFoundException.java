package com.example.messaging.shared.exception;

public class ResourceNotFoundException extends MessagingException {
    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
