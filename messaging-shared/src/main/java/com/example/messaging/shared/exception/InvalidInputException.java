package com.example.messaging.shared.exception;

public class InvalidInputException extends MessagingException {
    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
