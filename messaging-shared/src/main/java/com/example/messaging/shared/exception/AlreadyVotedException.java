package com.example.messaging.shared.exception;

public class AlreadyVotedException extends MessagingException {
    public AlreadyVotedException(String message) {
        super(ErrorCode.ALREADY_VOTED, message);
    }
}
