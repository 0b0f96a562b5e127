package com.example.messaging.shared.exception;

public class PollClosedException extends MessagingException {
    public PollClosedException(String message) {
        super(ErrorCode.POLL_CLOSED, message);
    }
}
