package com.example.messaging.shared.exception;

public enum ErrorCode {
    NOT_FOUND,
    INVALID_INPUT,
    ALREADY_VOTED,
    POLL_CLOSED,
    INVALID_OPTION,
    TRANSPORT_ERROR,
    TOO_LARGE,
    UNSUPPORTED_TYPE
}
