package com.example.messaging.shared.exception;

/**
 * The backing service could not be reached, timed out, or refused the call.
 */
public class TransportException extends MessagingException {
    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
