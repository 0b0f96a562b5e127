package com.example.messaging.chat.exception;

import com.example.messaging.shared.dto.ErrorResponse;
import com.example.messaging.shared.exception.AttachmentRejectedException;
import com.example.messaging.shared.exception.ErrorCode;
import com.example.messaging.shared.exception.MessagingException;
import com.example.messaging.shared.exception.ResourceNotFoundException;
import com.example.messaging.shared.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ResourceNotFoundException: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ErrorResponse> handleTransportException(TransportException ex, ServerWebExchange exchange) {
        log.error("TransportException: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange);
    }

    @ExceptionHandler(AttachmentRejectedException.class)
    public ResponseEntity<ErrorResponse> handleAttachmentRejectedException(AttachmentRejectedException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getErrorCode() == ErrorCode.TOO_LARGE
                ? HttpStatus.PAYLOAD_TOO_LARGE
                : HttpStatus.UNSUPPORTED_MEDIA_TYPE;
        log.warn("AttachmentRejectedException ({}): {}", ex.getErrorCode(), ex.getMessage());
        return respond(status, status.getReasonPhrase(), ex.getMessage(), exchange);
    }

    /**
     * Invalid input, invalid option, already voted and closed poll.
     */
    @ExceptionHandler(MessagingException.class)
    public ResponseEntity<ErrorResponse> handleMessagingException(MessagingException ex, ServerWebExchange exchange) {
        HttpStatus status = statusOf(ex.getErrorCode());
        log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        return respond(status, ex.getErrorCode().name(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }
        ErrorResponse errorResponse = ErrorResponse.of(ex.getStatusCode().value(), ex.getStatusCode().toString(),
                ex.getReason(), exchange.getRequest().getPath().toString());
        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private static HttpStatus statusOf(ErrorCode errorCode) {
        switch (errorCode) {
            case ALREADY_VOTED:
            case POLL_CLOSED:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case TRANSPORT_ERROR:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case TOO_LARGE:
                return HttpStatus.PAYLOAD_TOO_LARGE;
            case UNSUPPORTED_TYPE:
                return HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case INVALID_INPUT:
            case INVALID_OPTION:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return new ResponseEntity<>(ErrorResponse.of(status.value(), error, message, exchange.getRequest().getPath().toString()), status);
    }
}
