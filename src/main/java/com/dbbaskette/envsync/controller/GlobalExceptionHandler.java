package com.dbbaskette.envsync.controller;

import com.dbbaskette.envsync.error.EnvSyncException;
import com.dbbaskette.envsync.error.ErrorCode;
import com.dbbaskette.envsync.error.RateLimitExhaustedException;
import com.dbbaskette.envsync.error.SecondaryRateLimitException;
import com.dbbaskette.envsync.observability.CorrelationIdFilter;
import com.dbbaskette.envsync.security.Redactor;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Duration;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(EnvSyncException.class)
    public ResponseEntity<ErrorResponse> handleDomain(EnvSyncException e) {
        HttpStatus status = e.getCode().httpStatus();
        Long retryAfter = retryAfterSeconds(e);
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getCode(), e.getMessage());
        } else {
            log.warn("{}: {}", e.getCode(), e.getMessage());
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return builder.body(ErrorResponse.of(e.getCode(), e.getMessage(), retryAfter));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Request body is invalid";
        }
        log.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message, null));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        String message = e instanceof HttpMessageNotReadableException ? "Request body is not valid JSON" : e.getMessage();
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message, null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(new ErrorBody("NOT_FOUND", "No such endpoint",
                        CorrelationIdFilter.currentOrNew(), null)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null));
    }

    private Long retryAfterSeconds(EnvSyncException e) {
        if (e instanceof RateLimitExhaustedException exhausted && exhausted.getResetAt() != null) {
            return Math.max(0, Duration.between(clock.instant(), exhausted.getResetAt()).toSeconds());
        }
        if (e instanceof SecondaryRateLimitException secondary && secondary.getRetryAfter() != null) {
            return secondary.getRetryAfter().toSeconds();
        }
        return null;
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    public record ErrorResponse(ErrorBody error) {

        static ErrorResponse of(ErrorCode code, String message, Long retryAfter) {
            return new ErrorResponse(new ErrorBody(code.name(), Redactor.redact(message),
                    CorrelationIdFilter.currentOrNew(), retryAfter));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String code, String message, String correlationId, Long retryAfter) {}
}
