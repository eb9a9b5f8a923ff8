package com.filerepo.extraction.controller;

import com.filerepo.extraction.exception.ErrorKind;
import com.filerepo.extraction.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ErrorResponse> handleExtraction(ExtractionException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        }
        return build(ex.getMessage(), ex.getKind(), ex.isRetryable(), status);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> String.format("'%s' %s", error.getField(), error.getDefaultMessage()))
            .collect(Collectors.joining(", "));
        return build(message, ErrorKind.INVALID_ARGUMENT, false, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return build("Malformed request", ErrorKind.INVALID_ARGUMENT, false, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return build("An unexpected error occurred", null, false, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case UNSUPPORTED_FORMAT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case CORRUPT_DOCUMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_ARGUMENT, DIMENSION_MISMATCH, EMPTY_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_INDEXING, RUN_SUPERSEDED, FILE_STILL_PRESENT -> HttpStatus.CONFLICT;
            case RECOGNIZER_UNAVAILABLE, EMBEDDER_UNAVAILABLE, RATE_LIMITED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INDEXING_TIMED_OUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private static ResponseEntity<ErrorResponse> build(String message, ErrorKind kind, boolean retryable, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            kind,
            retryable,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
