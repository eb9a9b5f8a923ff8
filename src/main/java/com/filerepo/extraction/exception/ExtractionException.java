package com.filerepo.extraction.exception;

import lombok.Getter;

@Getter
public abstract class ExtractionException extends RuntimeException {
    private final ErrorKind kind;

    protected ExtractionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ExtractionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
