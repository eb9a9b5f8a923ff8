package com.filerepo.extraction.exception;

public enum ErrorKind {
    UNSUPPORTED_FORMAT(false),
    CORRUPT_DOCUMENT(false),
    RECOGNIZER_UNAVAILABLE(true),
    EMBEDDER_UNAVAILABLE(true),
    INDEXING_TIMED_OUT(true),
    DIMENSION_MISMATCH(false),
    INVALID_ARGUMENT(false),
    EMPTY_INPUT(false),
    ALREADY_INDEXING(true),
    RUN_SUPERSEDED(true),
    FILE_STILL_PRESENT(false),
    RATE_LIMITED(true),
    NOT_FOUND(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
