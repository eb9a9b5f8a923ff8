package com.filerepo.extraction.exception;

public class RateLimitExceededException extends ExtractionException {

    public RateLimitExceededException(String message) {
        super(ErrorKind.RATE_LIMITED, message);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, message, cause);
    }
}
