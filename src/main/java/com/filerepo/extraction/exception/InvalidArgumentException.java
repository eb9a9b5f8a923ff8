package com.filerepo.extraction.exception;

public class InvalidArgumentException extends ExtractionException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
