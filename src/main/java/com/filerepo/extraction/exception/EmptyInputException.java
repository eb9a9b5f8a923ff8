package com.filerepo.extraction.exception;

public class EmptyInputException extends ExtractionException {

    public EmptyInputException(String message) {
        super(ErrorKind.EMPTY_INPUT, message);
    }
}
