package com.filerepo.extraction.exception;

public class RecognizerUnavailableException extends ExtractionException {

    public RecognizerUnavailableException(String message) {
        super(ErrorKind.RECOGNIZER_UNAVAILABLE, message);
    }

    public RecognizerUnavailableException(String message, Throwable cause) {
        super(ErrorKind.RECOGNIZER_UNAVAILABLE, message, cause);
    }
}
