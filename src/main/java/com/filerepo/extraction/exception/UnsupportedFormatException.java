package com.filerepo.extraction.exception;

public class UnsupportedFormatException extends ExtractionException {

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message, cause);
    }
}
