package com.filerepo.extraction.exception;

public class CorruptDocumentException extends ExtractionException {

    public CorruptDocumentException(String message) {
        super(ErrorKind.CORRUPT_DOCUMENT, message);
    }

    public CorruptDocumentException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_DOCUMENT, message, cause);
    }
}
