package com.filerepo.extraction.exception;

public class EmbedderUnavailableException extends ExtractionException {

    public EmbedderUnavailableException(String message) {
        super(ErrorKind.EMBEDDER_UNAVAILABLE, message);
    }

    public EmbedderUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDER_UNAVAILABLE, message, cause);
    }
}
