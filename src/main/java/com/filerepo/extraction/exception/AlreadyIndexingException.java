package com.filerepo.extraction.exception;

import lombok.Getter;

@Getter
public class AlreadyIndexingException extends ExtractionException {
    private final String fileId;

    public AlreadyIndexingException(String fileId) {
        super(ErrorKind.ALREADY_INDEXING, "File is already being indexed: " + fileId);
        this.fileId = fileId;
    }
}
