package com.filerepo.extraction.exception;

import lombok.Getter;

@Getter
public class FileStillPresentException extends ExtractionException {
    private final String fileId;

    public FileStillPresentException(String fileId) {
        super(ErrorKind.FILE_STILL_PRESENT, "File is not deleted, its embeddings are kept: " + fileId);
        this.fileId = fileId;
    }
}
