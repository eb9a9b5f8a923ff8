package com.filerepo.extraction.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class IndexingTimedOutException extends ExtractionException {
    private final String fileId;

    public IndexingTimedOutException(String fileId, Duration deadline) {
        super(ErrorKind.INDEXING_TIMED_OUT,
            "Indexing of file " + fileId + " exceeded its deadline of " + deadline.toSeconds() + "s; previous embeddings kept");
        this.fileId = fileId;
    }
}
