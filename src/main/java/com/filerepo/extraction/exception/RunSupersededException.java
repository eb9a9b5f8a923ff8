package com.filerepo.extraction.exception;

import lombok.Getter;

/**
 * The run lost its claim on the file, either failed as abandoned or replaced by a newer claim.
 */
@Getter
public class RunSupersededException extends ExtractionException {
    private final String fileId;

    public RunSupersededException(String fileId) {
        super(ErrorKind.RUN_SUPERSEDED,
            "Indexing run for file " + fileId + " was abandoned or taken over; its results were discarded");
        this.fileId = fileId;
    }
}
