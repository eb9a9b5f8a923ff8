package com.filerepo.extraction.model;

public enum IndexingStatus {
    NOT_INDEXED,
    EXTRACTING,
    RECOGNIZING,
    EMBEDDING,
    PERSISTING,
    INDEXED,
    FAILED;

    public boolean isActive() {
        return this == EXTRACTING || this == RECOGNIZING || this == EMBEDDING || this == PERSISTING;
    }
}
