package com.filerepo.extraction.model;

public enum IndexingOutcome {
    INDEXED,
    PARTIALLY_INDEXED,
    FAILED
}
