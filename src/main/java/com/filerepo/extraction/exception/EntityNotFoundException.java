package com.filerepo.extraction.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends ExtractionException {
    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super(ErrorKind.NOT_FOUND, "File not found: " + entityId);
        this.entityId = entityId;
    }
}
