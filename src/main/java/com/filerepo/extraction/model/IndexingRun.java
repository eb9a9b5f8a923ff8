package com.filerepo.extraction.model;

import java.time.OffsetDateTime;

public record IndexingRun(
    String fileId,
    IndexingStatus status,
    int currentPage,
    Integer totalPages,
    String errorMessage,
    int attempts,
    OffsetDateTime startedAt,
    OffsetDateTime updatedAt
) {}
