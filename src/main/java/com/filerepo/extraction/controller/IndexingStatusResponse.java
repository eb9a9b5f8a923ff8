package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.filerepo.extraction.model.IndexingStatus;

import java.time.OffsetDateTime;

public record IndexingStatusResponse(
    @JsonProperty("file_id")
    String fileId,

    IndexingStatus status,

    @JsonProperty("current_page")
    int currentPage,

    @JsonProperty("total_pages")
    Integer totalPages,

    @JsonProperty("error_message")
    String errorMessage,

    int attempts,

    @JsonProperty("started_at")
    OffsetDateTime startedAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {}
