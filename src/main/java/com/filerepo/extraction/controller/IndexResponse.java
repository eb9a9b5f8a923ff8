package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.filerepo.extraction.model.IndexingOutcome;

import java.util.List;

public record IndexResponse(
    @JsonProperty("file_id")
    String fileId,

    IndexingOutcome outcome,

    @JsonProperty("pages_processed")
    int pagesProcessed,

    @JsonProperty("pages_total")
    int pagesTotal,

    @JsonProperty("failed_pages")
    List<Integer> failedPages,

    String message
) {}
