package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteEmbeddingsResponse(
    @JsonProperty("file_id")
    String fileId,

    @JsonProperty("pages_deleted")
    int pagesDeleted
) {}
