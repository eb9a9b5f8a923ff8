package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FileEmbeddingsResponse(
    @JsonProperty("file_id")
    String fileId,

    List<EmbeddingPageItem> pages
) {}
