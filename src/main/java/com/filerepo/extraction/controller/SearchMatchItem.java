package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SearchMatchItem(
    @JsonProperty("file_id")
    String fileId,

    @JsonProperty("page_id")
    int pageId,

    double score,

    String ocr
) {}
