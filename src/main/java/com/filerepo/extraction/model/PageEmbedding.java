package com.filerepo.extraction.model;

public record PageEmbedding(
    String fileId,
    int pageId,
    float[] vector,
    String ocrText
) {}
