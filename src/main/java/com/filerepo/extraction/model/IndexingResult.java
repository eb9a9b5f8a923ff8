package com.filerepo.extraction.model;

import java.util.List;

public record IndexingResult(
    String fileId,
    IndexingOutcome outcome,
    int pagesProcessed,
    int pagesTotal,
    List<Integer> failedPages,
    String message
) {
    public IndexingResult {
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
        if (pagesProcessed > pagesTotal) {
            throw new IllegalArgumentException(
                "pagesProcessed (" + pagesProcessed + ") exceeds pagesTotal (" + pagesTotal + ")");
        }
    }

    public static IndexingResult empty(String fileId) {
        return new IndexingResult(fileId, IndexingOutcome.INDEXED, 0, 0, List.of(), "Document has no pages");
    }
}
