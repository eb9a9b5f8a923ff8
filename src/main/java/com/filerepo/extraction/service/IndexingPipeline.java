package com.filerepo.extraction.service;

import com.filerepo.extraction.model.IndexingResult;

public interface IndexingPipeline {

    /**
     * Extracts, recognizes and embeds every page of {@code fileId}, then atomically replaces its stored pages.
     * Single-page failures are absorbed and reported in the result; when every page fails nothing is replaced.
     *
     * @throws com.filerepo.extraction.exception.AlreadyIndexingException if another run holds the file
     * @throws com.filerepo.extraction.exception.IndexingTimedOutException if the run exceeds its deadline;
     *         prior embeddings are left untouched
     */
    IndexingResult indexFile(String fileId);
}
