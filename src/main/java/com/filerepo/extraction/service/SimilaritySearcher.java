package com.filerepo.extraction.service;

import com.filerepo.extraction.model.PageMatch;
import com.filerepo.extraction.model.SearchScope;

import java.util.List;

/**
 * Ranks the stored pages of a scope against a query vector.
 */
public interface SimilaritySearcher {

    /**
     * @return at most {@code k} (clamped to the configured maximum) matches, by descending cosine similarity,
     *         ties broken by ascending file id then page id; empty when the scope has no embeddings
     * @throws com.filerepo.extraction.exception.InvalidArgumentException if {@code k <= 0}
     * @throws com.filerepo.extraction.exception.DimensionMismatchException if the query vector has the wrong length
     */
    List<PageMatch> search(float[] queryVector, SearchScope scope, int k);
}
