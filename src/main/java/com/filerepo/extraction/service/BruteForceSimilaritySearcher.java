package com.filerepo.extraction.service;

import com.filerepo.extraction.config.SearchProperties;
import com.filerepo.extraction.exception.DimensionMismatchException;
import com.filerepo.extraction.exception.InvalidArgumentException;
import com.filerepo.extraction.model.PageEmbedding;
import com.filerepo.extraction.model.PageMatch;
import com.filerepo.extraction.model.SearchScope;
import com.filerepo.extraction.repository.EmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact top-k by scanning every candidate of the scope. O(n·D) per query.
 */
@Slf4j
@Service
public class BruteForceSimilaritySearcher implements SimilaritySearcher {

    static final Comparator<PageMatch> RANKING = Comparator
        .comparingDouble(PageMatch::score).reversed()
        .thenComparing(PageMatch::fileId)
        .thenComparingInt(PageMatch::pageId);

    private final EmbeddingStore embeddingStore;
    private final SearchProperties searchProperties;
    private final int dimension;

    public BruteForceSimilaritySearcher(
        EmbeddingStore embeddingStore,
        SearchProperties searchProperties,
        @Value("${app.embedding.dimension:768}") int dimension
    ) {
        this.embeddingStore = embeddingStore;
        this.searchProperties = searchProperties;
        this.dimension = dimension;
    }

    @Override
    public List<PageMatch> search(float[] queryVector, SearchScope scope, int k) {
        if (k <= 0) {
            throw new InvalidArgumentException("k must be positive, got " + k);
        }
        if (queryVector == null) {
            throw new InvalidArgumentException("Query vector cannot be null");
        }
        if (queryVector.length != dimension) {
            throw new DimensionMismatchException(dimension, queryVector.length);
        }

        int limit = Math.min(k, searchProperties.maxK());
        List<PageEmbedding> candidates = embeddingStore.listCandidates(scope);
        log.debug("Ranking {} candidates in {} {} (k={})", candidates.size(), scope.type(), scope.id(), limit);

        // worst retained match at the head
        PriorityQueue<PageMatch> top = new PriorityQueue<>(limit + 1, RANKING.reversed());
        for (PageEmbedding candidate : candidates) {
            if (candidate.vector().length != dimension) {
                log.warn("Skipping page {} of file {}: stored vector has {} dimensions",
                    candidate.pageId(), candidate.fileId(), candidate.vector().length);
                continue;
            }
            top.add(new PageMatch(
                candidate.fileId(),
                candidate.pageId(),
                CosineSimilarity.between(queryVector, candidate.vector()),
                candidate.ocrText()));
            if (top.size() > limit) {
                top.poll();
            }
        }

        List<PageMatch> ranked = new ArrayList<>(top);
        ranked.sort(RANKING);
        return ranked;
    }
}
