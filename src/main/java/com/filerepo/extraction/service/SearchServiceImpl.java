package com.filerepo.extraction.service;

import com.filerepo.extraction.client.FileCatalog;
import com.filerepo.extraction.config.SearchProperties;
import com.filerepo.extraction.controller.SearchMatchItem;
import com.filerepo.extraction.controller.SearchResponse;
import com.filerepo.extraction.embedding.Embedder;
import com.filerepo.extraction.exception.EntityNotFoundException;
import com.filerepo.extraction.exception.InvalidArgumentException;
import com.filerepo.extraction.model.SearchScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private final Embedder embedder;
    private final SimilaritySearcher similaritySearcher;
    private final FileCatalog fileCatalog;
    private final SearchProperties searchProperties;

    @Override
    public SearchResponse searchTenant(String tenantId, String query, Integer topK) {
        return search(SearchScope.ofTenant(tenantId), query, topK);
    }

    @Override
    public SearchResponse searchFile(String tenantId, String fileId, String query, Integer topK) {
        if (!fileCatalog.isOwnedBy(tenantId, fileId)) {
            log.warn("File {} not found for tenant {}", fileId, tenantId);
            throw new EntityNotFoundException(fileId);
        }
        return search(SearchScope.ofFile(fileId), query, topK);
    }

    private SearchResponse search(SearchScope scope, String query, Integer topK) {
        String text = validateQuery(query);
        int k = topK == null ? searchProperties.defaultK() : topK;
        if (k <= 0) {
            throw new InvalidArgumentException("top_k must be positive");
        }

        log.debug("Semantic search in {} {}: k={}, query={}", scope.type(), scope.id(), k, text);

        float[] queryVector = embedder.embed(text);
        List<SearchMatchItem> matches = similaritySearcher.search(queryVector, scope, k).stream()
            .map(match -> new SearchMatchItem(match.fileId(), match.pageId(), match.score(), match.ocrText()))
            .toList();

        return new SearchResponse(matches);
    }

    private String validateQuery(String query) {
        String text = query == null ? "" : query.trim();
        if (text.length() < searchProperties.minQueryLength()) {
            throw new InvalidArgumentException("Query too short");
        }
        if (text.length() > searchProperties.maxQueryLength()) {
            throw new InvalidArgumentException("Query too long");
        }
        return text;
    }
}
