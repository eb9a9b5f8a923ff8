package com.filerepo.extraction.repository;

import com.filerepo.extraction.model.PageEmbedding;
import com.filerepo.extraction.model.PageRow;
import com.filerepo.extraction.model.PageSummary;
import com.filerepo.extraction.model.SearchScope;

import java.util.List;

/**
 * Durable (fileId, pageId) → (vector, OCR text) storage. All mutation is file-scoped and transactional.
 */
public interface EmbeddingStore {

    /**
     * Atomically replaces every stored page of {@code fileId} with {@code rows}. An empty list clears the file.
     *
     * @throws com.filerepo.extraction.exception.DimensionMismatchException if any vector has the wrong length;
     *         nothing is changed in that case
     */
    void put(String fileId, List<PageRow> rows);

    /**
     * Per-page existence and OCR text, ordered by page id. Vectors are not loaded.
     */
    List<PageSummary> get(String fileId);

    /**
     * Every row with a vector inside {@code scope}, ordered by file id then page id.
     */
    List<PageEmbedding> listCandidates(SearchScope scope);

    /**
     * @return number of rows removed; zero when the file had none
     */
    int deleteByFile(String fileId);
}
