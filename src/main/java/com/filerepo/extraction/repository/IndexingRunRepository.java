package com.filerepo.extraction.repository;

import com.filerepo.extraction.model.IndexingRun;
import com.filerepo.extraction.model.IndexingStatus;

import java.util.List;
import java.util.Optional;

public interface IndexingRunRepository {

    /**
     * Starts a run for {@code fileId} unless one is already active. The returned {@link IndexingRun#attempts()}
     * identifies this run in later progress and finish calls.
     *
     * @return the claimed run in {@link IndexingStatus#EXTRACTING}, or empty when another run holds the file
     */
    Optional<IndexingRun> claim(String fileId);

    /**
     * Moves the run claimed as {@code attempt} to {@code status}. Within one status {@code currentPage} only
     * grows, since pages complete out of order.
     *
     * @return false when that run is no longer active, was superseded by a newer claim, or its record is gone
     */
    boolean updateProgress(String fileId, int attempt, IndexingStatus status, int currentPage, int totalPages);

    /**
     * Ends the run claimed as {@code attempt}. A run that was already failed as abandoned, or superseded by a
     * newer claim, is left untouched.
     *
     * @return false when nothing was updated
     */
    boolean finish(String fileId, int attempt, IndexingStatus status, String errorMessage);

    Optional<IndexingRun> findByFileId(String fileId);

    List<String> failStaleRuns(int staleThresholdMinutes);

    void deleteByFileId(String fileId);
}
