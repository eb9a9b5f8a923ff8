package com.filerepo.extraction.repository;

import com.filerepo.extraction.model.IndexingRun;
import com.filerepo.extraction.model.IndexingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcIndexingRunRepository implements IndexingRunRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<IndexingRun> indexingRunMapper = (rs, rowNum) -> new IndexingRun(
        rs.getString("file_id"),
        IndexingStatus.valueOf(rs.getString("status")),
        rs.getInt("current_page"),
        rs.getObject("total_pages", Integer.class),
        rs.getString("error_message"),
        rs.getInt("attempts"),
        rs.getObject("started_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public Optional<IndexingRun> claim(String fileId) {
        String sql = """
            INSERT INTO indexing_runs (file_id, status, current_page, attempts, started_at, updated_at)
            VALUES (:fileId, 'EXTRACTING', 0, 1, NOW(), NOW())
            ON CONFLICT (file_id) DO UPDATE
            SET status = 'EXTRACTING',
                current_page = 0,
                total_pages = NULL,
                error_message = NULL,
                attempts = indexing_runs.attempts + 1,
                started_at = NOW(),
                updated_at = NOW()
            WHERE indexing_runs.status NOT IN ('EXTRACTING', 'RECOGNIZING', 'EMBEDDING', 'PERSISTING')
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("fileId", fileId)
            .query(indexingRunMapper)
            .optional();
    }

    @Override
    public boolean updateProgress(String fileId, int attempt, IndexingStatus status, int currentPage, int totalPages) {
        String sql = """
            UPDATE indexing_runs
            SET current_page = CASE
                    WHEN status = :status THEN GREATEST(current_page, :currentPage)
                    ELSE :currentPage
                END,
                status = :status,
                total_pages = :totalPages,
                updated_at = NOW()
            WHERE file_id = :fileId
              AND attempts = :attempt
              AND status IN ('EXTRACTING', 'RECOGNIZING', 'EMBEDDING', 'PERSISTING')
            """;

        return jdbcClient.sql(sql)
            .param("status", status.name())
            .param("currentPage", currentPage)
            .param("totalPages", totalPages)
            .param("fileId", fileId)
            .param("attempt", attempt)
            .update() > 0;
    }

    @Override
    public boolean finish(String fileId, int attempt, IndexingStatus status, String errorMessage) {
        String sql = """
            UPDATE indexing_runs
            SET status = :status,
                error_message = :error,
                updated_at = NOW()
            WHERE file_id = :fileId
              AND attempts = :attempt
              AND status IN ('EXTRACTING', 'RECOGNIZING', 'EMBEDDING', 'PERSISTING')
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("status", status.name())
            .param("error", errorMessage)
            .param("fileId", fileId)
            .param("attempt", attempt)
            .update();

        return rowsAffected > 0;
    }

    @Override
    public Optional<IndexingRun> findByFileId(String fileId) {
        return jdbcClient.sql("SELECT * FROM indexing_runs WHERE file_id = :fileId")
            .param("fileId", fileId)
            .query(indexingRunMapper)
            .optional();
    }

    @Override
    @Transactional
    public List<String> failStaleRuns(int staleThresholdMinutes) {
        String sql = """
            UPDATE indexing_runs
            SET status = 'FAILED',
                error_message = 'Abandoned: no progress for ' || :staleMins || ' minutes',
                updated_at = NOW()
            WHERE file_id IN (
                SELECT file_id
                FROM indexing_runs
                WHERE status IN ('EXTRACTING', 'RECOGNIZING', 'EMBEDDING', 'PERSISTING')
                  AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE SKIP LOCKED
            )
            RETURNING file_id
            """;

        return jdbcClient.sql(sql)
            .param("staleMins", staleThresholdMinutes)
            .query(String.class)
            .list();
    }

    @Override
    public void deleteByFileId(String fileId) {
        jdbcClient.sql("DELETE FROM indexing_runs WHERE file_id = :fileId")
            .param("fileId", fileId)
            .update();
    }
}
