package com.filerepo.extraction.repository;

import com.filerepo.extraction.client.FileCatalog;
import com.filerepo.extraction.exception.DimensionMismatchException;
import com.filerepo.extraction.exception.InvalidArgumentException;
import com.filerepo.extraction.model.PageEmbedding;
import com.filerepo.extraction.model.PageRow;
import com.filerepo.extraction.model.PageSummary;
import com.filerepo.extraction.model.SearchScope;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcEmbeddingStore implements EmbeddingStore {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final FileCatalog fileCatalog;

    @Value("${app.embedding.dimension:768}")
    private int dimension;

    private final RowMapper<PageEmbedding> pageEmbeddingMapper = (rs, rowNum) -> new PageEmbedding(
        rs.getString("file_id"),
        rs.getInt("page_id"),
        new PGvector(rs.getString("embedding")).toArray(),
        rs.getString("ocr_text")
    );

    private final RowMapper<PageSummary> pageSummaryMapper = (rs, rowNum) -> new PageSummary(
        rs.getInt("page_id"),
        rs.getString("ocr_text"),
        rs.getBoolean("has_vector")
    );

    @Override
    @Transactional
    public void put(String fileId, List<PageRow> rows) {
        requireFileId(fileId);
        validate(rows);

        int removed = jdbcClient.sql("DELETE FROM page_embeddings WHERE file_id = :fileId")
            .param("fileId", fileId)
            .update();

        if (!rows.isEmpty()) {
            insertAll(fileId, rows);
        }

        log.info("File {}: replaced {} page rows with {}", fileId, removed, rows.size());
    }

    private void insertAll(String fileId, List<PageRow> rows) {
        String sql = """
            INSERT INTO page_embeddings (file_id, page_id, embedding, ocr_text)
            VALUES (?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                PageRow row = rows.get(i);
                ps.setString(1, fileId);
                ps.setInt(2, row.pageId());
                if (row.hasVector()) {
                    ps.setObject(3, new PGvector(row.vector()));
                } else {
                    ps.setNull(3, Types.OTHER);
                }
                ps.setString(4, row.ocrText());
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
    }

    @Override
    public List<PageSummary> get(String fileId) {
        return jdbcClient.sql("""
                SELECT page_id, ocr_text, embedding IS NOT NULL AS has_vector
                FROM page_embeddings
                WHERE file_id = :fileId
                ORDER BY page_id ASC
                """)
            .param("fileId", fileId)
            .query(pageSummaryMapper)
            .list();
    }

    @Override
    public List<PageEmbedding> listCandidates(SearchScope scope) {
        return switch (scope.type()) {
            case FILE -> jdbcClient.sql("""
                    SELECT file_id, page_id, embedding::text AS embedding, ocr_text
                    FROM page_embeddings
                    WHERE file_id = :fileId
                      AND embedding IS NOT NULL
                    ORDER BY page_id ASC
                    """)
                .param("fileId", scope.id())
                .query(pageEmbeddingMapper)
                .list();
            case TENANT -> listTenantCandidates(scope.id());
        };
    }

    private List<PageEmbedding> listTenantCandidates(String tenantId) {
        List<String> fileIds = fileCatalog.listFilesForTenant(tenantId);
        if (fileIds.isEmpty()) {
            return List.of();
        }

        String sql = """
            SELECT file_id, page_id, embedding::text AS embedding, ocr_text
            FROM page_embeddings
            WHERE file_id = ANY (?)
              AND embedding IS NOT NULL
            ORDER BY file_id ASC, page_id ASC
            """;

        // one array parameter, whatever the number of files
        return jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setArray(1, con.createArrayOf("varchar", fileIds.toArray(new String[0])));
            return ps;
        }, pageEmbeddingMapper);
    }

    @Override
    @Transactional
    public int deleteByFile(String fileId) {
        int removed = jdbcClient.sql("DELETE FROM page_embeddings WHERE file_id = :fileId")
            .param("fileId", fileId)
            .update();

        if (removed > 0) {
            log.info("File {}: deleted {} page rows", fileId, removed);
        }
        return removed;
    }

    private void validate(List<PageRow> rows) {
        if (rows == null) {
            throw new InvalidArgumentException("Rows cannot be null");
        }
        Set<Integer> seen = new HashSet<>();
        for (PageRow row : rows) {
            if (!seen.add(row.pageId())) {
                throw new InvalidArgumentException("Duplicate page id " + row.pageId());
            }
            if (row.hasVector() && row.vector().length != dimension) {
                throw new DimensionMismatchException(dimension, row.vector().length);
            }
        }
    }

    private static void requireFileId(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new InvalidArgumentException("File id cannot be empty");
        }
    }
}
