package com.filerepo.extraction.repository;

import com.filerepo.extraction.exception.DimensionMismatchException;
import com.filerepo.extraction.exception.InvalidArgumentException;
import com.filerepo.extraction.model.PageEmbedding;
import com.filerepo.extraction.model.PageRow;
import com.filerepo.extraction.model.PageSummary;
import com.filerepo.extraction.model.SearchScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcEmbeddingStoreTest extends BaseIntegrationTest {

    @Autowired
    private EmbeddingStore embeddingStore;

    @Autowired
    private JdbcClient jdbcClient;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Value("${app.embedding.dimension}")
    private int dimension;

    private TransactionTemplate transactionTemplate;
    private String fileId;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        fileId = UUID.randomUUID().toString();
    }

    @Nested
    @DisplayName("Replace-all")
    class ReplaceAll {

        @Test
        @DisplayName("Stored pages are listed by page id with text and vector presence")
        void shouldStoreAndSummarizePages() {
            embeddingStore.put(fileId, List.of(
                new PageRow(2, vector(2), "second"),
                new PageRow(1, vector(1), "first"),
                PageRow.blank(3, "")));

            List<PageSummary> pages = embeddingStore.get(fileId);

            assertThat(pages).containsExactly(
                new PageSummary(1, "first", true),
                new PageSummary(2, "second", true),
                new PageSummary(3, "", false));
        }

        @Test
        @DisplayName("Re-indexing a 2-page file with 5 pages leaves exactly the new set")
        void shouldReplaceWholeGeneration() {
            embeddingStore.put(fileId, rows(2, "old"));

            embeddingStore.put(fileId, rows(5, "new"));

            List<PageSummary> pages = embeddingStore.get(fileId);
            assertThat(pages).extracting(PageSummary::pageId).containsExactly(1, 2, 3, 4, 5);
            assertThat(pages).extracting(PageSummary::ocrText).allMatch(text -> text.startsWith("new"));
        }

        @Test
        @DisplayName("Re-indexing with fewer pages removes the stale tail")
        void shouldDropStalePages() {
            embeddingStore.put(fileId, rows(5, "old"));

            embeddingStore.put(fileId, rows(2, "new"));

            assertThat(embeddingStore.get(fileId)).extracting(PageSummary::pageId).containsExactly(1, 2);
        }

        @Test
        @DisplayName("An empty replacement clears the file")
        void shouldClearWithEmptyList() {
            embeddingStore.put(fileId, rows(3, "old"));

            embeddingStore.put(fileId, List.of());

            assertThat(embeddingStore.get(fileId)).isEmpty();
        }

        @Test
        @DisplayName("A malformed vector is rejected and the previous generation survives")
        void shouldRejectWrongDimensionAtomically() {
            embeddingStore.put(fileId, rows(2, "old"));

            List<PageRow> bad = List.of(
                new PageRow(1, vector(1), "new"),
                new PageRow(2, new float[dimension - 1], "broken"));

            assertThatThrownBy(() -> embeddingStore.put(fileId, bad))
                .isInstanceOf(DimensionMismatchException.class);
            assertThat(embeddingStore.get(fileId)).extracting(PageSummary::ocrText)
                .containsExactly("old 1", "old 2");
        }

        @Test
        @DisplayName("Duplicate page ids are rejected")
        void shouldRejectDuplicatePages() {
            List<PageRow> duplicate = List.of(new PageRow(1, vector(1), "a"), new PageRow(1, vector(2), "b"));

            assertThatThrownBy(() -> embeddingStore.put(fileId, duplicate))
                .isInstanceOf(InvalidArgumentException.class);
        }

        @Test
        @DisplayName("A reader never sees a half-replaced file")
        void shouldExposeOldGenerationUntilCommit() {
            embeddingStore.put(fileId, rows(2, "old"));

            transactionTemplate.executeWithoutResult(status -> {
                embeddingStore.put(fileId, rows(5, "new"));

                List<PageSummary> seenElsewhere = CompletableFuture
                    .supplyAsync(() -> embeddingStore.get(fileId))
                    .join();

                assertThat(seenElsewhere).extracting(PageSummary::ocrText).containsExactly("old 1", "old 2");
            });

            assertThat(embeddingStore.get(fileId)).hasSize(5);
        }

        @Test
        @DisplayName("Vectors are read back with their values intact")
        void shouldPreserveVectorValues() {
            float[] original = vector(7);
            embeddingStore.put(fileId, List.of(new PageRow(1, original, "text")));

            PageEmbedding stored = embeddingStore.listCandidates(SearchScope.ofFile(fileId)).get(0);

            assertThat(stored.vector()).containsExactly(original);
        }
    }

    @Nested
    @DisplayName("Candidates")
    class Candidates {

        @Test
        @DisplayName("File scope returns only that file's pages with vectors")
        void shouldListFileCandidates() {
            String other = UUID.randomUUID().toString();
            embeddingStore.put(fileId, List.of(new PageRow(1, vector(1), "a"), PageRow.blank(2, "")));
            embeddingStore.put(other, rows(3, "other"));

            List<PageEmbedding> candidates = embeddingStore.listCandidates(SearchScope.ofFile(fileId));

            assertThat(candidates).extracting(PageEmbedding::fileId).containsOnly(fileId);
            assertThat(candidates).extracting(PageEmbedding::pageId).containsExactly(1);
        }

        @Test
        @DisplayName("Tenant scope covers every live file of the tenant and nothing else")
        void shouldListTenantCandidates() {
            String tenant = UUID.randomUUID().toString();
            String otherTenant = UUID.randomUUID().toString();
            String fileA = registerFile(tenant, false);
            String fileB = registerFile(tenant, false);
            String deleted = registerFile(tenant, true);
            String foreign = registerFile(otherTenant, false);
            embeddingStore.put(fileA, rows(3, "a"));
            embeddingStore.put(fileB, rows(2, "b"));
            embeddingStore.put(deleted, rows(1, "deleted"));
            embeddingStore.put(foreign, rows(1, "foreign"));

            List<PageEmbedding> candidates = embeddingStore.listCandidates(SearchScope.ofTenant(tenant));

            assertThat(candidates).hasSize(5);
            assertThat(candidates).extracting(PageEmbedding::fileId).containsOnly(fileA, fileB);
        }

        @Test
        @DisplayName("Tenant scope works for a tenant with more files than a statement has bind slots")
        void shouldListCandidatesForVeryLargeTenant() {
            String tenant = UUID.randomUUID().toString();
            jdbcClient.sql("""
                    INSERT INTO files (id, tenant_id, file_path)
                    SELECT gen_random_uuid(), ?, '/tmp/bulk.pdf'
                    FROM generate_series(1, 70000)
                    """)
                .param(UUID.fromString(tenant))
                .update();
            String indexed = registerFile(tenant, false);
            embeddingStore.put(indexed, rows(2, "bulk"));

            List<PageEmbedding> candidates = embeddingStore.listCandidates(SearchScope.ofTenant(tenant));

            assertThat(candidates).extracting(PageEmbedding::fileId).containsOnly(indexed);
            assertThat(candidates).extracting(PageEmbedding::pageId).containsExactly(1, 2);
        }

        @Test
        @DisplayName("A tenant without files has no candidates")
        void shouldReturnEmptyForUnknownTenant() {
            assertThat(embeddingStore.listCandidates(SearchScope.ofTenant(UUID.randomUUID().toString()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deletion")
    class Deletion {

        @Test
        @DisplayName("Deleting a file removes its rows and leaves other files alone")
        void shouldDeleteOnlyTargetFile() {
            String other = UUID.randomUUID().toString();
            embeddingStore.put(fileId, rows(3, "mine"));
            embeddingStore.put(other, rows(2, "other"));

            int removed = embeddingStore.deleteByFile(fileId);

            assertThat(removed).isEqualTo(3);
            assertThat(embeddingStore.get(fileId)).isEmpty();
            assertThat(embeddingStore.get(other)).hasSize(2);
        }

        @Test
        @DisplayName("Deleting a file without embeddings is a no-op")
        void shouldTolerateMissingFile() {
            assertThat(embeddingStore.deleteByFile(UUID.randomUUID().toString())).isZero();
        }
    }

    private String registerFile(String tenantId, boolean deleted) {
        UUID id = UUID.randomUUID();
        jdbcClient.sql("INSERT INTO files (id, tenant_id, file_path, is_deleted) VALUES (?, ?, ?, ?)")
            .params(id, UUID.fromString(tenantId), "/tmp/" + id + ".pdf", deleted)
            .update();
        return id.toString();
    }

    private List<PageRow> rows(int count, String prefix) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> new PageRow(i, vector(i), prefix + " " + i))
            .toList();
    }

    private float[] vector(int seed) {
        float[] vector = new float[dimension];
        vector[seed % dimension] = 1f;
        vector[(seed * 7) % dimension] += 0.25f;
        return vector;
    }
}
