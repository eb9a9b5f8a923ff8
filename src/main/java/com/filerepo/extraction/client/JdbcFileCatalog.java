package com.filerepo.extraction.client;

import com.filerepo.extraction.exception.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the file service's {@code files} table. File and tenant ids are exposed as text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcFileCatalog implements FileCatalog {

    private final JdbcClient jdbcClient;

    @Value("${app.files.storage-root:}")
    private String storageRoot;

    @Override
    public byte[] getFileBytes(String fileId) {
        String storedPath = jdbcClient.sql("""
                SELECT file_path
                FROM files
                WHERE id::text = :fileId
                  AND is_deleted = FALSE
                """)
            .param("fileId", fileId)
            .query(String.class)
            .optional()
            .orElseThrow(() -> new EntityNotFoundException(fileId));

        Path path = resolve(storedPath);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.warn("File {} is registered but missing on disk at {}", fileId, path);
            throw new EntityNotFoundException(fileId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file " + fileId, e);
        }
    }

    @Override
    public boolean fileExists(String fileId) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM files WHERE id::text = :fileId AND is_deleted = FALSE)")
            .param("fileId", fileId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public List<String> listFilesForTenant(String tenantId) {
        return jdbcClient.sql("""
                SELECT id::text
                FROM files
                WHERE tenant_id::text = :tenantId
                  AND is_deleted = FALSE
                ORDER BY id
                """)
            .param("tenantId", tenantId)
            .query(String.class)
            .list();
    }

    @Override
    public boolean isOwnedBy(String tenantId, String fileId) {
        return jdbcClient.sql("""
                SELECT EXISTS (
                    SELECT 1 FROM files
                    WHERE id::text = :fileId
                      AND tenant_id::text = :tenantId
                      AND is_deleted = FALSE
                )
                """)
            .param("fileId", fileId)
            .param("tenantId", tenantId)
            .query(Boolean.class)
            .single();
    }

    private Path resolve(String storedPath) {
        if (storageRoot == null || storageRoot.isBlank()) {
            return Path.of(storedPath);
        }
        return Path.of(storageRoot).resolve(storedPath);
    }
}
