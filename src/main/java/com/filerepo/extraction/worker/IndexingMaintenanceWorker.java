package com.filerepo.extraction.worker;

import com.filerepo.extraction.config.IndexingProperties;
import com.filerepo.extraction.repository.IndexingRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Releases files whose indexing run stopped making progress, e.g. after an instance crash.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexingMaintenanceWorker {

    private final IndexingRunRepository runRepository;
    private final IndexingProperties properties;

    @Scheduled(fixedDelayString = "${app.indexing.maintenance-interval-ms:60000}")
    public void failAbandonedRuns() {
        log.debug("Starting maintenance: checking for abandoned indexing runs...");

        List<String> fileIds = runRepository.failStaleRuns(properties.staleThresholdMinutes());
        if (fileIds.isEmpty()) {
            return;
        }

        log.warn("Maintenance marked {} abandoned indexing runs as failed: {}", fileIds.size(), fileIds);
    }
}
