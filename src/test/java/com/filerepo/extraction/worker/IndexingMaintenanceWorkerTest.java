package com.filerepo.extraction.worker;

import com.filerepo.extraction.config.IndexingProperties;
import com.filerepo.extraction.repository.IndexingRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexingMaintenanceWorkerTest {

    @Mock
    private IndexingRunRepository runRepository;

    private IndexingMaintenanceWorker worker;

    @BeforeEach
    void setUp() {
        worker = new IndexingMaintenanceWorker(runRepository, new IndexingProperties(600L, true, 30));
    }

    @Test
    @DisplayName("Fails runs older than the configured stale threshold")
    void shouldFailStaleRunsUsingThreshold() {
        when(runRepository.failStaleRuns(30)).thenReturn(List.of("f1", "f2"));

        worker.failAbandonedRuns();

        verify(runRepository).failStaleRuns(30);
        verifyNoMoreInteractions(runRepository);
    }

    @Test
    @DisplayName("Does nothing else when no run is stale")
    void shouldDoNothingWhenNothingIsStale() {
        when(runRepository.failStaleRuns(30)).thenReturn(List.of());

        assertThatCode(worker::failAbandonedRuns).doesNotThrowAnyException();
        verify(runRepository, times(1)).failStaleRuns(30);
    }
}
