package com.eyelevel.invoiceprocessor.service.janitor;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStarter;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisStartOutcome;
import com.eyelevel.invoiceprocessor.service.document.DocumentRecordAtomicService;
import com.eyelevel.invoiceprocessor.support.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StuckJobJanitorServiceTest {

    @Mock
    private DocumentRecordRepository repository;
    @Mock
    private DocumentRecordAtomicService atomicService;
    @Mock
    private AnalysisJobStarter starter;

    private StuckJobJanitorService janitor;

    @BeforeEach
    void setUp() {
        janitor = new StuckJobJanitorService(repository, atomicService, starter, new InvoiceProcessingConfig());
        lenient().when(repository.findStaleIds(eq(ProcessingStatus.ANALYZING), any())).thenReturn(List.of());
        lenient().when(repository.findRetryableFailedIds(any(), anyInt())).thenReturn(List.of());
        lenient().when(repository.findStaleIds(eq(ProcessingStatus.PENDING_ANALYSIS), any())).thenReturn(List.of());
    }

    @Test
    void everyBucketIsHandled() {
        final UUID stuck = UUID.randomUUID();
        final UUID failed = UUID.randomUUID();
        final DocumentRecord pending = TestDocuments.record(ProcessingStatus.PENDING_ANALYSIS);
        pending.setAttemptCount(1);
        when(repository.findStaleIds(eq(ProcessingStatus.ANALYZING), any())).thenReturn(List.of(stuck));
        when(repository.findRetryableFailedIds(any(), eq(3))).thenReturn(List.of(failed));
        when(repository.findStaleIds(eq(ProcessingStatus.PENDING_ANALYSIS), any()))
                .thenReturn(List.of(pending.getId()));
        when(atomicService.failStuckAnalysis(eq(stuck), any())).thenReturn(true);
        when(atomicService.requeueFailed(eq(failed), any())).thenReturn(true);
        when(atomicService.findLive(pending.getId())).thenReturn(Optional.of(pending));
        when(starter.restartStalePending(pending.getId())).thenReturn(AnalysisStartOutcome.started("job-2"));

        final JanitorRunSummary summary = janitor.runJanitorPass();

        assertThat(summary).isEqualTo(new JanitorRunSummary(1, 1, 1, 1, 1, 1, 0, 0));
    }

    @Test
    void pendingRecordWithoutAttemptsLeftIsFailedInsteadOfStarted() {
        final DocumentRecord pending = TestDocuments.record(ProcessingStatus.PENDING_ANALYSIS);
        pending.setAttemptCount(3);
        when(repository.findStaleIds(eq(ProcessingStatus.PENDING_ANALYSIS), any()))
                .thenReturn(List.of(pending.getId()));
        when(atomicService.findLive(pending.getId())).thenReturn(Optional.of(pending));
        when(atomicService.failExhaustedPending(eq(pending.getId()), any())).thenReturn(true);

        final JanitorRunSummary summary = janitor.runJanitorPass();

        assertThat(summary.stuckPendingFailed()).isEqualTo(1);
        verify(starter, never()).restartStalePending(any());
    }

    @Test
    void failureOnOneRecordDoesNotStopThePass() {
        final UUID broken = UUID.randomUUID();
        final UUID healthy = UUID.randomUUID();
        when(repository.findStaleIds(eq(ProcessingStatus.ANALYZING), any())).thenReturn(List.of(broken, healthy));
        when(atomicService.failStuckAnalysis(eq(broken), any())).thenThrow(new IllegalStateException("db down"));
        when(atomicService.failStuckAnalysis(eq(healthy), any())).thenReturn(true);

        final JanitorRunSummary summary = janitor.runJanitorPass();

        assertThat(summary.stuckAnalyzingFailed()).isEqualTo(1);
        assertThat(summary.errors()).isEqualTo(1);
    }

    @Test
    void allBucketsAreSelectedWithTheSameCutoff() {
        janitor.runJanitorPass();

        final ArgumentCaptor<LocalDateTime> analysing = ArgumentCaptor.forClass(LocalDateTime.class);
        final ArgumentCaptor<LocalDateTime> failed = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(repository).findStaleIds(eq(ProcessingStatus.ANALYZING), analysing.capture());
        verify(repository).findRetryableFailedIds(failed.capture(), eq(3));
        assertThat(failed.getValue()).isEqualTo(analysing.getValue());
        assertThat(analysing.getValue()).isBefore(LocalDateTime.now().minusMinutes(9));
    }
}
