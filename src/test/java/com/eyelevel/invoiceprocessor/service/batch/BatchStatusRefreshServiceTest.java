package com.eyelevel.invoiceprocessor.service.batch;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.dto.batch.BatchRefreshAction;
import com.eyelevel.invoiceprocessor.dto.batch.BatchRefreshResult;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.reconciliation.AnalysisReconciliationService;
import com.eyelevel.invoiceprocessor.service.reconciliation.ReconciliationOutcome;
import com.eyelevel.invoiceprocessor.support.TestDocuments;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchStatusRefreshServiceTest {

    @Mock
    private DocumentRecordRepository documentRecordRepository;
    @Mock
    private AnalysisReconciliationService reconciliationService;

    private ThreadPoolTaskExecutor executor;
    private BatchStatusRefreshService service;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(16);
        executor.setThreadNamePrefix("batch-test-");
        executor.initialize();
        service = new BatchStatusRefreshService(documentRecordRepository, reconciliationService, executor,
                                                new InvoiceProcessingConfig());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void moreThanTwentyIdsAreRejectedBeforeAnyProviderCall() {
        final List<UUID> ids = IntStream.range(0, 21).mapToObj(i -> UUID.randomUUID()).toList();

        assertThatThrownBy(() -> service.refresh(TestDocuments.ORG, TestDocuments.LOCATION, ids))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BATCH_TOO_LARGE);

        verifyNoInteractions(reconciliationService, documentRecordRepository);
    }

    @Test
    void emptyBatchIsRejected() {
        assertThatThrownBy(() -> service.refresh(TestDocuments.ORG, TestDocuments.LOCATION, List.of()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.EMPTY_BATCH);
    }

    @Test
    void repeatedIdsCountTowardsTheSizeLimit() {
        final UUID id = UUID.randomUUID();
        final List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            ids.add(id);
        }

        assertThatThrownBy(() -> service.refresh(TestDocuments.ORG, TestDocuments.LOCATION, ids))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.BATCH_TOO_LARGE);

        verifyNoInteractions(reconciliationService, documentRecordRepository);
    }

    @Test
    void duplicatesWithinTheLimitYieldOneResultPerId() {
        final UUID id = UUID.randomUUID();
        final List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ids.add(id);
        }
        when(documentRecordRepository.findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(
                anyCollection(), eq(TestDocuments.ORG), eq(TestDocuments.LOCATION))).thenReturn(List.of());

        assertThat(service.refresh(TestDocuments.ORG, TestDocuments.LOCATION, ids))
                .singleElement()
                .extracting(BatchRefreshResult::action)
                .isEqualTo(BatchRefreshAction.SKIPPED_NOT_FOUND);
    }

    @Test
    void resultsFollowRequestOrderWithPerIdOutcomes() {
        final DocumentRecord analysing = TestDocuments.analysing("job-1");
        final DocumentRecord complete = TestDocuments.record(ProcessingStatus.ANALYSIS_COMPLETE);
        final DocumentRecord broken = TestDocuments.analysing("job-2");
        final UUID missing = UUID.randomUUID();
        when(documentRecordRepository.findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(
                anyCollection(), eq(TestDocuments.ORG), eq(TestDocuments.LOCATION)))
                .thenReturn(List.of(broken, complete, analysing));
        when(reconciliationService.reconcile(analysing.getId())).thenAnswer(invocation -> {
            analysing.setProcessingStatus(ProcessingStatus.ANALYSIS_COMPLETE);
            return ReconciliationOutcome.COMPLETED;
        });
        when(documentRecordRepository.findById(analysing.getId())).thenReturn(Optional.of(analysing));
        when(reconciliationService.reconcile(broken.getId())).thenThrow(new IllegalStateException("boom"));

        final List<BatchRefreshResult> results = service.refresh(
                TestDocuments.ORG, TestDocuments.LOCATION,
                List.of(missing, analysing.getId(), complete.getId(), broken.getId()));

        assertThat(results).extracting(BatchRefreshResult::id)
                           .containsExactly(missing, analysing.getId(), complete.getId(), broken.getId());
        assertThat(results).extracting(BatchRefreshResult::action)
                           .containsExactly(BatchRefreshAction.SKIPPED_NOT_FOUND, BatchRefreshAction.CHECKED,
                                            BatchRefreshAction.SKIPPED_NOT_PROCESSING, BatchRefreshAction.ERROR);
        assertThat(results.get(1).processingStatus()).isEqualTo(ProcessingStatus.ANALYSIS_COMPLETE);
        assertThat(results.get(3).message()).isEqualTo(BatchStatusRefreshService.REFRESH_FAILED);
        verify(reconciliationService, never()).reconcile(complete.getId());
    }

    @Test
    void providerErrorIsReportedAsError() {
        final DocumentRecord analysing = TestDocuments.analysing("job-1");
        when(documentRecordRepository.findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(
                anyCollection(), eq(TestDocuments.ORG), eq(TestDocuments.LOCATION))).thenReturn(List.of(analysing));
        when(reconciliationService.reconcile(analysing.getId())).thenReturn(ReconciliationOutcome.PROVIDER_ERROR);

        assertThat(service.refresh(TestDocuments.ORG, TestDocuments.LOCATION, List.of(analysing.getId())))
                .singleElement()
                .extracting(BatchRefreshResult::action)
                .isEqualTo(BatchRefreshAction.ERROR);
    }

    @Test
    void noMoreThanFiveProviderCallsRunAtOnce() {
        final List<DocumentRecord> records = IntStream.range(0, 20)
                                                      .mapToObj(i -> TestDocuments.analysing("job-" + i))
                                                      .toList();
        when(documentRecordRepository.findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(
                anyCollection(), eq(TestDocuments.ORG), eq(TestDocuments.LOCATION))).thenReturn(records);
        records.forEach(r -> lenient().when(documentRecordRepository.findById(r.getId())).thenReturn(Optional.of(r)));

        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        when(reconciliationService.reconcile(any(UUID.class))).thenAnswer(invocation -> {
            final int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return ReconciliationOutcome.STILL_RUNNING;
        });

        final List<BatchRefreshResult> results = service.refresh(TestDocuments.ORG, TestDocuments.LOCATION,
                                                                 records.stream().map(DocumentRecord::getId).toList());

        assertThat(results).hasSize(20).allMatch(r -> r.action() == BatchRefreshAction.CHECKED);
        assertThat(maxInFlight.get()).isBetween(1, 5);
    }
}
