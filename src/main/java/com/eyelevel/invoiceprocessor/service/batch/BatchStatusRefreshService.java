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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Refreshes a small set of documents against the analysis provider on demand, with a bounded
 * number of provider calls in flight.
 */
@Slf4j
@Service
public class BatchStatusRefreshService {

    static final String REFRESH_FAILED = "Refresh failed";

    private final DocumentRecordRepository documentRecordRepository;
    private final AnalysisReconciliationService reconciliationService;
    private final AsyncTaskExecutor taskExecutor;
    private final InvoiceProcessingConfig processingConfig;

    public BatchStatusRefreshService(DocumentRecordRepository documentRecordRepository,
                                     AnalysisReconciliationService reconciliationService,
                                     @Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor,
                                     InvoiceProcessingConfig processingConfig) {
        this.documentRecordRepository = documentRecordRepository;
        this.reconciliationService = reconciliationService;
        this.taskExecutor = taskExecutor;
        this.processingConfig = processingConfig;
    }

    /**
     * Returns one result per distinct id, in request order.
     *
     * @throws ValidationException if no ids or more than the configured maximum are given, counting
     *                             repeated ids. Nothing is sent to the provider in that case.
     */
    public List<BatchRefreshResult> refresh(final String organisationId, final String locationId,
                                            final List<UUID> ids) {
        if (CollectionUtils.isEmpty(ids)) {
            throw new ValidationException(ErrorCode.EMPTY_BATCH, "At least one document id is required.");
        }
        final int maxIds = processingConfig.getBatchRefresh().getMaxIds();
        if (ids.size() > maxIds) {
            throw new ValidationException(ErrorCode.BATCH_TOO_LARGE,
                                          "At most " + maxIds + " documents can be refreshed at once.");
        }
        final Set<UUID> requested = new LinkedHashSet<>(ids);

        final Map<UUID, DocumentRecord> records = documentRecordRepository
                .findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(requested, organisationId, locationId)
                .stream()
                .collect(Collectors.toMap(DocumentRecord::getId, Function.identity()));

        final Semaphore permits = new Semaphore(processingConfig.getBatchRefresh().getConcurrency());
        final Map<UUID, CompletableFuture<BatchRefreshResult>> pending = new LinkedHashMap<>();
        boolean interrupted = false;
        for (UUID id : requested) {
            final DocumentRecord record = records.get(id);
            if (record == null) {
                pending.put(id, CompletableFuture.completedFuture(BatchRefreshResult.notFound(id)));
            } else if (record.getProcessingStatus() != ProcessingStatus.ANALYZING
                    || record.getAnalysisJobId() == null) {
                pending.put(id, CompletableFuture.completedFuture(
                        new BatchRefreshResult(id, BatchRefreshAction.SKIPPED_NOT_PROCESSING,
                                               record.getProcessingStatus(), record.getReviewStatus(), null)));
            } else if (interrupted) {
                pending.put(id, CompletableFuture.completedFuture(BatchRefreshResult.error(id, REFRESH_FAILED)));
            } else {
                try {
                    permits.acquire();
                    pending.put(id, CompletableFuture.supplyAsync(() -> refreshOne(id, permits), taskExecutor));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    pending.put(id, CompletableFuture.completedFuture(BatchRefreshResult.error(id, REFRESH_FAILED)));
                } catch (RuntimeException e) {
                    permits.release();
                    log.error("Could not schedule refresh of document {}.", id, e);
                    pending.put(id, CompletableFuture.completedFuture(BatchRefreshResult.error(id, REFRESH_FAILED)));
                }
            }
        }

        final List<BatchRefreshResult> results = new ArrayList<>(pending.size());
        pending.forEach((id, future) -> results.add(future.exceptionally(ex -> {
            log.error("Batch refresh of document {} failed.", id, ex);
            return BatchRefreshResult.error(id, REFRESH_FAILED);
        }).join()));
        log.info("Batch refresh for organisation {}, location {}: {} document(s).", organisationId, locationId,
                 results.size());
        return results;
    }

    private BatchRefreshResult refreshOne(final UUID id, final Semaphore permits) {
        try {
            final ReconciliationOutcome outcome = reconciliationService.reconcile(id);
            if (outcome == ReconciliationOutcome.PROVIDER_ERROR) {
                return BatchRefreshResult.error(id, REFRESH_FAILED);
            }
            return documentRecordRepository.findById(id)
                                           .map(r -> new BatchRefreshResult(id, BatchRefreshAction.CHECKED,
                                                                            r.getProcessingStatus(),
                                                                            r.getReviewStatus(), null))
                                           .orElseGet(() -> BatchRefreshResult.notFound(id));
        } catch (RuntimeException e) {
            log.error("Batch refresh of document {} failed.", id, e);
            return BatchRefreshResult.error(id, REFRESH_FAILED);
        } finally {
            permits.release();
        }
    }
}
